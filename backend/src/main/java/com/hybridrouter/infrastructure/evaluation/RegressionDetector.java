package com.hybridrouter.infrastructure.evaluation;

import com.hybridrouter.domain.quality.model.QualityWindow;
import com.hybridrouter.domain.quality.model.QualityWindow.SubjectType;
import com.hybridrouter.domain.quality.model.RegressionFinding;
import com.hybridrouter.domain.quality.model.RegressionFinding.Metric;
import com.hybridrouter.domain.quality.model.RegressionReport;
import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.infrastructure.config.RouterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Compares the recent half of the trailing window against the older half, per provider and per
 * (category, variant). A drop is flagged only when it is significant, material and adequately sampled.
 */
@Slf4j
@Component
public class RegressionDetector {

    private final double alpha;
    private final double minEffect;
    private final int minSamples;
    private final int windowDays;

    public RegressionDetector(RouterProperties properties) {
        RouterProperties.Regression config = properties.getEvaluator().getRegression();
        this.alpha = config.getAlpha();
        this.minEffect = config.getMinEffect();
        this.minSamples = config.getMinSamples();
        this.windowDays = config.getWindowDays();
    }

    public Duration window() {
        return Duration.ofDays(windowDays);
    }

    /**
     * Splits the samples decided within the trailing window at its midpoint and tests every subject.
     */
    public RegressionReport checkRegression(Collection<RewardSample> samples, Instant now) {
        Instant start = now.minus(window());
        Instant mid = now.minus(window().dividedBy(2));

        List<QualityWindow> windows = new ArrayList<>();
        windows.addAll(split(samples, SubjectType.PROVIDER, RewardSample::provider, start, mid, now));
        windows.addAll(split(samples, SubjectType.VARIANT, s -> s.category() + "/" + s.promptVariant(), start, mid, now));

        List<RegressionFinding> findings = new ArrayList<>();
        for (QualityWindow w : windows) {
            findings.addAll(checkRegression(w));
        }
        RegressionReport report = new RegressionReport(findings, now);
        if (report.regressionDetected()) {
            log.warn("[Evaluator] Regression detected: {}", report.summary());
        } else {
            log.info("[Evaluator] {}", report.summary());
        }
        return report;
    }

    private static List<QualityWindow> split(Collection<RewardSample> samples, SubjectType type,
                                             Function<RewardSample, String> subjectOf,
                                             Instant start, Instant mid, Instant end) {
        Map<String, List<RewardSample>> recent = new TreeMap<>();
        Map<String, List<RewardSample>> baseline = new TreeMap<>();
        for (RewardSample s : samples) {
            Instant t = s.decidedAt();
            if (t.isBefore(start) || t.isAfter(end)) continue;
            String subject = subjectOf.apply(s);
            if (t.isBefore(mid)) {
                baseline.computeIfAbsent(subject, k -> new ArrayList<>()).add(s);
            } else {
                recent.computeIfAbsent(subject, k -> new ArrayList<>()).add(s);
            }
        }
        List<QualityWindow> windows = new ArrayList<>();
        baseline.forEach((subject, base) -> {
            List<RewardSample> rec = recent.get(subject);
            if (rec != null) {
                windows.add(new QualityWindow(type, subject, rec, base));
            }
        });
        return windows;
    }

    /**
     * Tests pass rate and mean reward of one subject. Empty halves produce no findings.
     */
    public List<RegressionFinding> checkRegression(QualityWindow window) {
        List<RewardSample> base = window.baseline();
        List<RewardSample> rec = window.recent();
        if (base.isEmpty() || rec.isEmpty()) {
            return List.of();
        }

        int basePassed = QualityWindow.passed(base);
        int recPassed = QualityWindow.passed(rec);
        double baseRate = (double) basePassed / base.size();
        double recRate = (double) recPassed / rec.size();
        double passP = StatisticalTests.proportionDropPValue(basePassed, base.size(), recPassed, rec.size());

        double baseMean = QualityWindow.mean(base);
        double recMean = QualityWindow.mean(rec);
        double meanP = StatisticalTests.meanDropPValue(baseMean, QualityWindow.variance(base), base.size(),
                recMean, QualityWindow.variance(rec), rec.size());

        return List.of(
                finding(window, Metric.PASS_RATE, baseRate, recRate, passP),
                finding(window, Metric.MEAN_REWARD, baseMean, recMean, meanP));
    }

    private RegressionFinding finding(QualityWindow window, Metric metric,
                                      double baselineValue, double recentValue, double pValue) {
        int baseSize = window.baseline().size();
        int recSize = window.recent().size();
        double effect = baselineValue - recentValue;

        boolean sampled = baseSize >= minSamples && recSize >= minSamples;
        boolean significant = pValue < alpha;
        boolean material = effect >= minEffect;

        String note;
        if (!sampled) {
            note = "insufficient samples (min " + minSamples + ")";
        } else if (!significant) {
            note = "not significant";
        } else if (!material) {
            note = "below effect floor " + minEffect;
        } else {
            note = "regression";
        }
        return new RegressionFinding(window.subjectType(), window.subject(), metric, baselineValue, recentValue,
                baseSize, recSize, effect, pValue, sampled && significant && material, note);
    }
}
