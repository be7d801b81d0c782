package com.hybridrouter.infrastructure.evaluation;

import com.hybridrouter.domain.quality.model.QualityWindow;
import com.hybridrouter.domain.quality.model.RegressionFinding;
import com.hybridrouter.domain.quality.model.RegressionReport;
import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.support.RouterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.hybridrouter.support.RouterFixtures.FI_CRITICAL_HIGH;
import static com.hybridrouter.support.RouterFixtures.STANDARD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RegressionDetectorTest {

    private static final Instant NOW = Instant.parse("2026-06-15T03:30:00Z");
    private static final Instant BASELINE_AT = NOW.minus(Duration.ofDays(10));
    private static final Instant RECENT_AT = NOW.minus(Duration.ofDays(2));

    private RegressionDetector detector;

    @BeforeEach
    void setUp() {
        detector = new RegressionDetector(RouterFixtures.properties());
    }

    /**
     * {@code n} samples of which the first {@code round(passRate * n)} passed validation.
     */
    private static List<RewardSample> samples(String provider, double passRate, int n, Instant decidedAt, String prefix) {
        int passing = (int) Math.round(passRate * n);
        List<RewardSample> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            boolean passed = i < passing;
            list.add(RouterFixtures.sample(prefix + i, FI_CRITICAL_HIGH, provider, passed ? 0.8 : 0.2, passed, decidedAt));
        }
        return list;
    }

    private RegressionReport check(double baselineRate, double recentRate, int n) {
        List<RewardSample> all = new ArrayList<>();
        all.addAll(samples(STANDARD, baselineRate, n, BASELINE_AT, "b"));
        all.addAll(samples(STANDARD, recentRate, n, RECENT_AT, "r"));
        return detector.checkRegression(all, NOW);
    }

    private static RegressionFinding finding(RegressionReport report, QualityWindow.SubjectType type,
                                             RegressionFinding.Metric metric) {
        return report.findings().stream()
                .filter(f -> f.subjectType() == type && f.metric() == metric)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("95% -> 70% pass rate over 200 samples per half is flagged")
    void large_drop_is_flagged() {
        RegressionReport report = check(0.95, 0.70, 200);

        assertThat(report.regressionDetected()).isTrue();
        RegressionFinding passRate = finding(report, QualityWindow.SubjectType.PROVIDER, RegressionFinding.Metric.PASS_RATE);
        assertThat(passRate.subject()).isEqualTo(STANDARD);
        assertThat(passRate.flagged()).isTrue();
        assertThat(passRate.pValue()).isLessThan(0.05);
        assertThat(passRate.effectSize()).isCloseTo(0.25, within(1e-9));
        assertThat(finding(report, QualityWindow.SubjectType.VARIANT, RegressionFinding.Metric.PASS_RATE).subject())
                .isEqualTo("politics/politics_v1");
        assertThat(report.summary()).contains("regression");
    }

    @Test
    @DisplayName("Same drop over 5 samples per half is not flagged")
    void small_samples_are_not_flagged() {
        RegressionReport report = check(1.0, 0.6, 5);

        assertThat(report.regressionDetected()).isFalse();
        assertThat(report.findings()).allSatisfy(f -> assertThat(f.note()).startsWith("insufficient samples"));
    }

    @Test
    @DisplayName("Significant but immaterial drop (95% -> 94% at n=20000) is not flagged")
    void tiny_effect_is_not_flagged_despite_significance() {
        RegressionReport report = check(0.95, 0.94, 20000);

        RegressionFinding passRate = finding(report, QualityWindow.SubjectType.PROVIDER, RegressionFinding.Metric.PASS_RATE);
        assertThat(passRate.pValue()).isLessThan(0.05);
        assertThat(passRate.flagged()).isFalse();
        assertThat(passRate.note()).startsWith("below effect floor");
        assertThat(report.regressionDetected()).isFalse();
    }

    @Test
    void stable_quality_is_not_flagged() {
        RegressionReport report = check(0.9, 0.9, 200);

        assertThat(report.regressionDetected()).isFalse();
        assertThat(report.findings()).hasSize(4);
    }

    @Test
    void improvement_is_not_flagged() {
        RegressionReport report = check(0.7, 0.95, 200);

        assertThat(report.regressionDetected()).isFalse();
        assertThat(finding(report, QualityWindow.SubjectType.PROVIDER, RegressionFinding.Metric.PASS_RATE).effectSize())
                .isNegative();
    }

    @Test
    void samples_outside_window_are_ignored() {
        List<RewardSample> all = new ArrayList<>();
        all.addAll(samples(STANDARD, 1.0, 200, NOW.minus(Duration.ofDays(30)), "old"));
        all.addAll(samples(STANDARD, 0.5, 200, RECENT_AT, "r"));

        RegressionReport report = detector.checkRegression(all, NOW);

        assertThat(report.findings()).isEmpty();
        assertThat(report.regressionDetected()).isFalse();
    }
}
