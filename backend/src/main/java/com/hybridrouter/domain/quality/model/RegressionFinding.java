package com.hybridrouter.domain.quality.model;

/**
 * Outcome of one regression test for one subject and metric. Kept for operator review
 * whether or not it was flagged.
 *
 * @param subjectType   provider or variant
 * @param subject       provider id, or {@code category/variant}
 * @param metric        which quality metric was compared
 * @param baselineValue metric value in the baseline half
 * @param recentValue   metric value in the recent half
 * @param baselineSize  number of baseline samples
 * @param recentSize    number of recent samples
 * @param effectSize    absolute drop (baseline - recent); negative means improvement
 * @param pValue        one-sided p-value of the drop
 * @param flagged       true only if significant, material and adequately sampled
 * @param note          why the finding was or was not flagged
 */
public record RegressionFinding(
        QualityWindow.SubjectType subjectType,
        String subject,
        Metric metric,
        double baselineValue,
        double recentValue,
        int baselineSize,
        int recentSize,
        double effectSize,
        double pValue,
        boolean flagged,
        String note
) {
    public enum Metric {
        PASS_RATE,
        MEAN_REWARD
    }

    public String describe() {
        return String.format("%s %s %s: %.3f -> %.3f (n=%d/%d, effect=%.3f, p=%.4f) %s",
                subjectType, subject, metric, baselineValue, recentValue,
                baselineSize, recentSize, effectSize, pValue, note);
    }
}
