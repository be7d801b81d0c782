package com.hybridrouter.domain.feedback.model;

/**
 * Reader interaction with a published item.
 */
public record EngagementSignal(
        int clicks,
        double timeOnCardSeconds,
        int shares
) {
    private static final double FULL_ATTENTION_SECONDS = 60.0;
    private static final double SHARE_BONUS = 0.2;

    /**
     * Engagement in [0,1]: a click weighted by attention time, plus a bonus for sharing.
     */
    public double score() {
        if (clicks <= 0) {
            return 0.0;
        }
        double attention = Math.min(1.0, Math.max(0.0, timeOnCardSeconds) / FULL_ATTENTION_SECONDS);
        double bonus = shares > 0 ? SHARE_BONUS : 0.0;
        return Math.min(1.0, attention + bonus);
    }
}
