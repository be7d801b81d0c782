package com.hybridrouter.domain.feedback.model;

/**
 * Editor decision on a generated item.
 *
 * @param accepted  whether the item was published
 * @param editRatio fraction of the text the editor changed, in [0,1]
 */
public record EditorialSignal(
        boolean accepted,
        double editRatio
) {
    public double score() {
        if (!accepted) {
            return 0.0;
        }
        double edits = Math.min(1.0, Math.max(0.0, editRatio));
        return 1.0 - 0.5 * edits;
    }
}
