package com.hybridrouter.domain.quality.model;

import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.routing.model.ContextBucket;

import java.time.Instant;
import java.util.Set;

/**
 * Scalar quality observation attributed to one past routing decision.
 *
 * @param contentId        content the decision was made for
 * @param bucket           bandit bucket of the decision
 * @param provider         provider that served the request
 * @param category         topic category, keys the prompt variant statistics
 * @param promptVariant    prompt variant used
 * @param reward           reward in [0,1]
 * @param validationPassed whether the generated item passed validation
 * @param sources          feedback sources that contributed to the reward
 * @param decidedAt        when the decision was made
 * @param scoredAt         when the reward was computed
 */
public record RewardSample(
        String contentId,
        ContextBucket bucket,
        String provider,
        String category,
        String promptVariant,
        double reward,
        boolean validationPassed,
        Set<FeedbackSource> sources,
        Instant decidedAt,
        Instant scoredAt
) {
    public RewardSample {
        if (Double.isNaN(reward) || reward < 0.0 || reward > 1.0) {
            throw new IllegalArgumentException("Reward must be in [0,1]: " + reward);
        }
        sources = sources == null ? Set.of() : Set.copyOf(sources);
    }
}
