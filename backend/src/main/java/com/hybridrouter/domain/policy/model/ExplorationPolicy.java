package com.hybridrouter.domain.policy.model;

import java.time.Instant;

/**
 * Whether the bandit and prompter may explore. Frozen after a detected regression.
 */
public record ExplorationPolicy(
        ExplorationMode mode,
        String reason,
        Instant since
) {
    public static ExplorationPolicy active(Instant since) {
        return new ExplorationPolicy(ExplorationMode.ACTIVE, "initial", since);
    }

    public boolean frozen() {
        return mode == ExplorationMode.FROZEN;
    }
}
