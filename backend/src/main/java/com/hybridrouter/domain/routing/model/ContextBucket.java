package com.hybridrouter.domain.routing.model;

import java.util.Locale;

/**
 * Coarse grouping of request contexts that keys the bandit posteriors.
 */
public record ContextBucket(
        String language,
        boolean critical,
        ComplexityTier complexity
) {
    private static final String SEPARATOR = "|";

    public String key() {
        return language + SEPARATOR + (critical ? "critical" : "routine") + SEPARATOR
                + complexity.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Inverse of {@link #key()}, used when reading attributions back from the reward log.
     */
    public static ContextBucket parse(String key) {
        String[] parts = key.split("\\|");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed bucket key: " + key);
        }
        return new ContextBucket(
                parts[0],
                "critical".equals(parts[1]),
                ComplexityTier.valueOf(parts[2].toUpperCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return key();
    }
}
