package com.hybridrouter.infrastructure.prompt;

import java.util.HashMap;
import java.util.Map;

/**
 * Immutable trial counts and reward sums per (category key, variant).
 */
public record VariantSnapshot(
        Map<String, Map<String, VariantStats>> stats
) {
    public static final VariantSnapshot EMPTY = new VariantSnapshot(Map.of());

    public VariantSnapshot {
        Map<String, Map<String, VariantStats>> frozen = new HashMap<>();
        stats.forEach((k, v) -> frozen.put(k, Map.copyOf(v)));
        stats = Map.copyOf(frozen);
    }

    public VariantStats get(String key, String variant) {
        return stats.getOrDefault(key, Map.of()).getOrDefault(variant, VariantStats.NONE);
    }

    public VariantSnapshot with(String key, String variant, double reward) {
        Map<String, Map<String, VariantStats>> work = new HashMap<>();
        stats.forEach((k, v) -> work.put(k, new HashMap<>(v)));
        work.computeIfAbsent(key, k -> new HashMap<>())
                .merge(variant, VariantStats.NONE.plus(reward), (old, ignored) -> old.plus(reward));
        return new VariantSnapshot(work);
    }
}
