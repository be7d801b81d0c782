package com.hybridrouter.infrastructure.bandit;

import com.hybridrouter.domain.quality.model.RewardSample;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable posteriors per (bucket key, provider id). Writers build a new snapshot and swap it in.
 */
public final class BanditSnapshot {

    private static final BanditSnapshot EMPTY = new BanditSnapshot(Map.of(), 0, Instant.EPOCH);

    private final Map<String, Map<String, BetaPosterior>> posteriors;
    private final long version;
    private final Instant builtAt;

    private BanditSnapshot(Map<String, Map<String, BetaPosterior>> posteriors, long version, Instant builtAt) {
        this.posteriors = posteriors;
        this.version = version;
        this.builtAt = builtAt;
    }

    public static BanditSnapshot empty() {
        return EMPTY;
    }

    public static BanditSnapshot of(Collection<RewardSample> samples, long version, Instant builtAt) {
        Map<String, Map<String, BetaPosterior>> work = new HashMap<>();
        for (RewardSample s : samples) {
            work.computeIfAbsent(s.bucket().key(), k -> new HashMap<>())
                    .merge(s.provider(), BetaPosterior.prior().plus(s.reward()),
                            (old, ignored) -> old.plus(s.reward()));
        }
        return new BanditSnapshot(freeze(work), version, builtAt);
    }

    public BanditSnapshot with(String bucketKey, String provider, double reward, Instant at) {
        Map<String, Map<String, BetaPosterior>> work = new HashMap<>();
        posteriors.forEach((k, v) -> work.put(k, new HashMap<>(v)));
        work.computeIfAbsent(bucketKey, k -> new HashMap<>())
                .merge(provider, BetaPosterior.prior().plus(reward), (old, ignored) -> old.plus(reward));
        return new BanditSnapshot(freeze(work), version + 1, at);
    }

    private static Map<String, Map<String, BetaPosterior>> freeze(Map<String, Map<String, BetaPosterior>> work) {
        Map<String, Map<String, BetaPosterior>> frozen = new HashMap<>();
        work.forEach((k, v) -> frozen.put(k, Map.copyOf(v)));
        return Map.copyOf(frozen);
    }

    public BetaPosterior posterior(String bucketKey, String provider) {
        return posteriors.getOrDefault(bucketKey, Map.of()).getOrDefault(provider, BetaPosterior.prior());
    }

    public long bucketSamples(String bucketKey) {
        return posteriors.getOrDefault(bucketKey, Map.of()).values().stream()
                .mapToLong(BetaPosterior::samples)
                .sum();
    }

    public Map<String, Map<String, BetaPosterior>> posteriors() {
        return posteriors;
    }

    public long version() {
        return version;
    }

    public Instant builtAt() {
        return builtAt;
    }
}
