package com.hybridrouter.infrastructure.prompt;

import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.infrastructure.config.RouterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Epsilon-greedy choice among the curated variants of a category.
 */
@Slf4j
@Component
public class PromptVariantSelector {

    private final PromptVariantRegistry registry;
    private final Random random;
    private final double epsilon;
    private final int minTrials;
    private final AtomicReference<VariantSnapshot> snapshot = new AtomicReference<>(VariantSnapshot.EMPTY);

    public PromptVariantSelector(PromptVariantRegistry registry, RouterProperties properties, Random random) {
        this.registry = registry;
        this.random = random;
        this.epsilon = properties.getPrompter().getEpsilon();
        this.minTrials = properties.getPrompter().getMinTrials();
    }

    /**
     * @param explore false while exploration is frozen; no epsilon draw is made
     */
    public String selectVariant(String category, boolean explore) {
        String key = registry.resolveKey(category);
        List<String> candidates = registry.variantsFor(key);

        if (explore && candidates.size() > 1 && random.nextDouble() < epsilon) {
            return candidates.get(random.nextInt(candidates.size()));
        }
        return best(key, candidates);
    }

    private String best(String key, List<String> candidates) {
        VariantSnapshot current = snapshot.get();
        String best = null;
        double bestMean = Double.NEGATIVE_INFINITY;
        for (String variant : candidates) {
            VariantStats stats = current.get(key, variant);
            if (stats.trials() >= minTrials && stats.mean() > bestMean) {
                bestMean = stats.mean();
                best = variant;
            }
        }
        return best != null ? best : candidates.get(0);
    }

    public void update(String category, String variant, double reward) {
        String key = registry.resolveKey(category);
        snapshot.updateAndGet(s -> s.with(key, variant, reward));
    }

    public VariantSnapshot rebuild(Collection<RewardSample> samples) {
        Map<String, Map<String, VariantStats>> work = new HashMap<>();
        for (RewardSample s : samples) {
            work.computeIfAbsent(registry.resolveKey(s.category()), k -> new HashMap<>())
                    .merge(s.promptVariant(), VariantStats.NONE.plus(s.reward()), (old, ignored) -> old.plus(s.reward()));
        }
        VariantSnapshot fresh = new VariantSnapshot(work);
        snapshot.set(fresh);
        log.info("[Prompter] Rebuilt variant statistics for {} categories", work.size());
        return fresh;
    }

    public VariantSnapshot snapshot() {
        return snapshot.get();
    }
}
