package com.hybridrouter.infrastructure.bandit;

import com.hybridrouter.domain.quality.model.RewardSample;
import com.hybridrouter.domain.routing.model.ContextBucket;
import com.hybridrouter.domain.routing.model.Provider;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.routing.ProviderCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thompson-sampling bandit over providers, one Beta posterior per (bucket, provider).
 * Readers take the current snapshot without locking; updates and rebuilds swap a new one in.
 */
@Slf4j
@Component
public class ThompsonBandit {

    private final ProviderCatalog catalog;
    private final Random random;
    private final Clock clock;
    private final int minSamples;
    private final AtomicReference<BanditSnapshot> snapshot = new AtomicReference<>(BanditSnapshot.empty());
    private final AtomicLong versions = new AtomicLong();

    public ThompsonBandit(ProviderCatalog catalog, RouterProperties properties, Random random, Clock clock) {
        this.catalog = catalog;
        this.random = random;
        this.clock = clock;
        this.minSamples = properties.getBandit().getMinSamples();
    }

    public boolean isColdStart(ContextBucket bucket) {
        return snapshot.get().bucketSamples(bucket.key()) < minSamples;
    }

    /**
     * Draws once from every provider's posterior and returns the arm with the highest draw.
     * Premium draws are multiplied by {@code premiumScale} (1.0 = unbiased).
     * A cold bucket always gets the safe provider.
     */
    public Provider recommend(ContextBucket bucket, double premiumScale) {
        BanditSnapshot current = snapshot.get();
        if (current.bucketSamples(bucket.key()) < minSamples) {
            return catalog.safe();
        }

        Provider best = null;
        double bestDraw = Double.NEGATIVE_INFINITY;
        for (Provider provider : catalog.all()) {
            BetaPosterior posterior = current.posterior(bucket.key(), provider.id());
            double draw = BetaSampler.sample(posterior.alpha(), posterior.beta(), random);
            if (provider.isPremium()) {
                draw *= premiumScale;
            }
            if (draw > bestDraw) {
                bestDraw = draw;
                best = provider;
            }
        }
        return best;
    }

    /**
     * Arm with the best posterior mean; ties go to the cheaper provider. Cold start still applies.
     */
    public Provider exploit(ContextBucket bucket) {
        BanditSnapshot current = snapshot.get();
        if (current.bucketSamples(bucket.key()) < minSamples) {
            return catalog.safe();
        }
        Comparator<Provider> byMean = Comparator.comparingDouble(
                p -> current.posterior(bucket.key(), p.id()).mean());
        return catalog.all().stream()
                .max(byMean.thenComparing(Provider::estimatedCost, Comparator.reverseOrder()))
                .orElse(catalog.safe());
    }

    public void update(RewardSample sample) {
        snapshot.updateAndGet(s -> s.with(sample.bucket().key(), sample.provider(), sample.reward(), clock.instant()));
    }

    /**
     * Replaces the posteriors with ones built from {@code samples} alone.
     */
    public BanditSnapshot rebuild(Collection<RewardSample> samples) {
        BanditSnapshot fresh = BanditSnapshot.of(samples, versions.incrementAndGet(), clock.instant());
        snapshot.set(fresh);
        log.info("[Bandit] Rebuilt snapshot v{} from {} samples over {} buckets",
                fresh.version(), samples.size(), fresh.posteriors().size());
        return fresh;
    }

    public BanditSnapshot snapshot() {
        return snapshot.get();
    }

    public List<ProviderStatistics> statistics() {
        BanditSnapshot current = snapshot.get();
        return catalog.all().stream().map(provider -> {
            long samples = 0;
            double rewardSum = 0.0;
            int buckets = 0;
            for (Map<String, BetaPosterior> arms : current.posteriors().values()) {
                BetaPosterior p = arms.get(provider.id());
                if (p == null) continue;
                samples += p.samples();
                // alpha starts at 1 and grows by the reward
                rewardSum += p.alpha() - 1.0;
                buckets++;
            }
            double mean = samples == 0 ? 0.0 : rewardSum / samples;
            return new ProviderStatistics(provider.id(), provider.tier().name(), samples, mean, buckets);
        }).toList();
    }
}
