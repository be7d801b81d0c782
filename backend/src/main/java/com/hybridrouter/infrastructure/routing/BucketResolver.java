package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.routing.model.ComplexityTier;
import com.hybridrouter.domain.routing.model.ContextBucket;
import com.hybridrouter.domain.routing.model.RequestContext;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.config.RoutingConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a request context to its bandit bucket: language x criticality x complexity tier.
 * Unlisted languages share the {@code other} bucket, so the cardinality is fixed at startup.
 */
@Slf4j
@Component
public class BucketResolver {

    private static final int CRITICALITY_LEVELS = 2;

    private final Set<String> languages;
    private final Set<String> criticalCategories;
    private final double riskThreshold;
    private final double complexityMedium;
    private final double complexityHigh;
    private final int cardinality;

    public BucketResolver(RouterProperties properties) {
        RouterProperties.Bucket config = properties.getBucket();
        this.languages = config.getLanguages().stream()
                .map(l -> l.trim().toLowerCase(Locale.ROOT))
                .filter(l -> !l.isEmpty() && !RequestContext.UNKNOWN.equals(l))
                .collect(Collectors.toUnmodifiableSet());
        this.criticalCategories = config.getCriticalCategories().stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.riskThreshold = config.getRiskThreshold();
        this.complexityMedium = config.getComplexityMedium();
        this.complexityHigh = config.getComplexityHigh();

        if (!(0.0 < complexityMedium && complexityMedium < complexityHigh && complexityHigh <= 1.0)) {
            throw new RoutingConfigurationException("Complexity thresholds must satisfy 0 < medium < high <= 1, got "
                    + complexityMedium + " / " + complexityHigh);
        }

        this.cardinality = (languages.size() + 1) * CRITICALITY_LEVELS * ComplexityTier.values().length;
        int maxBuckets = properties.getBandit().getMaxBuckets();
        if (cardinality > maxBuckets) {
            throw new RoutingConfigurationException(String.format(
                    "Bucket cardinality %d exceeds router.bandit.max-buckets=%d (%d languages + other)",
                    cardinality, maxBuckets, languages.size()));
        }
        log.info("[BucketResolver] {} buckets over languages {}", cardinality, languages);
    }

    public ContextBucket resolve(RequestContext context) {
        String language = languages.contains(context.language()) ? context.language() : RequestContext.UNKNOWN;
        boolean critical = criticalCategories.contains(context.category()) || context.risk() >= riskThreshold;
        return new ContextBucket(language, critical, tierOf(context.complexity()));
    }

    private ComplexityTier tierOf(double complexity) {
        if (complexity >= complexityHigh) return ComplexityTier.HIGH;
        if (complexity >= complexityMedium) return ComplexityTier.MEDIUM;
        return ComplexityTier.LOW;
    }

    public int cardinality() {
        return cardinality;
    }
}
