package com.hybridrouter.infrastructure.routing;

import com.hybridrouter.domain.routing.model.Provider;
import com.hybridrouter.domain.routing.model.QualityTier;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.config.RoutingConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of configured providers, with the two designated arms the router falls back to:
 * the cheapest (throttling, fail-open) and the safe one (cold start).
 */
@Slf4j
@Component
public class ProviderCatalog {

    private final Map<String, Provider> providers;
    private final Provider cheapest;
    private final Provider safe;
    private final BigDecimal maxWorstCaseCost;

    public ProviderCatalog(RouterProperties properties) {
        if (properties.getProviders().isEmpty()) {
            throw new RoutingConfigurationException("router.providers must declare at least one provider");
        }

        Map<String, Provider> byId = new LinkedHashMap<>();
        for (RouterProperties.ProviderProperties p : properties.getProviders()) {
            Provider provider;
            try {
                provider = new Provider(p.getId(), p.getTier(), p.getCostPerThousandUnits(),
                        p.getExpectedUnits(), p.getMaxUnits());
            } catch (IllegalArgumentException e) {
                throw new RoutingConfigurationException("Invalid provider: " + e.getMessage(), e);
            }
            if (byId.putIfAbsent(provider.id(), provider) != null) {
                throw new RoutingConfigurationException("Duplicate provider id: " + provider.id());
            }
        }
        this.providers = Map.copyOf(byId);

        this.cheapest = byId.values().stream()
                .min(Comparator.comparing(Provider::estimatedCost))
                .orElseThrow();
        this.safe = resolveSafe(properties.getSafeProvider(), byId);
        this.maxWorstCaseCost = byId.values().stream()
                .map(Provider::worstCaseCost)
                .max(Comparator.naturalOrder())
                .orElseThrow();

        log.info("[ProviderCatalog] {} providers, cheapest={}, safe={}", byId.size(), cheapest.id(), safe.id());
    }

    private static Provider resolveSafe(String configured, Map<String, Provider> byId) {
        if (configured != null && !configured.isBlank()) {
            Provider p = byId.get(configured);
            if (p == null) {
                throw new RoutingConfigurationException("router.safe-provider refers to unknown provider: " + configured);
            }
            return p;
        }
        return byId.values().stream()
                .filter(p -> p.tier() == QualityTier.PREMIUM)
                .findFirst()
                .orElseGet(() -> byId.values().stream()
                        .max(Comparator.comparing(Provider::estimatedCost))
                        .orElseThrow());
    }

    public List<Provider> all() {
        return providers.values().stream()
                .sorted(Comparator.comparing(Provider::id))
                .toList();
    }

    public Optional<Provider> find(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    public Provider require(String id) {
        Provider p = providers.get(id);
        if (p == null) {
            throw new RoutingConfigurationException("Unknown provider: " + id);
        }
        return p;
    }

    public boolean contains(String id) {
        return providers.containsKey(id);
    }

    public Provider cheapest() {
        return cheapest;
    }

    public Provider safe() {
        return safe;
    }

    public BigDecimal maxWorstCaseCost() {
        return maxWorstCaseCost;
    }
}
