package com.hybridrouter.infrastructure.routing;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hybridrouter.domain.routing.model.RoutingRule;
import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.config.RoutingConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Loads the forced-provider rule table from YAML and publishes it as an atomically swapped,
 * versioned snapshot. A table that fails validation never replaces the active one.
 *
 * <pre>
 * rules:
 *   - name: fi-politics-premium
 *     languages: [fi]
 *     categories: [politics]
 *     provider: premium-a
 *     allowlisted: true
 * </pre>
 */
@Slf4j
@Component
public class RuleTableLoader {

    record RuleFile(List<RuleEntry> rules) {}

    record RuleEntry(
            String name,
            List<String> languages,
            List<String> categories,
            Double minComplexity,
            Double minRisk,
            String provider,
            Boolean allowlisted
    ) {}

    private final ResourceLoader resourceLoader;
    private final ProviderCatalog catalog;
    private final String location;
    private final Clock clock;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    private final AtomicLong versions = new AtomicLong();
    private final AtomicReference<RuleTable> current = new AtomicReference<>();

    public RuleTableLoader(ResourceLoader resourceLoader, ProviderCatalog catalog,
                           RouterProperties properties, Clock clock) {
        this.resourceLoader = resourceLoader;
        this.catalog = catalog;
        this.location = properties.getRulesLocation();
        this.clock = clock;
        current.set(load());
    }

    public RuleTable current() {
        return current.get();
    }

    /**
     * Re-reads the rule file and swaps it in.
     *
     * @throws RoutingConfigurationException if the file is missing or invalid; the active table is kept
     */
    public RuleTable reload() {
        RuleTable table = load();
        current.set(table);
        return table;
    }

    private RuleTable load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RoutingConfigurationException("Rule table not found: " + location);
        }

        RuleFile file;
        try (InputStream in = resource.getInputStream()) {
            file = yamlMapper.readValue(in, RuleFile.class);
        } catch (IOException e) {
            throw new RoutingConfigurationException("Unreadable rule table " + location + ": " + e.getMessage(), e);
        }

        List<RoutingRule> rules = validate(file == null || file.rules() == null ? List.of() : file.rules());
        RuleTable table = new RuleTable(versions.incrementAndGet(), rules, location, clock.instant());
        log.info("[RuleTable] Loaded version {} with {} rules from {}", table.version(), rules.size(), location);
        return table;
    }

    private List<RoutingRule> validate(List<RuleEntry> entries) {
        List<RoutingRule> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            RuleEntry e = entries.get(i);
            if (e == null || e.name() == null || e.name().isBlank()) {
                throw new RoutingConfigurationException("Rule #" + (i + 1) + " has no name");
            }
            if (!names.add(e.name())) {
                throw new RoutingConfigurationException("Duplicate rule name: " + e.name());
            }
            if (e.provider() == null || !catalog.contains(e.provider())) {
                throw new RoutingConfigurationException("Rule " + e.name() + " forces unknown provider: " + e.provider());
            }
            checkThreshold(e.name(), "minComplexity", e.minComplexity());
            checkThreshold(e.name(), "minRisk", e.minRisk());

            RoutingRule rule = new RoutingRule(e.name(), lower(e.languages()), lower(e.categories()),
                    e.minComplexity(), e.minRisk(), e.provider(), Boolean.TRUE.equals(e.allowlisted()));
            if (!rule.hasCriteria()) {
                throw new RoutingConfigurationException("Rule " + e.name() + " has no matching criteria");
            }
            rules.add(rule);
        }
        return rules;
    }

    private static void checkThreshold(String rule, String field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new RoutingConfigurationException("Rule " + rule + ": " + field + " must be in [0,1], got " + value);
        }
    }

    private static Set<String> lower(List<String> values) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
