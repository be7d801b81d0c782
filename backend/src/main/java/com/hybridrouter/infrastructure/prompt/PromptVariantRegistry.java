package com.hybridrouter.infrastructure.prompt;

import com.hybridrouter.infrastructure.config.RouterProperties;
import com.hybridrouter.infrastructure.config.RoutingConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Operator-curated prompt variants per category. Categories without their own list use
 * {@code default}. The first variant of each list is the curated fallback.
 */
@Slf4j
@Component
public class PromptVariantRegistry {

    public static final String DEFAULT_KEY = "default";

    private final Map<String, List<String>> variants;

    public PromptVariantRegistry(RouterProperties properties) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        properties.getPrompter().getVariants().forEach((category, list) -> {
            List<String> cleaned = list == null ? List.of() : list.stream()
                    .filter(v -> v != null && !v.isBlank())
                    .map(String::trim)
                    .distinct()
                    .toList();
            if (cleaned.isEmpty()) {
                throw new RoutingConfigurationException("Prompt category " + category + " has no variants");
            }
            copy.put(category.trim().toLowerCase(Locale.ROOT), cleaned);
        });
        if (!copy.containsKey(DEFAULT_KEY)) {
            throw new RoutingConfigurationException("router.prompter.variants must define a '" + DEFAULT_KEY + "' list");
        }
        this.variants = Map.copyOf(copy);
        log.info("[PromptVariantRegistry] {} categories, default={}", variants.size(), variants.get(DEFAULT_KEY));
    }

    /**
     * Key the statistics of {@code category} are kept under.
     */
    public String resolveKey(String category) {
        return variants.containsKey(category) ? category : DEFAULT_KEY;
    }

    public List<String> variantsFor(String key) {
        return variants.getOrDefault(key, variants.get(DEFAULT_KEY));
    }

    public String fallback(String category) {
        return variantsFor(resolveKey(category)).get(0);
    }
}
