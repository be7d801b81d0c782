package com.hybridrouter.domain.routing.model;

import java.util.Set;

/**
 * One entry of the ordered rule table: a predicate over the request context mapped to a
 * forced provider. Every criterion that is set must match; unset criteria are ignored.
 *
 * @param name          operator-facing rule name, unique within a table
 * @param languages     languages that match (empty = any)
 * @param categories    categories that match (empty = any)
 * @param minComplexity complexity at or above which the rule matches (null = any)
 * @param minRisk       risk at or above which the rule matches (null = any)
 * @param provider      id of the forced provider
 * @param allowlisted   whether the rule survives a hard throttle
 */
public record RoutingRule(
        String name,
        Set<String> languages,
        Set<String> categories,
        Double minComplexity,
        Double minRisk,
        String provider,
        boolean allowlisted
) {
    public RoutingRule {
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }

    public boolean hasCriteria() {
        return !languages.isEmpty() || !categories.isEmpty() || minComplexity != null || minRisk != null;
    }

    public boolean matches(RequestContext context) {
        if (!languages.isEmpty() && !languages.contains(context.language())) return false;
        if (!categories.isEmpty() && !categories.contains(context.category())) return false;
        if (minComplexity != null && context.complexity() < minComplexity) return false;
        if (minRisk != null && context.risk() < minRisk) return false;
        return hasCriteria();
    }
}
