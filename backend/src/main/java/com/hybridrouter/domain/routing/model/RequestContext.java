package com.hybridrouter.domain.routing.model;

import java.util.Locale;

/**
 * Immutable per-request facts the router decides on.
 *
 * @param contentId  identifier that later feedback refers back to
 * @param language   content language (ISO code, lower-cased)
 * @param category   topic category (lower-cased)
 * @param complexity computed complexity score, clamped to [0,1]
 * @param risk       computed risk score, clamped to [0,1]
 */
public record RequestContext(
        String contentId,
        String language,
        String category,
        double complexity,
        double risk
) {
    public static final String UNKNOWN = "other";

    public RequestContext {
        language = normalize(language);
        category = normalize(category);
        complexity = clamp(complexity);
        risk = clamp(risk);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
