package com.hybridrouter.domain.feedback.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Generated item as reported back by the caller after the provider ran.
 *
 * @param fields  structured output fields (headline, lede, why_it_matters, ...)
 * @param sources source references cited by the item
 * @param costEur actual generation cost, if the caller knows it (nullable)
 */
public record GenerationOutcome(
        Map<String, String> fields,
        List<String> sources,
        BigDecimal costEur
) {
    public GenerationOutcome {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public String field(String name) {
        return fields.getOrDefault(name, "");
    }

    public String fullText() {
        return String.join(" ", fields.values());
    }
}
