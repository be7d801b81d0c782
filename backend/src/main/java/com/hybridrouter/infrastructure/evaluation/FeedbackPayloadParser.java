package com.hybridrouter.infrastructure.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridrouter.domain.feedback.model.EditorialSignal;
import com.hybridrouter.domain.feedback.model.EngagementSignal;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import com.hybridrouter.domain.feedback.model.GenerationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON payloads of feedback events.
 *
 * <pre>
 * GENERATION_OUTCOME {"fields": {"headline": "..."}, "sources": ["https://..."], "costEur": 0.03}
 * EDITORIAL          {"accepted": true, "editRatio": 0.1}
 * ENGAGEMENT         {"clicks": 1, "timeOnCardSeconds": 45, "shares": 0}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class FeedbackPayloadParser {

    private final ObjectMapper objectMapper;

    /**
     * Fails fast on a payload that could never be scored.
     */
    public void check(FeedbackSource source, String payload) {
        switch (source) {
            case GENERATION_OUTCOME -> parseOutcome(payload);
            case EDITORIAL -> parseEditorial(payload);
            case ENGAGEMENT -> parseEngagement(payload);
        }
    }

    public GenerationOutcome parseOutcome(String payload) {
        JsonNode root = read(payload, FeedbackSource.GENERATION_OUTCOME);
        JsonNode fieldsNode = root.get("fields");
        if (fieldsNode == null || !fieldsNode.isObject()) {
            throw new FeedbackPayloadException("GENERATION_OUTCOME payload needs a 'fields' object");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fieldsNode.fields().forEachRemaining(e -> fields.put(e.getKey(), e.getValue().isNull() ? "" : e.getValue().asText()));

        List<String> sources = new ArrayList<>();
        JsonNode sourcesNode = root.get("sources");
        if (sourcesNode != null && !sourcesNode.isNull()) {
            if (!sourcesNode.isArray()) {
                throw new FeedbackPayloadException("GENERATION_OUTCOME 'sources' must be an array");
            }
            sourcesNode.forEach(s -> sources.add(s.asText()));
        }

        BigDecimal cost = null;
        JsonNode costNode = root.get("costEur");
        if (costNode != null && !costNode.isNull()) {
            if (!costNode.isNumber() || costNode.decimalValue().signum() < 0) {
                throw new FeedbackPayloadException("GENERATION_OUTCOME 'costEur' must be a non-negative number");
            }
            cost = costNode.decimalValue();
        }
        return new GenerationOutcome(fields, sources, cost);
    }

    public EditorialSignal parseEditorial(String payload) {
        JsonNode root = read(payload, FeedbackSource.EDITORIAL);
        JsonNode accepted = root.get("accepted");
        if (accepted == null || !accepted.isBoolean()) {
            throw new FeedbackPayloadException("EDITORIAL payload needs a boolean 'accepted'");
        }
        return new EditorialSignal(accepted.booleanValue(), root.path("editRatio").asDouble(0.0));
    }

    public EngagementSignal parseEngagement(String payload) {
        JsonNode root = read(payload, FeedbackSource.ENGAGEMENT);
        JsonNode clicks = root.get("clicks");
        if (clicks == null || !clicks.isNumber()) {
            throw new FeedbackPayloadException("ENGAGEMENT payload needs a numeric 'clicks'");
        }
        return new EngagementSignal(clicks.asInt(), root.path("timeOnCardSeconds").asDouble(0.0),
                root.path("shares").asInt(0));
    }

    private JsonNode read(String payload, FeedbackSource source) {
        if (payload == null || payload.isBlank()) {
            throw new FeedbackPayloadException(source + " payload is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new FeedbackPayloadException(source + " payload must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new FeedbackPayloadException(source + " payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
