package com.hybridrouter.interfaces.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.hybridrouter.domain.feedback.model.FeedbackSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record FeedbackRequest(
        @NotBlank(message = "contentId is required")
        @Size(max = 255, message = "contentId must not exceed 255 characters")
        String contentId,

        @NotNull(message = "source is required")
        FeedbackSource source,

        @NotNull(message = "payload is required")
        JsonNode payload,

        Instant occurredAt
) {}
