package com.hybridrouter.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RouteRequest(
        @NotBlank(message = "contentId is required")
        @Size(max = 255, message = "contentId must not exceed 255 characters")
        String contentId,

        @Size(max = 20, message = "language must not exceed 20 characters")
        String language,

        @Size(max = 100, message = "category must not exceed 100 characters")
        String category,

        @NotNull(message = "complexity is required")
        Double complexity,

        @NotNull(message = "risk is required")
        Double risk
) {}
