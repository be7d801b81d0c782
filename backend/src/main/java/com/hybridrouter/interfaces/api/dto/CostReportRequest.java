package com.hybridrouter.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CostReportRequest(
        @NotBlank(message = "contentId is required")
        String contentId,

        @NotNull(message = "amount is required")
        @PositiveOrZero(message = "amount must not be negative")
        BigDecimal amount
) {}
