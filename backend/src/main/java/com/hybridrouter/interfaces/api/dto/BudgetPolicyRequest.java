package com.hybridrouter.interfaces.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record BudgetPolicyRequest(
        @NotNull(message = "monthlyCap is required")
        @Positive(message = "monthlyCap must be positive")
        BigDecimal monthlyCap,

        @NotNull(message = "softRatio is required")
        @DecimalMin(value = "1.0", message = "softRatio must be at least 1.0")
        Double softRatio,

        @NotNull(message = "hardRatio is required")
        @DecimalMin(value = "1.0", message = "hardRatio must be at least 1.0")
        Double hardRatio
) {}
