package com.hybridrouter.interfaces.api.dto;

import com.hybridrouter.domain.budget.model.BudgetPolicy;

import java.math.BigDecimal;

public record BudgetPolicyResponse(
        long version,
        BigDecimal monthlyCap,
        double softRatio,
        double hardRatio,
        BigDecimal maxSingleCost
) {
    public static BudgetPolicyResponse from(BudgetPolicy p) {
        return new BudgetPolicyResponse(p.version(), p.monthlyCap(), p.softRatio(), p.hardRatio(), p.maxSingleCost());
    }
}
