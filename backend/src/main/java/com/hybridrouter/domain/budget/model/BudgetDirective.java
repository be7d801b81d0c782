package com.hybridrouter.domain.budget.model;

import com.hybridrouter.domain.routing.model.ThrottleState;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Throttle directive plus the numbers it was derived from, for the router and dashboards.
 */
public record BudgetDirective(
        ThrottleState state,
        LocalDate day,
        BigDecimal monthlyCap,
        BigDecimal monthSpend,
        BigDecimal daySpend,
        BigDecimal pacingTarget,
        BigDecimal projectedMonthEnd
) {
    public boolean allowsExploration() {
        return state != ThrottleState.EMERGENCY;
    }
}
