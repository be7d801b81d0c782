package com.hybridrouter.interfaces.api.dto;

import com.hybridrouter.domain.budget.model.BudgetDirective;
import com.hybridrouter.domain.routing.model.ThrottleState;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DirectiveResponse(
        ThrottleState throttleState,
        LocalDate day,
        BigDecimal monthlyCap,
        BigDecimal monthSpend,
        BigDecimal daySpend,
        BigDecimal pacingTarget,
        BigDecimal projectedMonthEnd
) {
    public static DirectiveResponse from(BudgetDirective d) {
        return new DirectiveResponse(d.state(), d.day(), d.monthlyCap(), d.monthSpend(), d.daySpend(),
                d.pacingTarget(), d.projectedMonthEnd());
    }
}
