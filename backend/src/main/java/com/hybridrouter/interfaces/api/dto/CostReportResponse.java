package com.hybridrouter.interfaces.api.dto;

import com.hybridrouter.application.feedback.CostReconciliation;

import java.math.BigDecimal;

public record CostReportResponse(
        String contentId,
        boolean known,
        BigDecimal estimatedCost,
        BigDecimal recordedDelta
) {
    public static CostReportResponse from(CostReconciliation r) {
        return new CostReportResponse(r.contentId(), r.known(), r.estimatedCost(), r.recordedDelta());
    }
}
