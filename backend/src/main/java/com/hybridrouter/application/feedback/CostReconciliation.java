package com.hybridrouter.application.feedback;

import java.math.BigDecimal;

/**
 * @param known          whether a decision exists for the content
 * @param estimatedCost  cost reserved at decision time (null when unknown)
 * @param recordedDelta  amount added to the month spend; zero when the estimate already covered it
 */
public record CostReconciliation(
        String contentId,
        boolean known,
        BigDecimal estimatedCost,
        BigDecimal actualCost,
        BigDecimal recordedDelta
) {}
