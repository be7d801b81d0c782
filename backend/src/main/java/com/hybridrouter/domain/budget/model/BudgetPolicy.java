package com.hybridrouter.domain.budget.model;

import java.math.BigDecimal;

/**
 * Versioned budget configuration, swapped atomically on reload.
 *
 * @param monthlyCap    hard monthly spending cap (EUR)
 * @param softRatio     daily spend / pacing target above which the directive is SOFT
 * @param hardRatio     ratio above which the directive is EMERGENCY; HARD lies between
 * @param maxSingleCost worst-case cost of one request; bounds the overshoot past the cap
 * @param version       monotonically increasing version
 */
public record BudgetPolicy(
        BigDecimal monthlyCap,
        double softRatio,
        double hardRatio,
        BigDecimal maxSingleCost,
        long version
) {
    public BudgetPolicy {
        if (monthlyCap == null || monthlyCap.signum() <= 0) {
            throw new IllegalArgumentException("Monthly cap must be positive");
        }
        if (softRatio < 1.0 || hardRatio < softRatio) {
            throw new IllegalArgumentException("Ratios must satisfy 1 <= soft <= hard, got soft="
                    + softRatio + " hard=" + hardRatio);
        }
        if (maxSingleCost == null || maxSingleCost.signum() <= 0) {
            throw new IllegalArgumentException("Max single cost must be positive");
        }
    }

    public BigDecimal reservationCeiling() {
        return monthlyCap.add(maxSingleCost);
    }

    public BudgetPolicy nextVersion(BigDecimal cap, double soft, double hard) {
        return new BudgetPolicy(cap, soft, hard, maxSingleCost, version + 1);
    }
}
