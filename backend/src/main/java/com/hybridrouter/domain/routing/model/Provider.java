package com.hybridrouter.domain.routing.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One selectable backend option (bandit arm).
 *
 * @param id                    stable provider id used in logs and rule tables
 * @param tier                  declared quality tier
 * @param costPerThousandUnits  EUR per 1000 output units
 * @param expectedUnits         typical output units per request, used for cost estimates
 * @param maxUnits              worst-case output units per request
 */
public record Provider(
        String id,
        QualityTier tier,
        BigDecimal costPerThousandUnits,
        int expectedUnits,
        int maxUnits
) {
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    public Provider {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("Provider " + id + " has no quality tier");
        }
        if (costPerThousandUnits == null || costPerThousandUnits.signum() < 0) {
            throw new IllegalArgumentException("Provider " + id + " has an invalid cost");
        }
        if (expectedUnits <= 0 || maxUnits < expectedUnits) {
            throw new IllegalArgumentException("Provider " + id + " needs 0 < expectedUnits <= maxUnits");
        }
    }

    public BigDecimal estimatedCost() {
        return costFor(expectedUnits);
    }

    public BigDecimal worstCaseCost() {
        return costFor(maxUnits);
    }

    public boolean isPremium() {
        return tier == QualityTier.PREMIUM;
    }

    private BigDecimal costFor(int units) {
        return costPerThousandUnits.multiply(BigDecimal.valueOf(units))
                .divide(THOUSAND, 6, RoundingMode.HALF_UP);
    }
}
