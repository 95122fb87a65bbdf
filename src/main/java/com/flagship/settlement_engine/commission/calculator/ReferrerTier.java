package com.flagship.settlement_engine.commission.calculator;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Referrer loyalty tier. The multiplier scales a single referrer's share of the base commission.
 */
public enum ReferrerTier {
    BRONZE(new BigDecimal("1.0")),
    SILVER(new BigDecimal("1.1")),
    GOLD(new BigDecimal("1.2")),
    PREMIUM(new BigDecimal("1.3"));

    private final BigDecimal multiplier;

    ReferrerTier(BigDecimal multiplier) {
        this.multiplier = multiplier;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    /**
     * Lenient parse used for data coming from the referral store; unknown or missing tiers count as BRONZE.
     */
    public static ReferrerTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BRONZE;
        }
        try {
            return ReferrerTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BRONZE;
        }
    }
}
