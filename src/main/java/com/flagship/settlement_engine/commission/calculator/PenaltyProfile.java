package com.flagship.settlement_engine.commission.calculator;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Referrer track record that reduces their share: disputes, late payments, low quality scores.
 */
@Value
public class PenaltyProfile {

    public static final PenaltyProfile CLEAN = new PenaltyProfile(0, 0, BigDecimal.ONE);

    private static final BigDecimal HEAVY_DISPUTE_REDUCTION = new BigDecimal("0.10");
    private static final BigDecimal LIGHT_DISPUTE_REDUCTION = new BigDecimal("0.05");
    private static final BigDecimal LATE_PAYMENT_REDUCTION = new BigDecimal("0.02");
    private static final BigDecimal LOW_QUALITY_REDUCTION = new BigDecimal("0.05");
    private static final BigDecimal QUALITY_THRESHOLD = new BigDecimal("0.7");

    int disputeCount;
    int latePaymentCount;
    BigDecimal qualityScore;

    /**
     * Unclamped reduction rate; the calculator caps what is actually applied.
     */
    public BigDecimal reductionRate() {
        BigDecimal reduction = BigDecimal.ZERO;

        if (disputeCount > 3) {
            reduction = reduction.add(HEAVY_DISPUTE_REDUCTION);
        } else if (disputeCount > 1) {
            reduction = reduction.add(LIGHT_DISPUTE_REDUCTION);
        }

        if (latePaymentCount > 2) {
            reduction = reduction.add(LATE_PAYMENT_REDUCTION);
        }

        if (qualityScore != null && qualityScore.compareTo(QUALITY_THRESHOLD) < 0) {
            reduction = reduction.add(LOW_QUALITY_REDUCTION);
        }

        return reduction;
    }
}
