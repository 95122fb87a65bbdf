package com.flagship.settlement_engine.payment;

/**
 * PROCESSING → COMPLETED | FAILED, and COMPLETED → REFUNDED once fully refunded.
 */
public enum PaymentStatus {
    PROCESSING,
    COMPLETED,
    FAILED,
    REFUNDED
}
