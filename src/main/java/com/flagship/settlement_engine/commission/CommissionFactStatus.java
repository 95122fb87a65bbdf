package com.flagship.settlement_engine.commission;

/**
 * RECORDED → INVOICED → PAID. Cancelling an invoice moves its facts from INVOICED back to RECORDED.
 */
public enum CommissionFactStatus {
    RECORDED,
    INVOICED,
    PAID
}
