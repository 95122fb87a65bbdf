package com.flagship.settlement_engine.invoice;

/**
 * DRAFT → SENT → PAID | OVERDUE | CANCELLED, and OVERDUE → PAID | CANCELLED.
 */
public enum InvoiceStatus {
    DRAFT,
    SENT,
    PAID,
    OVERDUE,
    CANCELLED;

    public boolean isPayable() {
        return this == SENT || this == OVERDUE;
    }
}
