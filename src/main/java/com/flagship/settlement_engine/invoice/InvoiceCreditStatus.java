package com.flagship.settlement_engine.invoice;

public enum InvoiceCreditStatus {
    AVAILABLE,
    CONSUMED
}
