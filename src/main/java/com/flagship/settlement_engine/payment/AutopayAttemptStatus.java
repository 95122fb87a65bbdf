package com.flagship.settlement_engine.payment;

public enum AutopayAttemptStatus {
    SCHEDULED,
    SUCCEEDED,
    EXHAUSTED
}
