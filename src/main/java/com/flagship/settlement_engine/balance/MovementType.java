package com.flagship.settlement_engine.balance;

public enum MovementType {
    COMMISSION_DEBT,
    REVENUE_SHARE,
    PAYMENT,
    PAYOUT,
    PAYOUT_REVERSAL,
    OFFSET_CREDIT_RELEASED,
    OFFSET_DEBT_SETTLED,
    RECALCULATION
}
