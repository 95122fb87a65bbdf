package com.flagship.settlement_engine.settlement;

public enum SettlementRunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED
}
