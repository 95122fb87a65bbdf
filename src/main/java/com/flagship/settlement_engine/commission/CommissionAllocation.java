package com.flagship.settlement_engine.commission;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One recipient's share of a job's commission, before it is persisted as a fact.
 */
@Value
public class CommissionAllocation {
    String recipientId;
    RecipientType recipientType;
    int chainLevel;
    BigDecimal amount;
    BigDecimal percentage;
    String description;
}
