package com.flagship.settlement_engine.commission.calculator;

import com.flagship.settlement_engine.commission.RecipientType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One recipient's share of a job's commission.
 * Level is the referral chain depth (0 = direct referrer) and is 0 for the platform line.
 */
@Value
public class BreakdownLine {
    RecipientType recipientType;
    int level;
    BigDecimal amount;
    BigDecimal percentage;
    String description;
}
