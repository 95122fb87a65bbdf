package com.flagship.settlement_engine.commission;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A professional's commission activity for one calendar month.
 *
 * owed: platform commission on jobs the professional completed.
 * earned: referral shares credited to the professional.
 */
@Value
public class MonthlyCommissionSummary {
    String professionalId;
    int month;
    int year;
    BigDecimal totalOwed;
    BigDecimal totalEarned;
    int jobCount;
    List<CommissionFact> facts;
}
