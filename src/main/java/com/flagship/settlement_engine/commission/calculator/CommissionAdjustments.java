package com.flagship.settlement_engine.commission.calculator;

import lombok.Value;

import java.time.Month;
import java.util.List;

/**
 * Referrer-side adjustments for one calculation: the season the job falls in and each
 * chain level's penalty profile (index 0 = direct referrer).
 */
@Value
public class CommissionAdjustments {

    public static final CommissionAdjustments NONE = new CommissionAdjustments(null, List.of());

    Month seasonMonth;
    List<PenaltyProfile> levelPenalties;

    public static CommissionAdjustments of(Month seasonMonth, List<PenaltyProfile> levelPenalties) {
        return new CommissionAdjustments(seasonMonth, List.copyOf(levelPenalties));
    }

    public PenaltyProfile penaltyForLevel(int level) {
        if (level < levelPenalties.size() && levelPenalties.get(level) != null) {
            return levelPenalties.get(level);
        }
        return PenaltyProfile.CLEAN;
    }
}
