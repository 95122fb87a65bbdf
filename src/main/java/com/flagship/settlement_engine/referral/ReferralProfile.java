package com.flagship.settlement_engine.referral;

import com.flagship.settlement_engine.commission.calculator.PenaltyProfile;
import com.flagship.settlement_engine.commission.calculator.ReferrerTier;
import lombok.Value;

/**
 * What the referral service knows about one professional.
 */
@Value
public class ReferralProfile {
    String professionalId;
    String referredBy;
    ReferrerTier tier;
    PenaltyProfile penaltyProfile;
}
