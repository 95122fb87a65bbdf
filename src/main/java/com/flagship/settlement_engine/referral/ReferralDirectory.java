package com.flagship.settlement_engine.referral;

import java.util.Optional;

/**
 * Port to the referral service's who-referred-whom data.
 */
public interface ReferralDirectory {

    Optional<ReferralProfile> findProfile(String professionalId);

    default Optional<String> findReferrerOf(String professionalId) {
        return findProfile(professionalId).map(ReferralProfile::getReferredBy);
    }
}
