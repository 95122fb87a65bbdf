package com.flagship.settlement_engine.referral;

import com.flagship.settlement_engine.commission.calculator.PenaltyProfile;
import com.flagship.settlement_engine.commission.calculator.ReferrerTier;
import lombok.Value;

import java.util.List;

/**
 * Resolved referrers of a payer, direct referrer first.
 *
 * {@code truncated} is set when the walk stopped early, either on the hop cap or
 * because a cycle was found ({@code anomaly} then describes it).
 */
@Value
public class ReferralChain {
    String payerId;
    List<Link> links;
    boolean truncated;
    String anomaly;

    public static ReferralChain empty(String payerId) {
        return new ReferralChain(payerId, List.of(), false, null);
    }

    public int depth() {
        return links.size();
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }

    public List<String> professionalIds() {
        return links.stream().map(Link::getProfessionalId).toList();
    }

    @Value
    public static class Link {
        String professionalId;
        int level;
        ReferrerTier tier;
        PenaltyProfile penaltyProfile;
    }
}
