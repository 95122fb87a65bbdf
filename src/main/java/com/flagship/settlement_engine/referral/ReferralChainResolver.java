package com.flagship.settlement_engine.referral;

import com.flagship.settlement_engine.commission.CommissionAllocation;
import com.flagship.settlement_engine.commission.CommissionPlan;
import com.flagship.settlement_engine.commission.RecipientType;
import com.flagship.settlement_engine.commission.calculator.BreakdownLine;
import com.flagship.settlement_engine.commission.calculator.CommissionAdjustments;
import com.flagship.settlement_engine.commission.calculator.CommissionBreakdown;
import com.flagship.settlement_engine.commission.calculator.CommissionCalculator;
import com.flagship.settlement_engine.commission.calculator.PenaltyProfile;
import com.flagship.settlement_engine.commission.calculator.ReferrerTier;
import com.flagship.settlement_engine.exception.ChainResolutionException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Month;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the referrer-of-referrer relation and turns the resulting chain into
 * per-recipient commission allocations.
 *
 * The walk never trusts the referral data to be acyclic:
 * - at most {@link #MAX_HOPS} referrers are followed
 * - a professional seen twice (the payer included) ends the walk at the first
 *   occurrence; the cycle is logged and counted, and the shorter chain is still paid
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferralChainResolver {

    public static final int MAX_HOPS = 10;

    private final ReferralDirectory referralDirectory;
    private final CommissionCalculator calculator;
    private final SettlementMetrics metrics;

    /**
     * Resolves the chain above a payer.
     *
     * @param payerId professional who owes the commission
     * @param directReferrerId referrer named on the job; when null the directory is asked who referred the payer
     */
    public ReferralChain resolveChain(String payerId, String directReferrerId) {
        String current = directReferrerId != null && !directReferrerId.isBlank()
            ? directReferrerId
            : referralDirectory.findReferrerOf(payerId).orElse(null);

        if (current == null) {
            return ReferralChain.empty(payerId);
        }

        Set<String> visited = new LinkedHashSet<>();
        visited.add(payerId);
        List<ReferralChain.Link> links = new ArrayList<>();

        while (current != null) {
            if (links.size() == MAX_HOPS) {
                log.warn("Referral chain for payer {} exceeds {} hops, truncating at {}",
                    payerId, MAX_HOPS, links.get(links.size() - 1).getProfessionalId());
                metrics.recordChainAnomaly("hop_cap");
                return new ReferralChain(payerId, List.copyOf(links), true, "hop cap of " + MAX_HOPS + " reached");
            }

            if (visited.contains(current)) {
                ChainResolutionException anomaly =
                    new ChainResolutionException(payerId, current, new ArrayList<>(visited));
                log.warn("Truncating referral chain: {}", anomaly.getMessage());
                metrics.recordChainAnomaly("cycle");
                return new ReferralChain(payerId, List.copyOf(links), true, anomaly.getMessage());
            }

            Optional<ReferralProfile> profile = referralDirectory.findProfile(current);
            links.add(new ReferralChain.Link(
                current,
                links.size(),
                profile.map(ReferralProfile::getTier).orElse(ReferrerTier.BRONZE),
                profile.map(ReferralProfile::getPenaltyProfile).orElse(PenaltyProfile.CLEAN)
            ));
            visited.add(current);

            current = profile.map(ReferralProfile::getReferredBy).orElse(null);
        }

        return new ReferralChain(payerId, List.copyOf(links), false, null);
    }

    /**
     * Computes the commission for a resolved chain and assigns every breakdown line to a recipient.
     * Chain levels beyond the calculator's split depth receive nothing.
     */
    public CommissionPlan planCommission(ReferralChain chain, BigDecimal jobValue, BigDecimal rate,
                                         String category, Month seasonMonth) {
        List<PenaltyProfile> penalties = chain.getLinks().stream()
            .map(ReferralChain.Link::getPenaltyProfile)
            .toList();
        ReferrerTier directTier = chain.isEmpty() ? null : chain.getLinks().get(0).getTier();

        CommissionBreakdown breakdown = calculator.computeCommission(
            jobValue, rate, category, directTier, chain.depth(),
            CommissionAdjustments.of(seasonMonth, penalties));

        List<CommissionAllocation> allocations = new ArrayList<>();
        for (BreakdownLine line : breakdown.getLines()) {
            String recipientId = line.getRecipientType() == RecipientType.PLATFORM
                ? RecipientType.PLATFORM_RECIPIENT_ID
                : chain.getLinks().get(line.getLevel()).getProfessionalId();
            allocations.add(new CommissionAllocation(
                recipientId,
                line.getRecipientType(),
                line.getLevel(),
                line.getAmount(),
                line.getPercentage(),
                line.getDescription()
            ));
        }

        log.debug("Planned commission for payer {}: chainDepth={}, lines={}, total={}",
            chain.getPayerId(), chain.depth(), allocations.size(), breakdown.total());

        return new CommissionPlan(breakdown, List.copyOf(allocations));
    }
}
