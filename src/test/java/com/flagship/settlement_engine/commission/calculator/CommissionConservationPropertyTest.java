package com.flagship.settlement_engine.commission.calculator;

import com.flagship.settlement_engine.common.Money;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.BigRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Scale;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * No cent is created or lost when a commission is split across a referral chain.
 */
class CommissionConservationPropertyTest {

    private final CommissionCalculator calculator = new CommissionCalculator(new CommissionRateProperties());

    @Property
    @Label("Level split always adds up to the amount being split")
    void splitAddsUpExactly(@ForAll @BigRange(min = "0.01", max = "1000000") @Scale(2) BigDecimal amount,
                            @ForAll @IntRange(min = 1, max = 4) int levels) {
        List<BigDecimal> split = CommissionCalculator.splitAcrossLevels(amount, levels);

        assertEquals(levels, split.size());
        assertEquals(0, split.stream().reduce(BigDecimal.ZERO, BigDecimal::add).compareTo(amount));
        split.forEach(share -> assertTrue(share.signum() >= 0, "negative share " + share));
    }

    @Property
    @Label("Referrer lines of an unpenalised chain add up to the base commission")
    void chainLinesAddUpToBase(@ForAll @BigRange(min = "1", max = "500000") @Scale(2) BigDecimal jobValue,
                               @ForAll @BigRange(min = "0", max = "0.30") @Scale(4) BigDecimal rate,
                               @ForAll @IntRange(min = 2, max = 12) int chainLength) {
        CommissionBreakdown breakdown = calculator.computeCommission(jobValue, rate, "general", null, chainLength);

        BigDecimal base = Money.round(jobValue.multiply(rate));
        BigDecimal referrerTotal = breakdown.referrerLines().stream()
            .map(BreakdownLine::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        assertEquals(0, referrerTotal.compareTo(base));
        assertEquals(Math.min(chainLength, CommissionCalculator.MAX_SPLIT_LEVELS), breakdown.referrerLines().size());
    }

    @Property
    @Label("A penalty never removes more than a fifth of a share")
    void penaltyIsBounded(@ForAll @BigRange(min = "0.01", max = "100000") @Scale(2) BigDecimal amount,
                          @ForAll @BigRange(min = "0", max = "1") @Scale(2) BigDecimal reduction) {
        BigDecimal reduced = CommissionCalculator.applyPenalty(amount, reduction);

        assertTrue(reduced.compareTo(amount) <= 0);
        assertTrue(reduced.compareTo(Money.round(amount.multiply(new BigDecimal("0.80")))) >= 0);
    }
}
