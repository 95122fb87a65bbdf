package com.flagship.settlement_engine.commission.calculator;

import com.flagship.settlement_engine.commission.RecipientType;
import com.flagship.settlement_engine.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Month;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommissionCalculatorTest {

    private CommissionCalculator calculator;

    @BeforeEach
    void setUp() {
        CommissionRateProperties rates = new CommissionRateProperties();
        CommissionRateProperties.CategoryRates renovation = new CommissionRateProperties.CategoryRates();
        renovation.setPlatformRate(new BigDecimal("0.10"));
        rates.setCategories(Map.of("renovation", renovation));
        calculator = new CommissionCalculator(rates);
    }

    @Test
    @DisplayName("Direct customer job produces a single platform line equal to the base commission")
    void testNoReferrer() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "general", null, 0);

        assertEquals(1, breakdown.getLines().size());
        BreakdownLine platform = breakdown.getLines().get(0);
        assertEquals(RecipientType.PLATFORM, platform.getRecipientType());
        assertEquals(new BigDecimal("100.00"), platform.getAmount());
        assertEquals(new BigDecimal("10.00"), platform.getPercentage());
        assertEquals(new BigDecimal("100.00"), breakdown.total());
    }

    @Test
    @DisplayName("Single referrer gets base × tier multiplier, platform gets job value × platform rate")
    void testSingleReferrerWithTier() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "renovation", ReferrerTier.GOLD, 1);

        assertEquals(2, breakdown.getLines().size());
        assertEquals(new BigDecimal("120.00"), breakdown.referrerLines().get(0).getAmount());
        assertEquals(new BigDecimal("100.00"), breakdown.platformAmount());
        assertEquals(new BigDecimal("220.00"), breakdown.total());
    }

    @Test
    @DisplayName("Unknown category falls back to the default platform rate")
    void testUnknownCategoryUsesDefaultPlatformRate() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("200.00"), new BigDecimal("0.05"), "Gardening", ReferrerTier.BRONZE, 1);

        assertEquals(new BigDecimal("0.05"), breakdown.getPlatformRate());
        assertEquals(new BigDecimal("10.00"), breakdown.platformAmount());
        assertEquals(new BigDecimal("10.00"), breakdown.referrerLines().get(0).getAmount());
    }

    @Test
    @DisplayName("Four-level chain splits the base 60/25/10/5")
    void testFourLevelSplit() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "general", null, 4);

        List<BreakdownLine> referrers = breakdown.referrerLines();
        assertEquals(4, referrers.size());
        assertEquals(new BigDecimal("60.00"), referrers.get(0).getAmount());
        assertEquals(new BigDecimal("25.00"), referrers.get(1).getAmount());
        assertEquals(new BigDecimal("10.00"), referrers.get(2).getAmount());
        assertEquals(new BigDecimal("5.00"), referrers.get(3).getAmount());
        for (int level = 0; level < 4; level++) {
            assertEquals(level, referrers.get(level).getLevel());
        }
    }

    @Test
    @DisplayName("Chains deeper than four levels pay only the first four")
    void testDeepChainCappedAtFourLevels() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "general", null, 7);

        assertEquals(CommissionCalculator.MAX_SPLIT_LEVELS, breakdown.referrerLines().size());
    }

    @Test
    @DisplayName("Deepest level absorbs the rounding remainder so levels add up to the base")
    void testRemainderGoesToDeepestLevel() {
        List<BigDecimal> split = CommissionCalculator.splitAcrossLevels(new BigDecimal("0.07"), 3);

        assertEquals(new BigDecimal("0.04"), split.get(0));
        assertEquals(new BigDecimal("0.01"), split.get(1));
        assertEquals(new BigDecimal("0.02"), split.get(2));
        assertEquals(new BigDecimal("0.07"), split.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Test
    @DisplayName("Tiny commission over four levels never leaves the deepest level negative")
    void testTinyAmountOverFourLevels() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1.20"), new BigDecimal("0.05"), "general", null, 4);

        List<BreakdownLine> referrers = breakdown.referrerLines();
        assertEquals(new BigDecimal("0.03"), referrers.get(0).getAmount());
        assertEquals(new BigDecimal("0.01"), referrers.get(1).getAmount());
        assertEquals(new BigDecimal("0.00"), referrers.get(2).getAmount());
        assertEquals(new BigDecimal("0.02"), referrers.get(3).getAmount());
        referrers.forEach(line -> assertTrue(line.getAmount().signum() >= 0, "negative share " + line.getAmount()));
        assertEquals(new BigDecimal("0.06"), referrers.stream()
            .map(BreakdownLine::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Test
    @DisplayName("Two-level chain gives the unused weights to level two")
    void testTwoLevelChainGetsUnusedWeights() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "general", null, 2);

        assertEquals(new BigDecimal("60.00"), breakdown.referrerLines().get(0).getAmount());
        assertEquals(new BigDecimal("40.00"), breakdown.referrerLines().get(1).getAmount());
    }

    @Test
    @DisplayName("Seasonal multiplier raises referrer lines only")
    void testSeasonalMultiplier() {
        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "renovation", ReferrerTier.BRONZE, 1,
            CommissionAdjustments.of(Month.APRIL, List.of()));

        assertEquals(new BigDecimal("130.00"), breakdown.referrerLines().get(0).getAmount());
        assertEquals(new BigDecimal("100.00"), breakdown.platformAmount());
    }

    @Test
    @DisplayName("Penalty reduction is capped at 20% of the computed amount")
    void testPenaltyCap() {
        PenaltyProfile heavy = new PenaltyProfile(5, 4, new BigDecimal("0.5"));
        assertEquals(new BigDecimal("0.17"), heavy.reductionRate());

        assertEquals(new BigDecimal("80.00"),
            CommissionCalculator.applyPenalty(new BigDecimal("100.00"), new BigDecimal("0.35")));

        CommissionBreakdown breakdown = calculator.computeCommission(
            new BigDecimal("1000.00"), new BigDecimal("0.10"), "general", ReferrerTier.BRONZE, 1,
            CommissionAdjustments.of(null, List.of(heavy)));
        assertEquals(new BigDecimal("83.00"), breakdown.referrerLines().get(0).getAmount());
    }

    @Test
    @DisplayName("Invalid inputs are rejected")
    void testValidation() {
        assertThrows(ValidationException.class, () -> calculator.computeCommission(
            BigDecimal.ZERO, new BigDecimal("0.10"), "general", null, 0));
        assertThrows(ValidationException.class, () -> calculator.computeCommission(
            new BigDecimal("-5"), new BigDecimal("0.10"), "general", null, 0));
        assertThrows(ValidationException.class, () -> calculator.computeCommission(
            new BigDecimal("100"), new BigDecimal("1.5"), "general", null, 0));
        assertThrows(ValidationException.class, () -> calculator.computeCommission(
            new BigDecimal("100"), new BigDecimal("0.10"), "general", null, -1));
    }

    @Test
    @DisplayName("Unknown tier names parse as BRONZE")
    void testTierParsing() {
        assertEquals(ReferrerTier.GOLD, ReferrerTier.fromValue(" gold "));
        assertEquals(ReferrerTier.BRONZE, ReferrerTier.fromValue("diamond"));
        assertEquals(ReferrerTier.BRONZE, ReferrerTier.fromValue(null));
    }
}
