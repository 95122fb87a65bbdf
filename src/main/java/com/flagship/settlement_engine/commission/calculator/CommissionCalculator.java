package com.flagship.settlement_engine.commission.calculator;

import com.flagship.settlement_engine.commission.RecipientType;
import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a job value and rate into a per-recipient commission breakdown.
 *
 * Pure computation, no I/O. Rules:
 * - base commission = jobValue × rate
 * - no referrer: a single platform line equal to the base
 * - one referrer: referrer gets base × tier multiplier, platform gets jobValue × platform rate
 * - longer chains: base is split over at most four levels with weights 60/25/10/5; every
 *   level but the deepest is rounded down and the deepest takes the remainder, so the levels
 *   always add up to the base exactly and no level goes negative
 *
 * Seasonal multipliers and penalty reductions touch referrer lines only. A recipient's
 * penalty reduction never exceeds 20% of their computed amount.
 */
@Component
@RequiredArgsConstructor
public class CommissionCalculator {

    public static final List<BigDecimal> LEVEL_WEIGHTS = List.of(
        new BigDecimal("0.60"),
        new BigDecimal("0.25"),
        new BigDecimal("0.10"),
        new BigDecimal("0.05")
    );
    public static final int MAX_SPLIT_LEVELS = LEVEL_WEIGHTS.size();
    public static final BigDecimal MAX_PENALTY_REDUCTION = new BigDecimal("0.20");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final CommissionRateProperties rates;

    public CommissionBreakdown computeCommission(BigDecimal jobValue, BigDecimal rate, String category,
                                                 ReferrerTier referrerTier, int chainLength) {
        return computeCommission(jobValue, rate, category, referrerTier, chainLength, CommissionAdjustments.NONE);
    }

    /**
     * Computes the breakdown for one job.
     *
     * @param jobValue accepted job price, must be positive
     * @param rate base commission rate in [0, 1]
     * @param category job category, used for the platform rate and seasonality
     * @param referrerTier tier of the direct referrer; only used when chainLength == 1
     * @param chainLength number of resolved referrers (0 for a direct customer job)
     * @param adjustments season and per-level penalty profiles
     * @throws ValidationException on non-positive job value, rate outside [0, 1] or negative chain length
     */
    public CommissionBreakdown computeCommission(BigDecimal jobValue, BigDecimal rate, String category,
                                                 ReferrerTier referrerTier, int chainLength,
                                                 CommissionAdjustments adjustments) {
        validate(jobValue, rate, chainLength);

        String normalizedCategory = CommissionRateProperties.normalizeCategory(category);
        BigDecimal base = Money.round(jobValue.multiply(rate));

        if (chainLength == 0) {
            BreakdownLine platform = line(RecipientType.PLATFORM, 0, base, jobValue,
                "Platform commission, " + normalizedCategory);
            return new CommissionBreakdown(jobValue, rate, BigDecimal.ZERO, List.of(platform));
        }

        CommissionAdjustments applied = adjustments != null ? adjustments : CommissionAdjustments.NONE;
        BigDecimal seasonal = SeasonalMultipliers.multiplier(normalizedCategory, applied.getSeasonMonth());
        List<BreakdownLine> lines = new ArrayList<>();

        if (chainLength == 1) {
            ReferrerTier tier = referrerTier != null ? referrerTier : ReferrerTier.BRONZE;
            BigDecimal nominal = Money.round(base.multiply(tier.getMultiplier()).multiply(seasonal));
            BigDecimal amount = applyPenalty(nominal, applied.penaltyForLevel(0).reductionRate());
            lines.add(line(RecipientType.REFERRER, 0, amount, jobValue,
                "Referrer commission, " + tier.name().toLowerCase(Locale.ROOT) + " tier"));
        } else {
            int levels = Math.min(chainLength, MAX_SPLIT_LEVELS);
            BigDecimal seasonalBase = Money.round(base.multiply(seasonal));
            List<BigDecimal> split = splitAcrossLevels(seasonalBase, levels);
            for (int level = 0; level < levels; level++) {
                BigDecimal amount = applyPenalty(split.get(level), applied.penaltyForLevel(level).reductionRate());
                lines.add(line(RecipientType.REFERRER, level, amount, jobValue,
                    "Referrer commission, level " + (level + 1) + " of " + levels));
            }
        }

        BigDecimal platformRate = rates.platformRate(normalizedCategory);
        BigDecimal platformAmount = Money.round(jobValue.multiply(platformRate));
        lines.add(line(RecipientType.PLATFORM, 0, platformAmount, jobValue,
            "Platform commission, " + normalizedCategory));

        return new CommissionBreakdown(jobValue, rate, platformRate, List.copyOf(lines));
    }

    /**
     * Splits an amount over the first {@code levels} weights. Shallower levels are rounded
     * down to the cent; the deepest level receives what they leave, including the unused weights.
     */
    static List<BigDecimal> splitAcrossLevels(BigDecimal amount, int levels) {
        List<BigDecimal> split = new ArrayList<>(levels);
        BigDecimal allocated = BigDecimal.ZERO;
        for (int level = 0; level < levels - 1; level++) {
            BigDecimal share = amount.multiply(LEVEL_WEIGHTS.get(level)).setScale(Money.SCALE, RoundingMode.DOWN);
            split.add(share);
            allocated = allocated.add(share);
        }
        split.add(Money.round(amount.subtract(allocated)));
        return split;
    }

    static BigDecimal applyPenalty(BigDecimal amount, BigDecimal reductionRate) {
        if (reductionRate == null || reductionRate.signum() <= 0) {
            return amount;
        }
        BigDecimal cappedRate = reductionRate.min(MAX_PENALTY_REDUCTION);
        BigDecimal reduction = Money.round(amount.multiply(cappedRate));
        return amount.subtract(reduction);
    }

    private BreakdownLine line(RecipientType type, int level, BigDecimal amount, BigDecimal jobValue,
                               String description) {
        BigDecimal percentage = amount.multiply(HUNDRED).divide(jobValue, 2, RoundingMode.HALF_UP);
        return new BreakdownLine(type, level, amount, percentage, description);
    }

    private void validate(BigDecimal jobValue, BigDecimal rate, int chainLength) {
        ValidationException.requirePositive(jobValue, "Job value");
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("Commission rate must be between 0 and 1, got " + rate);
        }
        if (chainLength < 0) {
            throw new ValidationException("Chain length cannot be negative, got " + chainLength);
        }
    }
}
