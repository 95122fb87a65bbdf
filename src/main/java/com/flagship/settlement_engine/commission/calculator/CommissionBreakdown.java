package com.flagship.settlement_engine.commission.calculator;

import com.flagship.settlement_engine.commission.RecipientType;
import com.flagship.settlement_engine.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a commission calculation: referrer lines ordered by level, then the platform line.
 */
@Value
public class CommissionBreakdown {
    BigDecimal jobValue;
    BigDecimal baseRate;
    BigDecimal platformRate;
    List<BreakdownLine> lines;

    public BigDecimal total() {
        return lines.stream()
            .map(BreakdownLine::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    public List<BreakdownLine> referrerLines() {
        return lines.stream()
            .filter(line -> line.getRecipientType() == RecipientType.REFERRER)
            .toList();
    }

    public BigDecimal platformAmount() {
        return lines.stream()
            .filter(line -> line.getRecipientType() == RecipientType.PLATFORM)
            .map(BreakdownLine::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    /**
     * Base rate plus platform rate; what the percentages of all lines add up to.
     */
    public BigDecimal nominalRate() {
        return baseRate.add(platformRate);
    }

    public BigDecimal totalPercentage() {
        return lines.stream()
            .map(BreakdownLine::getPercentage)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
