package com.flagship.settlement_engine.commission.calculator;

import java.math.BigDecimal;
import java.time.Month;
import java.util.EnumMap;
import java.util.Map;

/**
 * Category demand seasons. Referrers earn more for sending work in a category's busy months.
 */
final class SeasonalMultipliers {

    private static final Map<String, Map<Month, BigDecimal>> BY_CATEGORY = Map.of(
        "renovation", season(
            Month.MARCH, "1.2", Month.APRIL, "1.3", Month.MAY, "1.2",
            Month.SEPTEMBER, "1.1", Month.OCTOBER, "1.1"),
        "cleaning", season(
            Month.MARCH, "1.4", Month.SEPTEMBER, "1.3", Month.DECEMBER, "1.2"),
        "tutoring", season(
            Month.AUGUST, "1.3", Month.SEPTEMBER, "1.2", Month.JANUARY, "1.1", Month.MAY, "1.1")
    );

    private SeasonalMultipliers() {
    }

    static BigDecimal multiplier(String category, Month month) {
        if (month == null) {
            return BigDecimal.ONE;
        }
        Map<Month, BigDecimal> season = BY_CATEGORY.get(category);
        if (season == null) {
            return BigDecimal.ONE;
        }
        return season.getOrDefault(month, BigDecimal.ONE);
    }

    private static Map<Month, BigDecimal> season(Object... monthAndMultiplier) {
        Map<Month, BigDecimal> season = new EnumMap<>(Month.class);
        for (int i = 0; i < monthAndMultiplier.length; i += 2) {
            season.put((Month) monthAndMultiplier[i], new BigDecimal((String) monthAndMultiplier[i + 1]));
        }
        return season;
    }
}
