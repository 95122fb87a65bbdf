package com.flagship.settlement_engine.commission.calculator;

import com.flagship.settlement_engine.commission.CommissionType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Commission rate table bound from {@code commission.*}.
 *
 * Type defaults apply when a category has no override of its own; categories
 * missing from the table fall back to the default platform rate.
 */
@ConfigurationProperties(prefix = "commission")
@Getter
@Setter
public class CommissionRateProperties {

    public static final String DEFAULT_CATEGORY = "general";

    private BigDecimal customerJobRate = new BigDecimal("0.10");
    private BigDecimal referralJobRate = new BigDecimal("0.05");
    private BigDecimal defaultPlatformRate = new BigDecimal("0.05");
    private Map<String, CategoryRates> categories = new HashMap<>();

    public BigDecimal platformRate(String category) {
        CategoryRates rates = categories.get(normalizeCategory(category));
        if (rates != null && rates.getPlatformRate() != null) {
            return rates.getPlatformRate();
        }
        return defaultPlatformRate;
    }

    /**
     * Rate used when the caller does not supply one.
     */
    public BigDecimal defaultRate(CommissionType type, String category) {
        CategoryRates rates = categories.get(normalizeCategory(category));
        if (type == CommissionType.REFERRAL_JOB) {
            return rates != null && rates.getReferralRate() != null ? rates.getReferralRate() : referralJobRate;
        }
        return rates != null && rates.getCustomerRate() != null ? rates.getCustomerRate() : customerJobRate;
    }

    public static String normalizeCategory(String category) {
        if (category == null || category.isBlank()) {
            return DEFAULT_CATEGORY;
        }
        return category.trim().toLowerCase(Locale.ROOT);
    }

    @Getter
    @Setter
    public static class CategoryRates {
        private BigDecimal customerRate;
        private BigDecimal referralRate;
        private BigDecimal platformRate;
    }
}
