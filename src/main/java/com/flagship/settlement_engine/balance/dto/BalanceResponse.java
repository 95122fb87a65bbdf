package com.flagship.settlement_engine.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.balance.Balance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("professional_id")
    String professionalId;

    @JsonProperty("outstanding_commissions")
    BigDecimal outstandingCommissions;

    @JsonProperty("pending_revenue_shares")
    BigDecimal pendingRevenueShares;

    @JsonProperty("net_balance")
    BigDecimal netBalance;

    @JsonProperty("autopay_enabled")
    boolean autopayEnabled;

    @JsonProperty("autopay_payment_method_id")
    String autopayPaymentMethodId;

    @JsonProperty("last_updated")
    Instant lastUpdated;

    public static BalanceResponse from(Balance balance) {
        return BalanceResponse.builder()
            .professionalId(balance.getProfessionalId())
            .outstandingCommissions(balance.getOutstandingCommissions())
            .pendingRevenueShares(balance.getPendingRevenueShares())
            .netBalance(balance.getNetBalance())
            .autopayEnabled(balance.isAutopayEnabled())
            .autopayPaymentMethodId(balance.getAutopayPaymentMethodId())
            .lastUpdated(balance.getLastUpdated())
            .build();
    }
}
