package com.flagship.settlement_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Settlement tunables bound from {@code settlement.*}.
 */
@ConfigurationProperties(prefix = "settlement")
@Getter
@Setter
public class SettlementProperties {

    private BigDecimal vatRate = new BigDecimal("0.17");
    private int paymentTermsDays = 30;
    private int overdueGraceDays = 5;
    /** Billing periods and seasonal adjustments are evaluated in this zone. */
    private String zone = "Asia/Jerusalem";
    private int workerThreads = 4;
    private long lockTimeoutMs = 10_000;
    /** Number of balance lock stripes; professionals hash onto them. */
    private int lockStripes = 1024;
    private BigDecimal overpaymentTolerance = BigDecimal.ZERO;
    private Payout payout = new Payout();

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    @Getter
    @Setter
    public static class Payout {
        /** Applies to BANK_TRANSFER and MANUAL_CHECK payouts. */
        private BigDecimal minimumAmount = new BigDecimal("100.00");
    }
}
