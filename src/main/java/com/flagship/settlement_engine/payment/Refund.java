package com.flagship.settlement_engine.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class Refund {
    UUID id;
    UUID paymentId;
    BigDecimal amount;
    String reason;
    String gatewayRefundId;
    String processedBy;
    Instant processedAt;

    public static Refund of(UUID paymentId, BigDecimal amount, String reason,
                            String gatewayRefundId, String processedBy) {
        return new Refund(UUID.randomUUID(), paymentId, amount, reason, gatewayRefundId, processedBy, Instant.now());
    }
}
