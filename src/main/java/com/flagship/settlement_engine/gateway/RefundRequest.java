package com.flagship.settlement_engine.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class RefundRequest {
    UUID paymentId;
    String transactionId;
    BigDecimal amount;
    String currency;
    String reason;
}
