package com.flagship.settlement_engine.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ChargeRequest {
    UUID paymentId;
    UUID invoiceId;
    String professionalId;
    BigDecimal amount;
    String currency;
    /** Provider token for the card or account to charge. */
    String paymentMethod;
    String description;
}
