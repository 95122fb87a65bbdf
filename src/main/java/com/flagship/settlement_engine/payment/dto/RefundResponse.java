package com.flagship.settlement_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.payment.Refund;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RefundResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("gateway_refund_id")
    String gatewayRefundId;

    @JsonProperty("processed_by")
    String processedBy;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static RefundResponse from(Refund refund) {
        return RefundResponse.builder()
            .id(refund.getId())
            .paymentId(refund.getPaymentId())
            .amount(refund.getAmount())
            .reason(refund.getReason())
            .gatewayRefundId(refund.getGatewayRefundId())
            .processedBy(refund.getProcessedBy())
            .processedAt(refund.getProcessedAt())
            .build();
    }
}
