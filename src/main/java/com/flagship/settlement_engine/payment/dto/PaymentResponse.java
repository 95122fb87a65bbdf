package com.flagship.settlement_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.gateway.GatewayProvider;
import com.flagship.settlement_engine.payment.Payment;
import com.flagship.settlement_engine.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("professional_id")
    String professionalId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("gateway_provider")
    GatewayProvider gatewayProvider;

    @JsonProperty("gateway_transaction_id")
    String gatewayTransactionId;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("initiated_by")
    String initiatedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .invoiceId(payment.getInvoiceId())
            .professionalId(payment.getProfessionalId())
            .amount(payment.getAmount())
            .paymentMethod(payment.getPaymentMethod())
            .gatewayProvider(payment.getGatewayProvider())
            .gatewayTransactionId(payment.getGatewayTransactionId())
            .status(payment.getStatus())
            .failureReason(payment.getFailureReason())
            .refundedAmount(payment.getRefundedAmount())
            .initiatedBy(payment.getInitiatedBy())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
