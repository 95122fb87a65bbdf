package com.flagship.settlement_engine.commission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.commission.CommissionFact;
import com.flagship.settlement_engine.commission.CommissionFactStatus;
import com.flagship.settlement_engine.commission.CommissionType;
import com.flagship.settlement_engine.commission.RecipientType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CommissionFactResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("job_id")
    String jobId;

    @JsonProperty("payer_professional_id")
    String payerProfessionalId;

    @JsonProperty("job_value")
    BigDecimal jobValue;

    @JsonProperty("commission_type")
    CommissionType commissionType;

    @JsonProperty("category")
    String category;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonProperty("recipient_id")
    String recipientId;

    @JsonProperty("recipient_type")
    RecipientType recipientType;

    @JsonProperty("chain_level")
    int chainLevel;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    CommissionFactStatus status;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("job_completed_at")
    Instant jobCompletedAt;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    @JsonProperty("recorded_by")
    String recordedBy;

    public static CommissionFactResponse from(CommissionFact fact) {
        return CommissionFactResponse.builder()
            .id(fact.getId())
            .jobId(fact.getJobId())
            .payerProfessionalId(fact.getPayerProfessionalId())
            .jobValue(fact.getJobValue())
            .commissionType(fact.getCommissionType())
            .category(fact.getCategory())
            .rate(fact.getRate())
            .amount(fact.getAmount())
            .percentage(fact.getPercentage())
            .recipientId(fact.getRecipientId())
            .recipientType(fact.getRecipientType())
            .chainLevel(fact.getChainLevel())
            .description(fact.getDescription())
            .status(fact.getStatus())
            .invoiceId(fact.getInvoiceId())
            .paymentId(fact.getPaymentId())
            .jobCompletedAt(fact.getJobCompletedAt())
            .recordedAt(fact.getRecordedAt())
            .recordedBy(fact.getRecordedBy())
            .build();
    }
}
