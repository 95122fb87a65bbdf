package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.settlement.Payout;
import com.flagship.settlement_engine.settlement.PayoutMethod;
import com.flagship.settlement_engine.settlement.PayoutStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("professional_id")
    String professionalId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payout_method")
    PayoutMethod payoutMethod;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("bank_details")
    BankDetailsDto bankDetails;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static PayoutResponse from(Payout payout) {
        return PayoutResponse.builder()
            .id(payout.getId())
            .professionalId(payout.getProfessionalId())
            .amount(payout.getAmount())
            .payoutMethod(payout.getMethod())
            .status(payout.getStatus())
            .bankDetails(BankDetailsDto.from(payout.getBankDetails()))
            .reference(payout.getReference())
            .failureReason(payout.getFailureReason())
            .createdBy(payout.getCreatedBy())
            .createdAt(payout.getCreatedAt())
            .processedAt(payout.getProcessedAt())
            .build();
    }
}
