package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.settlement.SettlementError;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementErrorResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("run_id")
    UUID runId;

    @JsonProperty("professional_id")
    String professionalId;

    @JsonProperty("error_code")
    String errorCode;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static SettlementErrorResponse from(SettlementError error) {
        return SettlementErrorResponse.builder()
            .id(error.getId())
            .runId(error.getRunId())
            .professionalId(error.getProfessionalId())
            .errorCode(error.getErrorCode())
            .errorMessage(error.getErrorMessage())
            .occurredAt(error.getOccurredAt())
            .build();
    }
}
