package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.settlement.OffsetRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class OffsetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("professional_a_id")
    String professionalAId;

    @JsonProperty("professional_b_id")
    String professionalBId;

    @JsonProperty("offset_amount")
    BigDecimal offsetAmount;

    @JsonProperty("description")
    String description;

    @JsonProperty("processed_by")
    String processedBy;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static OffsetResponse from(OffsetRecord offset) {
        return OffsetResponse.builder()
            .id(offset.getId())
            .professionalAId(offset.getProfessionalAId())
            .professionalBId(offset.getProfessionalBId())
            .offsetAmount(offset.getOffsetAmount())
            .description(offset.getDescription())
            .processedBy(offset.getProcessedBy())
            .processedAt(offset.getProcessedAt())
            .build();
    }
}
