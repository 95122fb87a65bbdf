package com.flagship.settlement_engine.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.balance.BalanceMovement;
import com.flagship.settlement_engine.balance.MovementType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceMovementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("movement_type")
    MovementType movementType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("outstanding_after")
    BigDecimal outstandingAfter;

    @JsonProperty("pending_after")
    BigDecimal pendingAfter;

    @JsonProperty("net_after")
    BigDecimal netAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceMovementResponse from(BalanceMovement movement) {
        return BalanceMovementResponse.builder()
            .id(movement.getId())
            .movementType(movement.getMovementType())
            .amount(movement.getAmount())
            .referenceId(movement.getReferenceId())
            .outstandingAfter(movement.getOutstandingAfter())
            .pendingAfter(movement.getPendingAfter())
            .netAfter(movement.getNetAfter())
            .createdAt(movement.getCreatedAt())
            .build();
    }
}
