package com.flagship.settlement_engine.settlement;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SettlementError {
    UUID id;
    UUID runId;
    String professionalId;
    String errorCode;
    String errorMessage;
    Instant occurredAt;

    public static SettlementError of(UUID runId, String professionalId, String errorCode, String errorMessage,
                                     Instant now) {
        return new SettlementError(UUID.randomUUID(), runId, professionalId, errorCode, errorMessage, now);
    }
}
