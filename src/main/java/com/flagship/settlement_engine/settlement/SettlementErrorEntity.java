package com.flagship.settlement_engine.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "settlement_errors")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementErrorEntity {

    private static final int MAX_MESSAGE_LENGTH = 2000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(name = "error_code", nullable = false, updatable = false, length = 60)
    private String errorCode;

    @Column(name = "error_message", updatable = false, length = MAX_MESSAGE_LENGTH)
    private String errorMessage;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    static SettlementErrorEntity fromDomain(SettlementError error) {
        String message = error.getErrorMessage();
        if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
        return new SettlementErrorEntity(error.getId(), error.getRunId(), error.getProfessionalId(),
            error.getErrorCode(), message, error.getOccurredAt());
    }

    public SettlementError toDomain() {
        return new SettlementError(id, runId, professionalId, errorCode, errorMessage, occurredAt);
    }
}
