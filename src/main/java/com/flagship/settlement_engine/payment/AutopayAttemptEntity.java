package com.flagship.settlement_engine.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "autopay_attempts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AutopayAttemptEntity {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(nullable = false)
    private int attempts;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AutopayAttemptStatus status;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_payment_id")
    private UUID lastPaymentId;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static AutopayAttemptEntity fromDomain(AutopayAttempt attempt) {
        AutopayAttemptEntity entity = new AutopayAttemptEntity();
        entity.invoiceId = attempt.getInvoiceId();
        entity.professionalId = attempt.getProfessionalId();
        entity.updateFromDomain(attempt);
        return entity;
    }

    AutopayAttempt toDomain() {
        return new AutopayAttempt(invoiceId, professionalId, attempts, status, nextAttemptAt,
            lastPaymentId, lastError, updatedAt);
    }

    void updateFromDomain(AutopayAttempt attempt) {
        this.attempts = attempt.getAttempts();
        this.status = attempt.getStatus();
        this.nextAttemptAt = attempt.getNextAttemptAt();
        this.lastPaymentId = attempt.getLastPaymentId();
        String error = attempt.getLastError();
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
            ? error.substring(0, MAX_ERROR_LENGTH) : error;
        this.updatedAt = attempt.getUpdatedAt();
    }
}
