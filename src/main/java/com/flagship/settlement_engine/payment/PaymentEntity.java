package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.gateway.GatewayProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payments.
 *
 * The idempotency key is a persistence concern and is passed to
 * {@link #fromDomain(Payment, String)} separately from the domain object.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    private static final int MAX_REASON_LENGTH = 1000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "payment_method", nullable = false, updatable = false, length = 128)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway_provider", nullable = false, updatable = false, length = 20)
    private GatewayProvider gatewayProvider;

    @Column(name = "gateway_transaction_id", length = 128)
    private String gatewayTransactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "failure_reason", length = MAX_REASON_LENGTH)
    private String failureReason;

    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "initiated_by", updatable = false, length = 64)
    private String initiatedBy;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        return new PaymentEntity(
            payment.getId(),
            payment.getInvoiceId(),
            payment.getProfessionalId(),
            payment.getAmount(),
            payment.getPaymentMethod(),
            payment.getGatewayProvider(),
            payment.getGatewayTransactionId(),
            payment.getStatus(),
            truncate(payment.getFailureReason()),
            payment.getRefundedAmount(),
            payment.getInitiatedBy(),
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Payment toDomain() {
        return new Payment(
            id,
            invoiceId,
            professionalId,
            amount,
            paymentMethod,
            gatewayProvider,
            gatewayTransactionId,
            status,
            failureReason,
            refundedAmount,
            initiatedBy,
            createdAt,
            updatedAt
        );
    }

    /**
     * Only the gateway outcome fields change after insert.
     */
    void updateFromDomain(Payment payment) {
        this.status = payment.getStatus();
        this.gatewayTransactionId = payment.getGatewayTransactionId();
        this.failureReason = truncate(payment.getFailureReason());
        this.refundedAmount = payment.getRefundedAmount();
    }

    private static String truncate(String reason) {
        return reason != null && reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
    }
}
