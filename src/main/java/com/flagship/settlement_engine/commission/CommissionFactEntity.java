package com.flagship.settlement_engine.commission;

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
 * JPA entity for commission_facts.
 *
 * Every money and identity column is updatable = false; only the settlement
 * columns can be written after insert.
 */
@Entity
@Table(name = "commission_facts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommissionFactEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false, length = 64)
    private String jobId;

    @Column(name = "payer_professional_id", nullable = false, updatable = false, length = 64)
    private String payerProfessionalId;

    @Column(name = "job_value", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal jobValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "commission_type", nullable = false, updatable = false, length = 20)
    private CommissionType commissionType;

    @Column(nullable = false, updatable = false, length = 50)
    private String category;

    @Column(nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal rate;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 7, scale = 2)
    private BigDecimal percentage;

    @Column(name = "recipient_id", nullable = false, updatable = false, length = 64)
    private String recipientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, updatable = false, length = 20)
    private RecipientType recipientType;

    @Column(name = "chain_level", nullable = false, updatable = false)
    private int chainLevel;

    @Column(updatable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CommissionFactStatus status;

    @Column(name = "invoice_id")
    private UUID invoiceId;

    @Column(name = "payment_id")
    private UUID paymentId;

    @Column(name = "job_completed_at", nullable = false, updatable = false)
    private Instant jobCompletedAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "recorded_by", updatable = false, length = 64)
    private String recordedBy;

    @PrePersist
    protected void onCreate() {
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    static CommissionFactEntity fromDomain(CommissionFact fact) {
        return new CommissionFactEntity(
            fact.getId(),
            fact.getJobId(),
            fact.getPayerProfessionalId(),
            fact.getJobValue(),
            fact.getCommissionType(),
            fact.getCategory(),
            fact.getRate(),
            fact.getAmount(),
            fact.getPercentage(),
            fact.getRecipientId(),
            fact.getRecipientType(),
            fact.getChainLevel(),
            fact.getDescription(),
            fact.getStatus(),
            fact.getInvoiceId(),
            fact.getPaymentId(),
            fact.getJobCompletedAt(),
            fact.getRecordedAt(),
            null,  // updatedAt - set by @PrePersist
            fact.getRecordedBy()
        );
    }

    public CommissionFact toDomain() {
        return new CommissionFact(id, jobId, payerProfessionalId, jobValue, commissionType, category, rate,
            amount, percentage, recipientId, recipientType, chainLevel, description,
            status, invoiceId, paymentId, jobCompletedAt, recordedAt, recordedBy);
    }

    void updateFromDomain(CommissionFact fact) {
        if (!fact.getId().equals(this.id)) {
            throw new IllegalArgumentException("Cannot update commission fact " + id + " from " + fact.getId());
        }
        this.status = fact.getStatus();
        this.invoiceId = fact.getInvoiceId();
        this.paymentId = fact.getPaymentId();
    }
}
