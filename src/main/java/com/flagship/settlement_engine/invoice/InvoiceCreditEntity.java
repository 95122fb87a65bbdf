package com.flagship.settlement_engine.invoice;

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

@Entity
@Table(name = "invoice_credits")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceCreditEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "remaining_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal remainingAmount;

    @Column(name = "source_payout_id", updatable = false)
    private UUID sourcePayoutId;

    @Column(name = "source_invoice_id", updatable = false)
    private UUID sourceInvoiceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceCreditStatus status;

    @Column(name = "applied_invoice_id")
    private UUID appliedInvoiceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    static InvoiceCreditEntity fromDomain(InvoiceCredit credit) {
        return new InvoiceCreditEntity(credit.getId(), credit.getProfessionalId(), credit.getAmount(),
            credit.getRemainingAmount(), credit.getSourcePayoutId(), credit.getSourceInvoiceId(),
            credit.getStatus(), credit.getAppliedInvoiceId(), credit.getCreatedAt(), null);
    }

    public InvoiceCredit toDomain() {
        return new InvoiceCredit(id, professionalId, amount, remainingAmount, sourcePayoutId, sourceInvoiceId,
            status, appliedInvoiceId, createdAt);
    }

    void updateFromDomain(InvoiceCredit credit) {
        this.remainingAmount = credit.getRemainingAmount();
        this.status = credit.getStatus();
        this.appliedInvoiceId = credit.getAppliedInvoiceId();
    }
}
