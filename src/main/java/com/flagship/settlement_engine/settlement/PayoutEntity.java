package com.flagship.settlement_engine.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Bank details are stored flat on the payout row; a payout without them has all five columns null.
 */
@Entity
@Table(name = "payouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutEntity {

    private static final int MAX_REASON_LENGTH = 1000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payout_method", nullable = false, updatable = false, length = 30)
    private PayoutMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "bank_name", updatable = false, length = 100)
    private String bankName;

    @Column(name = "branch_number", updatable = false, length = 20)
    private String branchNumber;

    @Column(name = "account_number", updatable = false, length = 40)
    private String accountNumber;

    @Column(name = "account_holder_name", updatable = false, length = 120)
    private String accountHolderName;

    @Column(name = "swift_code", updatable = false, length = 20)
    private String swiftCode;

    @Column(length = 128)
    private String reference;

    @Column(name = "failure_reason", length = MAX_REASON_LENGTH)
    private String failureReason;

    @Column(name = "created_by", updatable = false, length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    static PayoutEntity fromDomain(Payout payout) {
        BankDetails bank = payout.getBankDetails();
        return new PayoutEntity(
            payout.getId(),
            payout.getProfessionalId(),
            payout.getAmount(),
            payout.getMethod(),
            payout.getStatus(),
            bank != null ? bank.getBankName() : null,
            bank != null ? bank.getBranchNumber() : null,
            bank != null ? bank.getAccountNumber() : null,
            bank != null ? bank.getAccountHolderName() : null,
            bank != null ? bank.getSwiftCode() : null,
            payout.getReference(),
            truncate(payout.getFailureReason()),
            payout.getCreatedBy(),
            payout.getCreatedAt(),
            payout.getProcessedAt()
        );
    }

    public Payout toDomain() {
        BankDetails bank = bankName == null && accountNumber == null ? null
            : new BankDetails(bankName, branchNumber, accountNumber, accountHolderName, swiftCode);
        return new Payout(id, professionalId, amount, method, status, bank, reference, failureReason,
            createdBy, createdAt, processedAt);
    }

    void updateFromDomain(Payout payout) {
        this.status = payout.getStatus();
        this.reference = payout.getReference();
        this.failureReason = truncate(payout.getFailureReason());
        this.processedAt = payout.getProcessedAt();
    }

    private static String truncate(String reason) {
        return reason != null && reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
    }
}
