package com.flagship.settlement_engine.commission;

import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One recipient's commission on one job.
 *
 * Immutable apart from the settlement fields: status, invoiceId and paymentId
 * change through the transition methods below, each returning a new instance.
 */
@Value
public class CommissionFact {
    UUID id;
    String jobId;
    String payerProfessionalId;
    BigDecimal jobValue;
    CommissionType commissionType;
    String category;
    BigDecimal rate;
    BigDecimal amount;
    BigDecimal percentage;
    String recipientId;
    RecipientType recipientType;
    int chainLevel;
    String description;
    CommissionFactStatus status;
    UUID invoiceId;
    UUID paymentId;
    Instant jobCompletedAt;
    Instant recordedAt;
    String recordedBy;

    public static CommissionFact record(JobCompletion job, BigDecimal rate, String category,
                                        Instant completedAt, CommissionAllocation allocation) {
        return new CommissionFact(
            UUID.randomUUID(),
            job.getJobId(),
            job.getProfessionalId(),
            job.getJobValue(),
            job.getCommissionType(),
            category,
            rate,
            allocation.getAmount(),
            allocation.getPercentage(),
            allocation.getRecipientId(),
            allocation.getRecipientType(),
            allocation.getChainLevel(),
            allocation.getDescription(),
            CommissionFactStatus.RECORDED,
            null,
            null,
            completedAt,
            Instant.now(),
            job.getRecordedBy()
        );
    }

    public CommissionFact markInvoiced(UUID invoiceId) {
        requireStatus(CommissionFactStatus.RECORDED, "invoice");
        return withSettlement(CommissionFactStatus.INVOICED, invoiceId, null);
    }

    public CommissionFact markPaid(UUID paymentId) {
        requireStatus(CommissionFactStatus.INVOICED, "mark paid");
        return withSettlement(CommissionFactStatus.PAID, invoiceId, paymentId);
    }

    public CommissionFact releaseFromInvoice() {
        requireStatus(CommissionFactStatus.INVOICED, "release");
        return withSettlement(CommissionFactStatus.RECORDED, null, null);
    }

    public boolean isPlatformFact() {
        return recipientType == RecipientType.PLATFORM;
    }

    private void requireStatus(CommissionFactStatus expected, String action) {
        if (status != expected) {
            throw new InvalidStateTransitionException(String.format(
                "Cannot %s commission fact %s: status is %s, expected %s", action, id, status, expected));
        }
    }

    private CommissionFact withSettlement(CommissionFactStatus newStatus, UUID newInvoiceId, UUID newPaymentId) {
        return new CommissionFact(id, jobId, payerProfessionalId, jobValue, commissionType, category, rate,
            amount, percentage, recipientId, recipientType, chainLevel, description,
            newStatus, newInvoiceId, newPaymentId, jobCompletedAt, recordedAt, recordedBy);
    }
}
