package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Money owed to a professional leaving their pending revenue shares.
 *
 * The initial status follows from the method:
 * - BANK_TRANSFER: QUEUED until bulk processing hands it to the bank
 * - CREDIT_TO_NEXT_INVOICE: COMPLETED at once, an invoice credit carries the value
 * - MANUAL_CHECK: PENDING_MANUAL until someone confirms the cheque was issued
 */
@Value
public class Payout {
    UUID id;
    String professionalId;
    BigDecimal amount;
    PayoutMethod method;
    PayoutStatus status;
    BankDetails bankDetails;
    String reference;
    String failureReason;
    String createdBy;
    Instant createdAt;
    Instant processedAt;

    public static Payout create(String professionalId, BigDecimal amount, PayoutMethod method,
                                BankDetails bankDetails, String reference, String createdBy, Instant now) {
        PayoutStatus status = switch (method) {
            case BANK_TRANSFER -> PayoutStatus.QUEUED;
            case CREDIT_TO_NEXT_INVOICE -> PayoutStatus.COMPLETED;
            case MANUAL_CHECK -> PayoutStatus.PENDING_MANUAL;
        };
        return new Payout(UUID.randomUUID(), professionalId, amount, method, status,
            method == PayoutMethod.BANK_TRANSFER ? bankDetails : null,
            reference, null, createdBy, now, status == PayoutStatus.COMPLETED ? now : null);
    }

    public Payout startProcessing() {
        if (status != PayoutStatus.QUEUED) {
            throw new InvalidStateTransitionException(String.format(
                "Payout %s is %s; only QUEUED payouts can be sent to the bank", id, status));
        }
        return with(PayoutStatus.PROCESSING, reference, null, null);
    }

    public Payout complete(String bankReference, Instant now) {
        if (status != PayoutStatus.PROCESSING && status != PayoutStatus.PENDING_MANUAL) {
            throw new InvalidStateTransitionException(String.format(
                "Payout %s is %s and cannot be completed", id, status));
        }
        return with(PayoutStatus.COMPLETED, bankReference != null ? bankReference : reference, null, now);
    }

    public Payout fail(String reason, Instant now) {
        if (status != PayoutStatus.PROCESSING) {
            throw new InvalidStateTransitionException(String.format(
                "Payout %s is %s and cannot fail", id, status));
        }
        return with(PayoutStatus.FAILED, reference, reason, now);
    }

    private Payout with(PayoutStatus newStatus, String newReference, String reason, Instant processed) {
        return new Payout(id, professionalId, amount, method, newStatus, bankDetails, newReference, reason,
            createdBy, createdAt, processed);
    }
}
