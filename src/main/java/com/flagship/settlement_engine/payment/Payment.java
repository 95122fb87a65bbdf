package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.gateway.GatewayProvider;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A charge against one invoice through one gateway.
 *
 * Key principles:
 * - a payment is created PROCESSING before the gateway is called, so an
 *   in-flight charge is always visible to other callers
 * - COMPLETED and FAILED are final for the charge itself; only refunds move a
 *   COMPLETED payment further
 * - every transition returns a new Payment
 */
@Value
public class Payment {
    UUID id;
    UUID invoiceId;
    String professionalId;
    BigDecimal amount;
    String paymentMethod;
    GatewayProvider gatewayProvider;
    String gatewayTransactionId;
    PaymentStatus status;
    String failureReason;
    BigDecimal refundedAmount;
    String initiatedBy;
    Instant createdAt;
    Instant updatedAt;

    public static Payment initiate(UUID invoiceId, String professionalId, BigDecimal amount,
                                   String paymentMethod, GatewayProvider provider, String initiatedBy) {
        Instant now = Instant.now();
        return new Payment(
            UUID.randomUUID(),
            invoiceId,
            professionalId,
            amount,
            paymentMethod,
            provider,
            null,
            PaymentStatus.PROCESSING,
            null,
            BigDecimal.ZERO.setScale(2),
            initiatedBy,
            now,
            now
        );
    }

    /**
     * The gateway accepted the charge but confirms it later by webhook.
     */
    public Payment awaitConfirmation(String transactionId) {
        requireStatus(PaymentStatus.PROCESSING, "await confirmation for");
        return with(PaymentStatus.PROCESSING, transactionId, null, refundedAmount);
    }

    public Payment complete(String transactionId) {
        requireStatus(PaymentStatus.PROCESSING, "complete");
        return with(PaymentStatus.COMPLETED, transactionId != null ? transactionId : gatewayTransactionId,
            null, refundedAmount);
    }

    public Payment fail(String reason, String transactionId) {
        requireStatus(PaymentStatus.PROCESSING, "fail");
        return with(PaymentStatus.FAILED, transactionId != null ? transactionId : gatewayTransactionId,
            reason, refundedAmount);
    }

    /**
     * Adds a refund. The payment becomes REFUNDED once the cumulative refunds reach its amount.
     */
    public Payment recordRefund(BigDecimal refund) {
        requireStatus(PaymentStatus.COMPLETED, "refund");
        if (refund.compareTo(refundableAmount()) > 0) {
            throw new ValidationException(String.format(
                "Refund %s exceeds refundable amount %s of payment %s", refund, refundableAmount(), id));
        }
        BigDecimal total = refundedAmount.add(refund);
        PaymentStatus next = total.compareTo(amount) == 0 ? PaymentStatus.REFUNDED : PaymentStatus.COMPLETED;
        return with(next, gatewayTransactionId, failureReason, total);
    }

    public BigDecimal refundableAmount() {
        return amount.subtract(refundedAmount);
    }

    public boolean isFinal() {
        return status != PaymentStatus.PROCESSING;
    }

    private void requireStatus(PaymentStatus expected, String action) {
        if (status != expected) {
            throw new InvalidStateTransitionException(String.format(
                "Cannot %s payment %s in %s status. Only %s payments allowed.", action, id, status, expected));
        }
    }

    private Payment with(PaymentStatus newStatus, String transactionId, String reason, BigDecimal refunded) {
        return new Payment(id, invoiceId, professionalId, amount, paymentMethod, gatewayProvider,
            transactionId, newStatus, reason, refunded, initiatedBy, createdAt, Instant.now());
    }
}
