package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Money the platform owes a professional that is settled by reducing the
 * amount due on their next invoice instead of a bank transfer.
 */
@Value
public class InvoiceCredit {
    UUID id;
    String professionalId;
    BigDecimal amount;
    BigDecimal remainingAmount;
    UUID sourcePayoutId;
    UUID sourceInvoiceId;
    InvoiceCreditStatus status;
    UUID appliedInvoiceId;
    Instant createdAt;

    public static InvoiceCredit fromPayout(String professionalId, BigDecimal amount, UUID payoutId) {
        return new InvoiceCredit(UUID.randomUUID(), professionalId, amount, amount, payoutId, null,
            InvoiceCreditStatus.AVAILABLE, null, Instant.now());
    }

    /**
     * Credit handed back when the invoice that consumed it is cancelled.
     */
    public static InvoiceCredit returnedFrom(Invoice cancelled) {
        return new InvoiceCredit(UUID.randomUUID(), cancelled.getProfessionalId(), cancelled.getCreditApplied(),
            cancelled.getCreditApplied(), null, cancelled.getId(), InvoiceCreditStatus.AVAILABLE, null, Instant.now());
    }

    /**
     * Part of a paid invoice that covered debt an offset had already cleared.
     */
    public static InvoiceCredit overpaidOn(Invoice paid, BigDecimal excess) {
        return new InvoiceCredit(UUID.randomUUID(), paid.getProfessionalId(), excess, excess, null, paid.getId(),
            InvoiceCreditStatus.AVAILABLE, null, Instant.now());
    }

    /**
     * Uses up to {@code limit} of the remaining credit against an invoice.
     */
    public InvoiceCredit consume(BigDecimal limit, UUID invoiceId) {
        BigDecimal used = Money.min(remainingAmount, limit);
        BigDecimal left = remainingAmount.subtract(used);
        return new InvoiceCredit(id, professionalId, amount, left, sourcePayoutId, sourceInvoiceId,
            left.signum() == 0 ? InvoiceCreditStatus.CONSUMED : InvoiceCreditStatus.AVAILABLE,
            invoiceId, createdAt);
    }

    public BigDecimal usedSince(InvoiceCredit before) {
        return before.remainingAmount.subtract(remainingAmount);
    }
}
