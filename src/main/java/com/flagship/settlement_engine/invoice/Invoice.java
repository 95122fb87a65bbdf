package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.InvoiceAlreadyPaidException;
import com.flagship.settlement_engine.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Monthly commission invoice for one professional.
 *
 * Totals are derived once at creation: subtotal is the sum of the line items,
 * VAT is the rounded subtotal × rate, total is their sum. Credits reduce the
 * amount due but never the total.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Invoice {
    UUID id;
    String invoiceNumber;
    String professionalId;
    BillingPeriod period;
    LocalDate issueDate;
    LocalDate dueDate;
    InvoiceStatus status;
    BigDecimal subtotal;
    BigDecimal vatRate;
    BigDecimal vatAmount;
    BigDecimal totalAmount;
    BigDecimal creditApplied;
    List<InvoiceLineItem> lineItems;
    Instant paidAt;
    String createdBy;
    Instant createdAt;

    public static Invoice draft(String professionalId, BillingPeriod period, List<InvoiceLineItem> lineItems,
                                BigDecimal vatRate, LocalDate issueDate, int paymentTermsDays, String createdBy) {
        if (lineItems.isEmpty()) {
            throw new ValidationException(ValidationException.NOTHING_TO_INVOICE,
                "No commission to invoice for " + professionalId);
        }
        UUID id = UUID.randomUUID();
        BigDecimal subtotal = lineItems.stream()
            .map(InvoiceLineItem::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
        BigDecimal vat = Money.round(subtotal.multiply(vatRate));
        String number = period.numberPrefix()
            + id.toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);

        return new Invoice(
            id,
            number,
            professionalId,
            period,
            issueDate,
            issueDate.plusDays(paymentTermsDays),
            InvoiceStatus.DRAFT,
            subtotal,
            vatRate,
            vat,
            subtotal.add(vat),
            Money.ZERO,
            List.copyOf(lineItems),
            null,
            createdBy,
            Instant.now()
        );
    }

    static Invoice restore(UUID id, String invoiceNumber, String professionalId, BillingPeriod period,
                           LocalDate issueDate, LocalDate dueDate, InvoiceStatus status,
                           BigDecimal subtotal, BigDecimal vatRate, BigDecimal vatAmount, BigDecimal totalAmount,
                           BigDecimal creditApplied, List<InvoiceLineItem> lineItems, Instant paidAt,
                           String createdBy, Instant createdAt) {
        return new Invoice(id, invoiceNumber, professionalId, period, issueDate, dueDate, status,
            subtotal, vatRate, vatAmount, totalAmount, creditApplied, List.copyOf(lineItems),
            paidAt, createdBy, createdAt);
    }

    public Invoice send() {
        if (status != InvoiceStatus.DRAFT) {
            throw transitionError("send");
        }
        return with(InvoiceStatus.SENT, creditApplied, paidAt);
    }

    /**
     * Applies invoice credit against the amount due.
     */
    public Invoice applyCredit(BigDecimal amount) {
        if (status != InvoiceStatus.DRAFT && status != InvoiceStatus.SENT) {
            throw transitionError("apply credit to");
        }
        if (amount.compareTo(amountDue()) > 0) {
            throw new ValidationException(String.format(
                "Credit %s exceeds amount due %s on invoice %s", amount, amountDue(), invoiceNumber));
        }
        return with(status, creditApplied.add(amount), paidAt);
    }

    public Invoice markPaid(Instant when) {
        if (status == InvoiceStatus.PAID) {
            throw new InvoiceAlreadyPaidException(id);
        }
        if (!status.isPayable()) {
            throw transitionError("pay");
        }
        return with(InvoiceStatus.PAID, creditApplied, when);
    }

    public Invoice markOverdue() {
        if (status != InvoiceStatus.SENT) {
            throw transitionError("mark overdue");
        }
        return with(InvoiceStatus.OVERDUE, creditApplied, paidAt);
    }

    public Invoice cancel() {
        if (status == InvoiceStatus.PAID || status == InvoiceStatus.CANCELLED) {
            throw transitionError("cancel");
        }
        return with(InvoiceStatus.CANCELLED, creditApplied, paidAt);
    }

    public BigDecimal amountDue() {
        return totalAmount.subtract(creditApplied);
    }

    /**
     * Unique slot key while the invoice is live; null once cancelled so the period can be invoiced again.
     */
    public String activePeriodKey() {
        return status == InvoiceStatus.CANCELLED ? null : period.activeKey(professionalId);
    }

    private InvalidStateTransitionException transitionError(String action) {
        return new InvalidStateTransitionException(String.format(
            "Cannot %s invoice %s in status %s", action, invoiceNumber, status));
    }

    private Invoice with(InvoiceStatus newStatus, BigDecimal newCreditApplied, Instant newPaidAt) {
        return new Invoice(id, invoiceNumber, professionalId, period, issueDate, dueDate, newStatus,
            subtotal, vatRate, vatAmount, totalAmount, newCreditApplied, lineItems, newPaidAt, createdBy, createdAt);
    }
}
