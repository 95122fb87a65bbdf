package com.flagship.settlement_engine.invoice.event;

import com.flagship.settlement_engine.common.SettlementEvent;
import com.flagship.settlement_engine.invoice.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when an invoice is sent to a professional. The notification
 * service formats and delivers it.
 */
@Value
public class InvoiceIssuedEvent implements SettlementEvent {
    UUID eventId;
    UUID invoiceId;
    String invoiceNumber;
    String professionalId;
    int periodMonth;
    int periodYear;
    BigDecimal subtotal;
    BigDecimal vatAmount;
    BigDecimal totalAmount;
    BigDecimal creditApplied;
    BigDecimal amountDue;
    LocalDate dueDate;
    String status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceIssued";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return invoiceId.toString();
    }

    public static InvoiceIssuedEvent fromInvoice(Invoice invoice) {
        return new InvoiceIssuedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getProfessionalId(),
            invoice.getPeriod().getMonth(),
            invoice.getPeriod().getYear(),
            invoice.getSubtotal(),
            invoice.getVatAmount(),
            invoice.getTotalAmount(),
            invoice.getCreditApplied(),
            invoice.amountDue(),
            invoice.getDueDate(),
            invoice.getStatus().name(),
            Instant.now()
        );
    }
}
