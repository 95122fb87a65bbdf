package com.flagship.settlement_engine.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceLineItem;
import com.flagship.settlement_engine.invoice.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("professional_id")
    String professionalId;

    @JsonProperty("period_month")
    int periodMonth;

    @JsonProperty("period_year")
    int periodYear;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("vat_rate")
    BigDecimal vatRate;

    @JsonProperty("vat_amount")
    BigDecimal vatAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("credit_applied")
    BigDecimal creditApplied;

    @JsonProperty("amount_due")
    BigDecimal amountDue;

    @JsonProperty("line_items")
    List<LineItem> lineItems;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("created_by")
    String createdBy;

    @Value
    public static class LineItem {
        @JsonProperty("commission_fact_id")
        UUID commissionFactId;

        @JsonProperty("job_id")
        String jobId;

        @JsonProperty("description")
        String description;

        @JsonProperty("amount")
        BigDecimal amount;

        static LineItem from(InvoiceLineItem item) {
            return new LineItem(item.getCommissionFactId(), item.getJobId(), item.getDescription(), item.getAmount());
        }
    }

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .professionalId(invoice.getProfessionalId())
            .periodMonth(invoice.getPeriod().getMonth())
            .periodYear(invoice.getPeriod().getYear())
            .issueDate(invoice.getIssueDate())
            .dueDate(invoice.getDueDate())
            .status(invoice.getStatus())
            .subtotal(invoice.getSubtotal())
            .vatRate(invoice.getVatRate())
            .vatAmount(invoice.getVatAmount())
            .totalAmount(invoice.getTotalAmount())
            .creditApplied(invoice.getCreditApplied())
            .amountDue(invoice.amountDue())
            .lineItems(invoice.getLineItems().stream().map(LineItem::from).toList())
            .paidAt(invoice.getPaidAt())
            .createdBy(invoice.getCreatedBy())
            .build();
    }
}
