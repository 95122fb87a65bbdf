package com.flagship.settlement_engine.invoice;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_number", nullable = false, updatable = false, length = 40)
    private String invoiceNumber;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(name = "period_month", nullable = false, updatable = false)
    private int periodMonth;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int periodYear;

    @Column(name = "active_period_key", length = 100)
    private String activePeriodKey;

    @Column(name = "issue_date", nullable = false, updatable = false)
    private LocalDate issueDate;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "vat_rate", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal vatRate;

    @Column(name = "vat_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal vatAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "credit_applied", nullable = false, precision = 19, scale = 2)
    private BigDecimal creditApplied;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "invoice_line_items", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "line_number")
    private List<InvoiceLineItemEmbeddable> lineItems = new ArrayList<>();

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_by", updatable = false, length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    static InvoiceEntity fromDomain(Invoice invoice) {
        return new InvoiceEntity(
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getProfessionalId(),
            invoice.getPeriod().getMonth(),
            invoice.getPeriod().getYear(),
            invoice.activePeriodKey(),
            invoice.getIssueDate(),
            invoice.getDueDate(),
            invoice.getStatus(),
            invoice.getSubtotal(),
            invoice.getVatRate(),
            invoice.getVatAmount(),
            invoice.getTotalAmount(),
            invoice.getCreditApplied(),
            new ArrayList<>(invoice.getLineItems().stream().map(InvoiceLineItemEmbeddable::fromDomain).toList()),
            invoice.getPaidAt(),
            invoice.getCreatedBy(),
            invoice.getCreatedAt(),
            null,  // updatedAt - set by @PrePersist
            null   // version - assigned on persist
        );
    }

    public Invoice toDomain() {
        return Invoice.restore(
            id,
            invoiceNumber,
            professionalId,
            new BillingPeriod(periodMonth, periodYear),
            issueDate,
            dueDate,
            status,
            subtotal,
            vatRate,
            vatAmount,
            totalAmount,
            creditApplied,
            lineItems.stream().map(InvoiceLineItemEmbeddable::toDomain).toList(),
            paidAt,
            createdBy,
            createdAt
        );
    }

    /**
     * Only the lifecycle fields move after creation.
     */
    void updateFromDomain(Invoice invoice) {
        if (!invoice.getId().equals(this.id)) {
            throw new IllegalArgumentException("Cannot update invoice " + id + " from " + invoice.getId());
        }
        this.status = invoice.getStatus();
        this.activePeriodKey = invoice.activePeriodKey();
        this.creditApplied = invoice.getCreditApplied();
        this.paidAt = invoice.getPaidAt();
    }
}
