package com.flagship.settlement_engine.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Row of invoice_line_items; position is kept by the owning collection's order column.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceLineItemEmbeddable {

    @Column(name = "commission_fact_id", nullable = false)
    private UUID commissionFactId;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "description")
    private String description;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    static InvoiceLineItemEmbeddable fromDomain(InvoiceLineItem item) {
        return new InvoiceLineItemEmbeddable(item.getCommissionFactId(), item.getJobId(),
            item.getDescription(), item.getAmount());
    }

    InvoiceLineItem toDomain() {
        return new InvoiceLineItem(commissionFactId, jobId, description, amount);
    }
}
