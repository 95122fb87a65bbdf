package com.flagship.settlement_engine.invoice;

import lombok.Value;

/**
 * Result of asking for a professional's invoice for a period: either a new
 * invoice or the live one that already covers the period.
 */
@Value
public class InvoiceGeneration {

    public enum Outcome {
        CREATED,
        ALREADY_INVOICED
    }

    Outcome outcome;
    Invoice invoice;

    public static InvoiceGeneration created(Invoice invoice) {
        return new InvoiceGeneration(Outcome.CREATED, invoice);
    }

    public static InvoiceGeneration existing(Invoice invoice) {
        return new InvoiceGeneration(Outcome.ALREADY_INVOICED, invoice);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
