package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class InvoiceAlreadyPaidException extends SettlementEngineException {

    public InvoiceAlreadyPaidException(UUID invoiceId) {
        super("INVOICE_ALREADY_PAID", HttpStatus.CONFLICT, "Invoice " + invoiceId + " is already paid");
    }
}
