package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.UUID;

public class AmountMismatchException extends SettlementEngineException {

    public AmountMismatchException(UUID invoiceId, BigDecimal expected, BigDecimal actual) {
        super("AMOUNT_MISMATCH", HttpStatus.BAD_REQUEST,
            String.format("Payment amount %s does not match amount due %s for invoice %s",
                actual, expected, invoiceId));
    }
}
