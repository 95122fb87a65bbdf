package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

/**
 * Bad input: negative amount, rate outside 0..1, unknown enum value, nothing to invoice.
 */
public class ValidationException extends SettlementEngineException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String NOTHING_TO_INVOICE = "NOTHING_TO_INVOICE";

    public ValidationException(String message) {
        super(VALIDATION_ERROR, HttpStatus.BAD_REQUEST, message);
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, HttpStatus.BAD_REQUEST, message);
    }

    public static void requirePositive(BigDecimal amount, String field) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(field + " must be greater than 0, got " + amount);
        }
    }
}
