package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

public class InsufficientBalanceException extends SettlementEngineException {

    public InsufficientBalanceException(String message) {
        super("INSUFFICIENT_BALANCE", HttpStatus.BAD_REQUEST, message);
    }

    public InsufficientBalanceException(String professionalId, BigDecimal requested, BigDecimal available) {
        this(String.format("Requested %s exceeds available %s for professional %s",
            requested, available, professionalId));
    }
}
