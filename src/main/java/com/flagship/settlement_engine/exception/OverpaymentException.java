package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

public class OverpaymentException extends SettlementEngineException {

    public OverpaymentException(String professionalId, BigDecimal amount, BigDecimal outstanding) {
        super("OVERPAYMENT", HttpStatus.BAD_REQUEST,
            String.format("Payment of %s exceeds outstanding commissions %s for professional %s",
                amount, outstanding, professionalId));
    }
}
