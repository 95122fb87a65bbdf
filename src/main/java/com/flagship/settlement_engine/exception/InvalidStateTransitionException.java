package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateTransitionException extends SettlementEngineException {

    public InvalidStateTransitionException(String message) {
        super("INVALID_STATE_TRANSITION", HttpStatus.CONFLICT, message);
    }
}
