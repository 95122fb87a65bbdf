package com.flagship.settlement_engine.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for business-rule violations raised by the engine.
 *
 * Each subtype carries a stable error code that callers can match on and the
 * HTTP status the REST boundary answers with. These are never swallowed: they
 * either reach the caller through {@link GlobalExceptionHandler} or are
 * collected into a batch report.
 */
@Getter
public abstract class SettlementEngineException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;

    protected SettlementEngineException(String errorCode, HttpStatus status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected SettlementEngineException(String errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }
}
