package com.flagship.settlement_engine.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A payment provider failed in a way that is not a plain decline.
 */
@Getter
public class GatewayException extends SettlementEngineException {

    private final boolean retryable;

    public GatewayException(String message, boolean retryable) {
        super("GATEWAY_ERROR", HttpStatus.BAD_GATEWAY, message);
        this.retryable = retryable;
    }

    public GatewayException(String message, boolean retryable, Throwable cause) {
        super("GATEWAY_ERROR", HttpStatus.BAD_GATEWAY, message, cause);
        this.retryable = retryable;
    }

    protected GatewayException(String errorCode, HttpStatus status, String message, Throwable cause) {
        super(errorCode, status, message, cause);
        this.retryable = true;
    }
}
