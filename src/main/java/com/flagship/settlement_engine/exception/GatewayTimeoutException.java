package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

public class GatewayTimeoutException extends GatewayException {

    public GatewayTimeoutException(String provider, Throwable cause) {
        super("GATEWAY_TIMEOUT", HttpStatus.GATEWAY_TIMEOUT,
            "Timed out waiting for payment provider " + provider, cause);
    }
}
