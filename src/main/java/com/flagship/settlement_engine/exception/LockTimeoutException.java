package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

/**
 * A per-professional balance lock could not be acquired in time. Safe to retry.
 */
public class LockTimeoutException extends SettlementEngineException {

    public LockTimeoutException(String professionalId, long timeoutMs) {
        super("LOCK_TIMEOUT", HttpStatus.CONFLICT,
            "Timed out after " + timeoutMs + "ms waiting for balance lock of professional " + professionalId);
    }
}
