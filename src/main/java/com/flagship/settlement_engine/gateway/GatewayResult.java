package com.flagship.settlement_engine.gateway;

import lombok.Value;

/**
 * Outcome of a charge or refund call. Declines are values, not exceptions.
 */
@Value
public class GatewayResult {

    public enum Outcome {
        SUCCEEDED,
        /** Accepted; the final status arrives by webhook. */
        PENDING,
        DECLINED
    }

    Outcome outcome;
    String transactionId;
    String errorCode;
    String errorMessage;
    boolean retryable;

    public static GatewayResult succeeded(String transactionId) {
        return new GatewayResult(Outcome.SUCCEEDED, transactionId, null, null, false);
    }

    public static GatewayResult pending(String transactionId) {
        return new GatewayResult(Outcome.PENDING, transactionId, null, null, false);
    }

    public static GatewayResult declined(String transactionId, String errorCode, String errorMessage) {
        return new GatewayResult(Outcome.DECLINED, transactionId, errorCode, errorMessage, false);
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }

    public String failureReason() {
        if (errorCode == null) {
            return errorMessage;
        }
        return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
    }
}
