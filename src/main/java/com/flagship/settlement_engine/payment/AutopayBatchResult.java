package com.flagship.settlement_engine.payment;

import lombok.Value;

/**
 * Counts from one autopay run. Every candidate invoice lands in exactly one of
 * succeeded, pending, failed or skipped; exhausted is a subset of failed.
 */
@Value
public class AutopayBatchResult {
    int attempted;
    int succeeded;
    int pending;
    int failed;
    int exhausted;
    int skipped;

    static final class Counter {
        int attempted;
        int succeeded;
        int pending;
        int failed;
        int exhausted;
        int skipped;

        AutopayBatchResult toResult() {
            return new AutopayBatchResult(attempted, succeeded, pending, failed, exhausted, skipped);
        }
    }
}
