package com.flagship.settlement_engine.payment;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Automatic charge tracking for one invoice.
 *
 * Each charge that does not complete counts as an attempt and pushes the next one
 * back by the retry delay. After the maximum number of attempts the invoice is
 * EXHAUSTED and autopay is not tried on it again.
 */
@Value
public class AutopayAttempt {
    UUID invoiceId;
    String professionalId;
    int attempts;
    AutopayAttemptStatus status;
    Instant nextAttemptAt;
    UUID lastPaymentId;
    String lastError;
    Instant updatedAt;

    public static AutopayAttempt first(UUID invoiceId, String professionalId, Instant now) {
        return new AutopayAttempt(invoiceId, professionalId, 0, AutopayAttemptStatus.SCHEDULED,
            now, null, null, now);
    }

    public boolean isDue(Instant asOf) {
        return status == AutopayAttemptStatus.SCHEDULED
            && (nextAttemptAt == null || !nextAttemptAt.isAfter(asOf));
    }

    /**
     * Number the next charge will carry; part of its idempotency key.
     */
    public int nextAttemptNumber() {
        return attempts + 1;
    }

    public AutopayAttempt recordSuccess(UUID paymentId, Instant now) {
        return new AutopayAttempt(invoiceId, professionalId, attempts + 1, AutopayAttemptStatus.SUCCEEDED,
            null, paymentId, null, now);
    }

    /**
     * The provider has not confirmed yet. The attempt is used up but the row stays
     * SCHEDULED: if the webhook fails the payment, the next run either charges again
     * or, with no attempts left, exhausts the row.
     */
    public AutopayAttempt recordPending(UUID paymentId, Instant now, Duration retryDelay) {
        return new AutopayAttempt(invoiceId, professionalId, attempts + 1, AutopayAttemptStatus.SCHEDULED,
            now.plus(retryDelay), paymentId, null, now);
    }

    public boolean hasAttemptsLeft(int maxAttempts) {
        return attempts < maxAttempts;
    }

    public AutopayAttempt exhaust(String error, Instant now) {
        return new AutopayAttempt(invoiceId, professionalId, attempts, AutopayAttemptStatus.EXHAUSTED,
            null, lastPaymentId, error, now);
    }

    public AutopayAttempt recordFailure(UUID paymentId, String error, Instant now, Duration retryDelay,
                                        int maxAttempts) {
        return afterUnsuccessful(paymentId, error, now, retryDelay, maxAttempts);
    }

    public boolean isExhausted() {
        return status == AutopayAttemptStatus.EXHAUSTED;
    }

    private AutopayAttempt afterUnsuccessful(UUID paymentId, String error, Instant now, Duration retryDelay,
                                             int maxAttempts) {
        int used = attempts + 1;
        if (used >= maxAttempts) {
            return new AutopayAttempt(invoiceId, professionalId, used, AutopayAttemptStatus.EXHAUSTED,
                null, paymentId, error, now);
        }
        return new AutopayAttempt(invoiceId, professionalId, used, AutopayAttemptStatus.SCHEDULED,
            now.plus(retryDelay), paymentId, error, now);
    }
}
