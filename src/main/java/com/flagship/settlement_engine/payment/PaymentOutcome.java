package com.flagship.settlement_engine.payment;

import lombok.Value;

/**
 * A payment plus whether it was created by this request or found through its idempotency key.
 */
@Value
public class PaymentOutcome {
    Payment payment;
    boolean replayed;

    static PaymentOutcome created(Payment payment) {
        return new PaymentOutcome(payment, false);
    }

    static PaymentOutcome replayed(Payment payment) {
        return new PaymentOutcome(payment, true);
    }
}
