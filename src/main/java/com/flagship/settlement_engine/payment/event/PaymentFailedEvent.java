package com.flagship.settlement_engine.payment.event;

import com.flagship.settlement_engine.common.SettlementEvent;
import com.flagship.settlement_engine.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a charge is declined, times out or the provider errors.
 * Notification uses it to ask the professional to update their payment method.
 */
@Value
public class PaymentFailedEvent implements SettlementEvent {
    UUID eventId;
    UUID paymentId;
    UUID invoiceId;
    String professionalId;
    BigDecimal amount;
    String gatewayProvider;
    String failureReason;
    boolean retryable;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return paymentId.toString();
    }

    public static PaymentFailedEvent fromPayment(Payment payment, boolean retryable) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getInvoiceId(),
            payment.getProfessionalId(),
            payment.getAmount(),
            payment.getGatewayProvider().name(),
            payment.getFailureReason(),
            retryable,
            Instant.now()
        );
    }
}
