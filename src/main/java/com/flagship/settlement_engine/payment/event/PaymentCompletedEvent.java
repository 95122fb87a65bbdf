package com.flagship.settlement_engine.payment.event;

import com.flagship.settlement_engine.common.SettlementEvent;
import com.flagship.settlement_engine.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentCompletedEvent implements SettlementEvent {
    UUID eventId;
    UUID paymentId;
    UUID invoiceId;
    String professionalId;
    BigDecimal amount;
    String gatewayProvider;
    String gatewayTransactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return paymentId.toString();
    }

    public static PaymentCompletedEvent fromPayment(Payment payment) {
        return new PaymentCompletedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getInvoiceId(),
            payment.getProfessionalId(),
            payment.getAmount(),
            payment.getGatewayProvider().name(),
            payment.getGatewayTransactionId(),
            Instant.now()
        );
    }
}
