package com.flagship.settlement_engine.payment.event;

import com.flagship.settlement_engine.common.SettlementEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AutopayDisabledEvent implements SettlementEvent {
    UUID eventId;
    String professionalId;
    UUID invoiceId;
    int failedAttempts;
    String lastError;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AutopayDisabled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return professionalId;
    }

    public static AutopayDisabledEvent of(String professionalId, UUID invoiceId, int failedAttempts, String lastError) {
        return new AutopayDisabledEvent(UUID.randomUUID(), professionalId, invoiceId, failedAttempts,
            lastError, Instant.now());
    }
}
