package com.flagship.settlement_engine.common;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event the engine publishes through the outbox.
 * Consumers de-duplicate on {@link #getEventId()}.
 */
public interface SettlementEvent {

    UUID getEventId();

    /**
     * Id of the invoice, payment, payout, offset, job or professional the event is about.
     * Used as the Kafka record key.
     */
    String getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
