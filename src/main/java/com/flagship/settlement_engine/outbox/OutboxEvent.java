package com.flagship.settlement_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox table to be published.
 *
 * Written in the same transaction as the state change it describes, so a
 * committed change always has its event and a rolled-back one never does.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "Invoice"
    String aggregateId;        // invoice id, job id, professional id
    String eventType;          // e.g. "InvoiceIssued"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
