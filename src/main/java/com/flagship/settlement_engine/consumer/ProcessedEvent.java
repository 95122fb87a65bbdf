package com.flagship.settlement_engine.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event.
 *
 * The event key is whatever identifies the delivery uniquely for its source:
 * the event id for Kafka messages, {@code provider:transactionId} for gateway webhooks.
 */
@Value
public class ProcessedEvent {
    UUID id;
    String eventKey;
    String eventType;
    String aggregateType;
    String aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(String eventKey, String eventType, String aggregateType,
                                         String aggregateId, String consumerGroup) {
        return new ProcessedEvent(UUID.randomUUID(), eventKey, eventType, aggregateType, aggregateId,
            consumerGroup, Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(String eventKey, String eventType, String aggregateType,
                                         String aggregateId, String consumerGroup, String reason) {
        return new ProcessedEvent(UUID.randomUUID(), eventKey, eventType, aggregateType, aggregateId,
            consumerGroup, Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}
