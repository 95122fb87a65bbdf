package com.flagship.settlement_engine.consumer;

import com.flagship.settlement_engine.AbstractIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * At-most-once handling per (event key, consumer group).
 */
class IdempotentEventProcessorTest extends AbstractIntegrationTest {

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "TestEvent";
    private static final String AGGREGATE_TYPE = "TestAggregate";

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Test
    @DisplayName("First delivery runs the handler and records the event")
    void testFirstEventProcessing_ExecutesHandler() {
        String eventKey = UUID.randomUUID().toString();
        String aggregateId = UUID.randomUUID().toString();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(processed, "First event should be processed");
        assertEquals(1, calls.get(), "Handler should be called once");
        assertTrue(eventProcessor.isAlreadyProcessed(eventKey, CONSUMER_GROUP), "Processing record should exist");
        List<ProcessedEvent> history = eventProcessor.historyFor(AGGREGATE_TYPE, aggregateId);
        assertEquals(1, history.size());
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, history.get(0).getResult());
    }

    @Test
    @DisplayName("Redelivered events do not run the handler again")
    void testDuplicateEvent_SkipsHandler() {
        String eventKey = UUID.randomUUID().toString();
        String aggregateId = UUID.randomUUID().toString();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);
        boolean third = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(first, "First event should be processed");
        assertFalse(second, "Duplicate should be skipped");
        assertFalse(third, "Duplicate should be skipped");
        assertEquals(1, calls.get(), "Handler should only be called once");
    }

    @Test
    @DisplayName("Each consumer group handles the same event once")
    void testDifferentConsumerGroups_ProcessSameEvent() {
        String eventKey = UUID.randomUUID().toString();
        String aggregateId = UUID.randomUUID().toString();
        AtomicInteger calls = new AtomicInteger();

        boolean posting = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            "commission-posting", calls::incrementAndGet);
        boolean webhooks = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            "gateway-webhooks", calls::incrementAndGet);

        assertTrue(posting);
        assertTrue(webhooks);
        assertEquals(2, calls.get(), "Each consumer group should process once");
    }

    @Test
    @DisplayName("A failing handler leaves no record so the event is retried")
    void testFailedProcessing_AllowsRetry() {
        String eventKey = UUID.randomUUID().toString();
        String aggregateId = UUID.randomUUID().toString();
        AtomicInteger calls = new AtomicInteger();

        IllegalStateException error = assertThrows(IllegalStateException.class, () ->
            eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("downstream unavailable");
            }));

        assertEquals("downstream unavailable", error.getMessage());
        assertFalse(eventProcessor.isAlreadyProcessed(eventKey, CONSUMER_GROUP));

        boolean retried = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);
        assertTrue(retried, "Retry after failure should be processed");
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Handler result is returned on first delivery only")
    void testProcessEventWithResult() {
        String eventKey = UUID.randomUUID().toString();

        IdempotentEventProcessor.ProcessingResult<String> first = eventProcessor.processEventWithResult(
            eventKey, EVENT_TYPE, AGGREGATE_TYPE, "agg", CONSUMER_GROUP, () -> "posted");
        IdempotentEventProcessor.ProcessingResult<String> second = eventProcessor.processEventWithResult(
            eventKey, EVENT_TYPE, AGGREGATE_TYPE, "agg", CONSUMER_GROUP, () -> "posted again");

        assertTrue(first.wasProcessed());
        assertEquals("posted", first.getValue());
        assertFalse(second.wasProcessed());
        assertNull(second.getValue());
    }

    @Test
    @DisplayName("Skipped events are recorded with their reason and never handled")
    void testSkipEvent() {
        String eventKey = UUID.randomUUID().toString();
        String aggregateId = UUID.randomUUID().toString();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, "not relevant");
        eventProcessor.skipEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, "again");
        boolean processed = eventProcessor.processEvent(eventKey, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, calls.get());
        List<ProcessedEvent> history = eventProcessor.historyFor(AGGREGATE_TYPE, aggregateId);
        assertEquals(1, history.size());
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, history.get(0).getResult());
        assertEquals("not relevant", history.get(0).getErrorMessage());
    }
}
