package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked broker: routing, keys, retries and dead letters.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    @InjectMocks
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(publisher, "commissionTopic", "commission-events");
        ReflectionTestUtils.setField(publisher, "settlementTopic", "settlement-events");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(String aggregateType, String aggregateId, String eventType, int retries) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, "{}",
            Instant.now(), null, retries, null);
    }

    private static CompletableFuture<SendResult<String, String>> acked(String topic, String key) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 42L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, key, "{}"), metadata));
    }

    @Test
    @DisplayName("Commission events go to the commission topic keyed by aggregate id")
    void testPublisher_RoutesCommissionEvents() {
        OutboxEvent commission = event("Commission", "job-1", "CommissionRecorded", 0);
        OutboxEvent invoice = event("Invoice", "inv-1", "InvoiceIssued", 0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(commission, invoice));
        when(kafkaTemplate.send("commission-events", "job-1", "{}")).thenReturn(acked("commission-events", "job-1"));
        when(kafkaTemplate.send("settlement-events", "inv-1", "{}")).thenReturn(acked("settlement-events", "inv-1"));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(commission.getId());
        verify(outboxService).markPublished(invoice.getId());
        verify(outboxMetrics).recordEventPublished("commission-events", "CommissionRecorded");
        verify(outboxMetrics).recordEventPublished("settlement-events", "InvoiceIssued");
    }

    @Test
    @DisplayName("A failed send marks the event failed and leaves it for the next poll")
    void testPublisher_MarksFailedOnBrokerError() {
        OutboxEvent payout = event("Payout", "payout-1", "PayoutCreated", 1);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(payout));
        when(kafkaTemplate.send("settlement-events", "payout-1", "{}"))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(payout.getId()), anyString());
        verify(outboxService, never()).markPublished(payout.getId());
        verify(outboxMetrics).recordEventPublishFailed("settlement-events", "PayoutCreated");
    }

    @Test
    @DisplayName("Events past max retries are dead-lettered without a send")
    void testPublisher_DeadLettersExhaustedEvents() {
        OutboxEvent stuck = event("Payment", "pay-1", "PaymentCompleted", 5);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(stuck));

        publisher.publishPendingEvents();

        verify(outboxMetrics).recordEventDeadLettered("PaymentCompleted");
        verify(outboxService, never()).markPublished(stuck.getId());
        verify(outboxService, never()).markFailed(eq(stuck.getId()), anyString());
    }

    @Test
    @DisplayName("Topic follows the aggregate type")
    void testTopicFor() {
        assertEquals("commission-events", publisher.topicFor(event("Commission", "j", "CommissionRecorded", 0)));
        assertEquals("settlement-events", publisher.topicFor(event("Offset", "o", "BalanceOffsetApplied", 0)));
    }
}
