package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import com.flagship.settlement_engine.payment.PaymentRepository;
import com.flagship.settlement_engine.payment.PaymentStatus;
import com.flagship.settlement_engine.settlement.PayoutRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObservabilityTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private OutboxEventRepository outboxRepository;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private PayoutRepository payoutRepository;

    @Mock
    private OutboxMetrics outboxMetrics;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    @DisplayName("Outbox gauges report backlog, age of the oldest event and dead letters")
    void testOutboxGauges() {
        OutboxMetrics metrics = new OutboxMetrics(outboxRepository, registry, Clock.fixed(NOW, ZoneOffset.UTC), 5);
        metrics.registerGauges();
        when(outboxRepository.countUnpublished()).thenReturn(12L);
        when(outboxRepository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.of(NOW.minusSeconds(90)));
        when(outboxRepository.countByRetryCountGreaterThanEqual(5)).thenReturn(2L);

        metrics.refreshMetrics();
        metrics.recordEventPublished("commission-events", "CommissionRecorded");

        assertEquals(12.0, registry.get("settlement.outbox.pending").gauge().value());
        assertEquals(90.0, registry.get("settlement.outbox.oldest.pending.seconds").gauge().value());
        assertEquals(2.0, registry.get("settlement.outbox.dead.letters").gauge().value());
        assertEquals(1.0, registry.get("settlement.outbox.published")
            .tag("topic", "commission-events").counter().count());
    }

    @Test
    @DisplayName("A database error keeps the last gauge values")
    void testOutboxGaugesSurviveDatabaseErrors() {
        OutboxMetrics metrics = new OutboxMetrics(outboxRepository, registry, Clock.fixed(NOW, ZoneOffset.UTC), 5);
        metrics.registerGauges();
        when(outboxRepository.countUnpublished()).thenReturn(3L)
            .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(outboxRepository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.empty());
        when(outboxRepository.countByRetryCountGreaterThanEqual(anyInt())).thenReturn(0L);

        metrics.refreshMetrics();
        metrics.refreshMetrics();

        assertEquals(3.0, registry.get("settlement.outbox.pending").gauge().value());
    }

    @Test
    @DisplayName("Scheduler refreshes payment and payout gauges")
    void testSchedulerGauges() {
        MetricsScheduler scheduler = new MetricsScheduler(outboxMetrics, paymentRepository, payoutRepository, registry);
        scheduler.init();
        when(paymentRepository.countByStatus(PaymentStatus.PROCESSING)).thenReturn(4L);
        when(payoutRepository.countByStatusIn(anyCollection())).thenReturn(7L);

        scheduler.refreshMetrics();

        verify(outboxMetrics).refreshMetrics();
        assertEquals(4.0, registry.get("settlement.payments.processing").gauge().value());
        assertEquals(7.0, registry.get("settlement.payouts.awaiting").gauge().value());
    }

    @Test
    @DisplayName("Outbox health degrades with the backlog")
    void testOutboxHealth() {
        HealthIndicators.OutboxHealthIndicator indicator = new HealthIndicators.OutboxHealthIndicator(outboxRepository);

        when(outboxRepository.countUnpublished()).thenReturn(10L);
        assertEquals(Status.UP, indicator.health().getStatus());

        when(outboxRepository.countUnpublished()).thenReturn(HealthIndicators.OutboxHealthIndicator.BACKLOG_WARNING_THRESHOLD);
        assertEquals("WARNING", indicator.health().getStatus().getCode());

        when(outboxRepository.countUnpublished()).thenReturn(HealthIndicators.OutboxHealthIndicator.BACKLOG_CRITICAL_THRESHOLD);
        Health critical = indicator.health();
        assertEquals(Status.DOWN, critical.getStatus());
        assertEquals(HealthIndicators.OutboxHealthIndicator.BACKLOG_CRITICAL_THRESHOLD,
            critical.getDetails().get("backlogSize"));
    }
}
