package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and per-topic publish counters.
 *
 * Gauges read values cached by {@link MetricsScheduler}, so a scrape never
 * touches the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    void registerGauges() {
        Gauge.builder("settlement.outbox.pending", pending, AtomicLong::get)
                .description("Settlement and commission events not yet on Kafka")
                .register(meterRegistry);
        Gauge.builder("settlement.outbox.oldest.pending.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event")
                .register(meterRegistry);
        Gauge.builder("settlement.outbox.dead.letters", deadLetters, AtomicLong::get)
                .description("Events that used up their publish retries")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            deadLetters.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));
            log.debug("Outbox gauges: pending={}, oldest={}s, deadLetters={}",
                    pending.get(), oldestPendingSeconds.get(), deadLetters.get());
        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox gauges: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String topic, String eventType) {
        meterRegistry.counter("settlement.outbox.published",
                "topic", topic, "event_type", eventType, "outcome", "success").increment();
    }

    public void recordEventPublishFailed(String topic, String eventType) {
        meterRegistry.counter("settlement.outbox.published",
                "topic", topic, "event_type", eventType, "outcome", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("settlement.outbox.dead_lettered", "event_type", eventType).increment();
    }
}
