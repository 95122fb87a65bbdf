package com.flagship.settlement_engine.consumer;

import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a handler at most once per (event key, consumer group).
 *
 * Handlers run their own locked transactions, so the processed record is
 * written after the handler returns. Handlers must therefore be idempotent
 * themselves: a crash between the two steps replays the handler, and the
 * replay must be a no-op. A failing handler leaves no record and the event
 * is delivered again.
 *
 * Usage:
 * <pre>
 * processor.processEvent(
 *     eventKey, eventType, aggregateType, aggregateId, consumerGroup,
 *     () -> handle(event)
 * );
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final SettlementMetrics metrics;

    /**
     * @return true if the handler ran, false if the event was already processed
     */
    public boolean processEvent(String eventKey, String eventType,
                                String aggregateType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        return processEventWithResult(eventKey, eventType, aggregateType, aggregateId, consumerGroup, () -> {
            handler.run();
            return null;
        }).wasProcessed();
    }

    public <T> ProcessingResult<T> processEventWithResult(String eventKey, String eventType,
                                                          String aggregateType, String aggregateId,
                                                          String consumerGroup, Supplier<T> handler) {
        if (isAlreadyProcessed(eventKey, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventKey, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return ProcessingResult.skipped();
        }

        T value;
        try {
            value = handler.get();
        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(eventType, e.getClass().getSimpleName());
            log.error("Failed to process event {} by consumer group {}: {}",
                eventKey, consumerGroup, e.getMessage(), e);
            throw e;
        }

        if (!record(ProcessedEvent.success(eventKey, eventType, aggregateType, aggregateId, consumerGroup))) {
            metrics.recordEventProcessed(eventType, false);
            return ProcessingResult.skipped();
        }
        metrics.recordEventProcessed(eventType, true);
        log.debug("Processed event {} by consumer group {}", eventKey, consumerGroup);
        return ProcessingResult.success(value);
    }

    /**
     * Marks an event as not relevant to this consumer so replays skip it.
     */
    public void skipEvent(String eventKey, String eventType, String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventKey, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.skipped(eventKey, eventType, aggregateType, aggregateId, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventKey, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(String eventKey, String consumerGroup) {
        return repository.existsByEventKeyAndConsumerGroup(eventKey, consumerGroup);
    }

    public List<ProcessedEvent> historyFor(String aggregateType, String aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(aggregateType, aggregateId)
            .stream()
            .map(ProcessedEventEntity::toDomain)
            .toList();
    }

    /**
     * @return false if a concurrent delivery recorded the same event first
     */
    private boolean record(ProcessedEvent event) {
        try {
            repository.saveAndFlush(ProcessedEventEntity.fromDomain(event));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Event {} was recorded concurrently by consumer group {}",
                event.getEventKey(), event.getConsumerGroup());
            return false;
        }
    }

    public static final class ProcessingResult<T> {
        private final T value;
        private final boolean processed;

        private ProcessingResult(T value, boolean processed) {
            this.value = value;
            this.processed = processed;
        }

        public static <T> ProcessingResult<T> success(T value) {
            return new ProcessingResult<>(value, true);
        }

        public static <T> ProcessingResult<T> skipped() {
            return new ProcessingResult<>(null, false);
        }

        public T getValue() {
            return value;
        }

        public boolean wasProcessed() {
            return processed;
        }
    }
}
