package com.flagship.settlement_engine.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.commission.CommissionPostingService;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Posts commissions for JobCompleted events.
 *
 * - Manual acknowledgment: offsets are committed only after the facts are stored
 * - Replays are skipped by event id, and a job recorded through REST is not recorded twice
 * - Unreadable messages and business rejections (bad amounts, self-referral) are
 *   acknowledged and recorded as skipped; anything else, lock timeouts included, is redelivered
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JobEventConsumer {

    static final String CONSUMER_GROUP = "commission-posting";
    static final String RECORDED_BY = "job-events";

    private final IdempotentEventProcessor eventProcessor;
    private final CommissionPostingService postingService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.jobs:job-events}",
        groupId = "${spring.kafka.consumer.group-id:settlement-engine}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.begin(headerValue(record, CorrelationContext.CORRELATION_ID_HEADER));
        try {
            log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

            JobCompletedEvent event = parse(record.value());
            if (event == null || event.getEventId() == null || event.getJobId() == null) {
                log.warn("Could not parse job event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            handle(event);
            ack.acknowledge();
        } finally {
            CorrelationContext.end();
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    /**
     * @return true if commission was posted for this delivery
     */
    boolean handle(JobCompletedEvent event) {
        String eventKey = event.getEventId().toString();
        try {
            boolean processed = eventProcessor.processEvent(eventKey, JobCompletedEvent.EVENT_TYPE,
                "Job", event.getJobId(), CONSUMER_GROUP,
                () -> postingService.postJobCompletionIdempotently(event.toJobCompletion(RECORDED_BY)));
            if (processed) {
                log.info("Processed JobCompleted: eventId={}, jobId={}", eventKey, event.getJobId());
            }
            return processed;
        } catch (ValidationException e) {
            log.warn("Rejected JobCompleted {} for job {}: {} ({})",
                eventKey, event.getJobId(), e.getMessage(), e.getErrorCode());
            eventProcessor.skipEvent(eventKey, JobCompletedEvent.EVENT_TYPE, "Job", event.getJobId(),
                CONSUMER_GROUP, e.getErrorCode() + ": " + e.getMessage());
            return false;
        }
    }

    private JobCompletedEvent parse(String json) {
        try {
            return objectMapper.readValue(json, JobCompletedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse job event: {}", e.getOriginalMessage());
            return null;
        }
    }
}
