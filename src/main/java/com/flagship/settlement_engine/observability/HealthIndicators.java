package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors.
 *
 * Redis is optional: without it idempotency lookups go to the database, so an
 * unreachable Redis reports DEGRADED rather than DOWN.
 */
public class HealthIndicators {

    /**
     * DOWN once the unpublished backlog passes the critical threshold; the
     * notification service would then be badly behind.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (RuntimeException e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency keys fall back to the payments table";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(result))
                            .withDetail("note", FALLBACK_NOTE).build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                        .withDetail("error", describe(e))
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;

        public KafkaHealthIndicator(ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
            if (template == null) {
                return Health.down().withDetail("error", "KafkaTemplate not configured").build();
            }
            try {
                var metrics = template.metrics();
                return metrics.isEmpty()
                        ? Health.down().withDetail("error", "No Kafka connections established").build()
                        : Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (RuntimeException e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
