package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Idempotency-Key headers to payments.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the payments table, which holds the key with a unique constraint
 * 3. Cache database hits back into Redis
 *
 * Redis is optional: without a template bean every lookup goes to the database.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final SettlementMetrics metrics;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              SettlementMetrics metrics) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return the payment created earlier with this key, if any
     */
    public Optional<UUID> findPaymentId(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            metrics.recordIdempotencyHit();
            return cached;
        }

        Optional<UUID> stored = paymentRepository.findByIdempotencyKey(idempotencyKey)
            .map(PaymentEntity::getId);
        if (stored.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            metrics.recordIdempotencyHit();
            writeCache(idempotencyKey, stored.get());
        } else {
            metrics.recordIdempotencyMiss();
        }
        return stored;
    }

    /**
     * Caches a key after its payment row is committed. The database row stays the source of truth.
     */
    public void remember(String idempotencyKey, UUID paymentId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return;
        }
        writeCache(idempotencyKey, paymentId);
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }
}
