package com.flagship.settlement_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the commission, balance and settlement flows.
 *
 * Metrics exposed:
 * - commission.posted: commission postings by type and outcome
 * - referral.chain.anomalies: cycles and hop-cap truncations found while walking chains
 * - balance.mutations: Balance Ledger operations by operation and outcome
 * - settlement.invoices.issued / settlement.run.*: monthly batch results
 * - payments.processed / gateway.latency: gateway outcomes and call latency per provider
 * - webhooks.received, autopay.attempts, payouts.created, offsets.applied
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Counter invoicesIssued;
    private final Counter offsetsApplied;
    private final Counter duplicateRequests;
    private final Timer settlementRunTimer;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.invoicesIssued = Counter.builder("settlement.invoices.issued")
                .description("Number of invoices issued")
                .register(registry);

        this.offsetsApplied = Counter.builder("settlement.offsets.applied")
                .description("Number of balance offsets applied")
                .register(registry);

        this.duplicateRequests = Counter.builder("payments.duplicate_requests")
                .description("Number of duplicate payment requests (idempotency hits)")
                .register(registry);

        this.settlementRunTimer = Timer.builder("settlement.run.duration")
                .description("Time taken by a monthly settlement run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Commission ====================

    public void recordCommissionPosted(String commissionType, String outcome) {
        registry.counter("commission.posted",
                "commission_type", sanitizeTag(commissionType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordChainAnomaly(String kind) {
        registry.counter("referral.chain.anomalies",
                "kind", sanitizeTag(kind)
        ).increment();
    }

    // ==================== Balance ====================

    public void recordBalanceMutation(String operation, String outcome) {
        registry.counter("balance.mutations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    // ==================== Settlement ====================

    public void incrementInvoicesIssued() {
        invoicesIssued.increment();
    }

    public void incrementOffsetsApplied() {
        offsetsApplied.increment();
    }

    public void recordSettlementRun(int created, int skipped, int failed, Duration duration) {
        registry.counter("settlement.run.professionals", "result", "created").increment(created);
        registry.counter("settlement.run.professionals", "result", "skipped").increment(skipped);
        registry.counter("settlement.run.professionals", "result", "failed").increment(failed);
        settlementRunTimer.record(duration);
    }

    public void recordPayoutCreated(String method) {
        registry.counter("settlement.payouts.created",
                "method", sanitizeTag(method)
        ).increment();
    }

    // ==================== Payments ====================

    public void recordPayment(String provider, String status) {
        registry.counter("payments.processed",
                "provider", sanitizeTag(provider),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordGatewayLatency(String provider, String operation, long durationMs) {
        registry.timer("gateway.latency",
                "provider", sanitizeTag(provider),
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timeGatewayCall(String provider, String operation, Supplier<T> call) {
        long start = System.currentTimeMillis();
        try {
            return call.get();
        } finally {
            recordGatewayLatency(provider, operation, System.currentTimeMillis() - start);
        }
    }

    public void recordIdempotencyHit() {
        duplicateRequests.increment();
        registry.counter("payments.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("payments.idempotency", "result", "miss").increment();
    }

    public void recordWebhook(String provider, String result) {
        registry.counter("webhooks.received",
                "provider", sanitizeTag(provider),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordAutopayAttempt(String outcome) {
        registry.counter("autopay.attempts",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    // ==================== Event Processing ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        Counter.builder("event.processed")
                .tag("event_type", sanitizeTag(eventType))
                .tag("was_new", String.valueOf(wasNew))
                .register(registry)
                .increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        Counter.builder("event.processing.failure")
                .tag("event_type", sanitizeTag(eventType))
                .tag("error", sanitizeTag(error))
                .register(registry)
                .increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
