package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.payment.PaymentRepository;
import com.flagship.settlement_engine.payment.PaymentStatus;
import com.flagship.settlement_engine.settlement.PayoutRepository;
import com.flagship.settlement_engine.settlement.PayoutStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes gauges that need a database query, so a Prometheus scrape never does.
 *
 * Besides the outbox backlog it tracks payments still waiting for a provider
 * webhook and payouts waiting for bulk processing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong paymentsInFlight = new AtomicLong(0);
    private final AtomicLong payoutsAwaiting = new AtomicLong(0);

    @PostConstruct
    void init() {
        Gauge.builder("settlement.payments.processing", paymentsInFlight, AtomicLong::get)
                .description("Payments still PROCESSING at the provider")
                .register(meterRegistry);
        Gauge.builder("settlement.payouts.awaiting", payoutsAwaiting, AtomicLong::get)
                .description("Payouts QUEUED or PENDING_MANUAL")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        outboxMetrics.refreshMetrics();
        try {
            paymentsInFlight.set(paymentRepository.countByStatus(PaymentStatus.PROCESSING));
            payoutsAwaiting.set(payoutRepository.countByStatusIn(
                List.of(PayoutStatus.QUEUED, PayoutStatus.PENDING_MANUAL)));
        } catch (RuntimeException e) {
            log.warn("Failed to refresh settlement gauges: {}", e.getMessage());
        }
    }
}
