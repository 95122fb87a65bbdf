package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.balance.Balance;
import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.balance.ProfessionalLockRegistry;
import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.InvoiceAlreadyPaidException;
import com.flagship.settlement_engine.exception.SettlementEngineException;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceService;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.payment.event.AutopayDisabledEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Charges payable invoices of professionals who enabled autopay.
 *
 * One attempt row per invoice tracks how many charges were made and when the
 * next one is allowed. A charge that does not complete schedules the next one
 * after the retry delay; once the attempts run out the professional's autopay
 * is switched off and an AutopayDisabled event is written. An unexpected error on
 * one invoice is counted as failed and the run moves on to the next.
 */
@Service
@Slf4j
public class AutopayService {

    static final String INITIATED_BY = "autopay";
    static final String BALANCE_AGGREGATE_TYPE = "Balance";

    private final InvoiceService invoiceService;
    private final BalanceLedgerService balanceLedger;
    private final PaymentProcessingService paymentService;
    private final PaymentRepository paymentRepository;
    private final AutopayAttemptRepository attemptRepository;
    private final OutboxService outboxService;
    private final ProfessionalLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration retryDelay;

    public AutopayService(InvoiceService invoiceService,
                          BalanceLedgerService balanceLedger,
                          PaymentProcessingService paymentService,
                          PaymentRepository paymentRepository,
                          AutopayAttemptRepository attemptRepository,
                          OutboxService outboxService,
                          ProfessionalLockRegistry locks,
                          TransactionTemplate transactionTemplate,
                          SettlementMetrics metrics,
                          Clock clock,
                          @Value("${autopay.max-attempts:3}") int maxAttempts,
                          @Value("${autopay.retry-delay-hours:24}") long retryDelayHours) {
        this.invoiceService = invoiceService;
        this.balanceLedger = balanceLedger;
        this.paymentService = paymentService;
        this.paymentRepository = paymentRepository;
        this.attemptRepository = attemptRepository;
        this.outboxService = outboxService;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.retryDelay = Duration.ofHours(retryDelayHours);
    }

    @Scheduled(cron = "${autopay.cron}", zone = "${settlement.zone}")
    public void runScheduledAutopay() {
        AutopayBatchResult result = processAutopayBatch(clock.instant(), null, null);
        log.info("Scheduled autopay finished: {}", result);
    }

    /**
     * Charges every due invoice once.
     *
     * @param month optional; with year, restricts the run to one billing period
     */
    public AutopayBatchResult processAutopayBatch(Instant asOf, Integer month, Integer year) {
        List<Invoice> candidates = invoiceService.payableInvoices().stream()
            .filter(invoice -> month == null || invoice.getPeriod().getMonth() == month)
            .filter(invoice -> year == null || invoice.getPeriod().getYear() == year)
            .filter(invoice -> {
                Balance balance = balanceLedger.findBalance(invoice.getProfessionalId());
                return balance != null && balance.isAutopayEnabled();
            })
            .toList();
        log.info("Autopay run as of {}: {} candidate invoices", asOf, candidates.size());

        AutopayBatchResult.Counter counter = new AutopayBatchResult.Counter();
        for (Invoice invoice : candidates) {
            MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoice.getId().toString());
            MDC.put(CorrelationContext.PROFESSIONAL_ID_MDC_KEY, invoice.getProfessionalId());
            try {
                chargeInvoice(invoice, asOf, counter);
            } catch (RuntimeException e) {
                log.error("Unexpected autopay failure for invoice {}: {}", invoice.getInvoiceNumber(), e.getMessage(), e);
                counter.failed++;
            } finally {
                MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
                MDC.remove(CorrelationContext.PROFESSIONAL_ID_MDC_KEY);
            }
        }
        AutopayBatchResult result = counter.toResult();
        log.info("Autopay run complete: attempted={}, succeeded={}, pending={}, failed={}, exhausted={}, skipped={}",
            result.getAttempted(), result.getSucceeded(), result.getPending(), result.getFailed(),
            result.getExhausted(), result.getSkipped());
        return result;
    }

    private void chargeInvoice(Invoice invoice, Instant asOf, AutopayBatchResult.Counter counter) {
        AutopayAttempt attempt = attemptRepository.findById(invoice.getId())
            .map(AutopayAttemptEntity::toDomain)
            .orElseGet(() -> AutopayAttempt.first(invoice.getId(), invoice.getProfessionalId(), asOf));

        if (!attempt.isDue(asOf)) {
            log.debug("Invoice {} not due for autopay (status={}, next={})",
                invoice.getInvoiceNumber(), attempt.getStatus(), attempt.getNextAttemptAt());
            counter.skipped++;
            return;
        }
        if (paymentRepository.existsByInvoiceIdAndStatus(invoice.getId(), PaymentStatus.PROCESSING)) {
            log.debug("Invoice {} has a payment in progress, autopay skipped", invoice.getInvoiceNumber());
            counter.skipped++;
            return;
        }

        if (!attempt.hasAttemptsLeft(maxAttempts)) {
            // the last charge went PENDING and the provider later failed it
            String lastError = attempt.getLastPaymentId() == null ? null
                : paymentService.getPayment(attempt.getLastPaymentId()).getFailureReason();
            counter.failed++;
            exhaust(attempt.exhaust(lastError, asOf), counter);
            return;
        }

        Balance balance = balanceLedger.getBalance(invoice.getProfessionalId());
        String idempotencyKey = "autopay:" + invoice.getId() + ":" + attempt.nextAttemptNumber();

        Payment payment;
        try {
            payment = paymentService.processPayment(invoice.getId(), invoice.amountDue(),
                balance.getAutopayPaymentMethodId(), null, idempotencyKey, INITIATED_BY).getPayment();
        } catch (InvoiceAlreadyPaidException | InvalidStateTransitionException e) {
            log.info("Invoice {} no longer chargeable: {}", invoice.getInvoiceNumber(), e.getMessage());
            counter.skipped++;
            return;
        } catch (SettlementEngineException e) {
            log.warn("Autopay rejected for invoice {} ({}): {}",
                invoice.getInvoiceNumber(), e.getErrorCode(), e.getMessage());
            counter.attempted++;
            recordFailure(attempt, null, e.getErrorCode() + ": " + e.getMessage(), asOf, counter);
            return;
        }
        counter.attempted++;

        switch (payment.getStatus()) {
            case COMPLETED, REFUNDED -> {
                save(attempt.recordSuccess(payment.getId(), asOf));
                metrics.recordAutopayAttempt("succeeded");
                counter.succeeded++;
            }
            case PROCESSING -> {
                save(attempt.recordPending(payment.getId(), asOf, retryDelay));
                metrics.recordAutopayAttempt("pending");
                counter.pending++;
            }
            case FAILED -> recordFailure(attempt, payment.getId(), payment.getFailureReason(), asOf, counter);
        }
    }

    private void recordFailure(AutopayAttempt attempt, UUID paymentId, String error, Instant now,
                               AutopayBatchResult.Counter counter) {
        AutopayAttempt next = attempt.recordFailure(paymentId, error, now, retryDelay, maxAttempts);
        counter.failed++;
        if (!next.isExhausted()) {
            save(next);
            metrics.recordAutopayAttempt("failed");
            log.info("Autopay attempt {} of {} failed for invoice {}; next at {}",
                next.getAttempts(), maxAttempts, next.getInvoiceId(), next.getNextAttemptAt());
            return;
        }

        exhaust(next, counter);
    }

    private void exhaust(AutopayAttempt exhausted, AutopayBatchResult.Counter counter) {
        counter.exhausted++;
        metrics.recordAutopayAttempt("exhausted");
        String professionalId = exhausted.getProfessionalId();
        locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
            attemptRepository.save(toEntity(exhausted));
            balanceLedger.disableAutopay(professionalId, "autopay exhausted after "
                + exhausted.getAttempts() + " attempts on invoice " + exhausted.getInvoiceId());
            outboxService.saveEvent(BALANCE_AGGREGATE_TYPE, professionalId, AutopayDisabledEvent.EVENT_TYPE,
                AutopayDisabledEvent.of(professionalId, exhausted.getInvoiceId(), exhausted.getAttempts(),
                    exhausted.getLastError()));
            return null;
        }));
        log.warn("Autopay exhausted for invoice {} after {} attempts; disabled for {}",
            exhausted.getInvoiceId(), exhausted.getAttempts(), professionalId);
    }

    private void save(AutopayAttempt attempt) {
        attemptRepository.save(toEntity(attempt));
    }

    private AutopayAttemptEntity toEntity(AutopayAttempt attempt) {
        AutopayAttemptEntity entity = attemptRepository.findById(attempt.getInvoiceId()).orElse(null);
        if (entity == null) {
            return AutopayAttemptEntity.fromDomain(attempt);
        }
        entity.updateFromDomain(attempt);
        return entity;
    }
}
