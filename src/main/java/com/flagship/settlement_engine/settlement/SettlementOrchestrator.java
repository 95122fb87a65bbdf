package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.balance.ProfessionalLockRegistry;
import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.exception.InsufficientBalanceException;
import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import com.flagship.settlement_engine.exception.SettlementEngineException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.gateway.GatewayProperties;
import com.flagship.settlement_engine.invoice.BillingPeriod;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceGeneration;
import com.flagship.settlement_engine.invoice.InvoiceService;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.settlement.bank.BankTransferClient;
import com.flagship.settlement_engine.settlement.bank.BankTransferRequest;
import com.flagship.settlement_engine.settlement.bank.BankTransferResult;
import com.flagship.settlement_engine.settlement.event.BalanceOffsetAppliedEvent;
import com.flagship.settlement_engine.settlement.event.PayoutCreatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Monthly invoicing, payouts and offsets.
 *
 * A monthly run fans out over a fixed worker pool, one task per professional with
 * outstanding commissions. Each task is one call to
 * {@link InvoiceService#generateMonthlyInvoice}, which is atomic for that professional,
 * so a cancelled run never leaves a half-built invoice: cancellation is checked only
 * before a professional starts. Failures are isolated per professional and recorded
 * as settlement errors.
 */
@Service
@Slf4j
public class SettlementOrchestrator {

    static final String PAYOUT_AGGREGATE_TYPE = "Payout";
    static final String OFFSET_AGGREGATE_TYPE = "Offset";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final InvoiceService invoiceService;
    private final BalanceLedgerService balanceLedger;
    private final PayoutRepository payoutRepository;
    private final OffsetRecordRepository offsetRepository;
    private final SettlementRunRepository runRepository;
    private final SettlementErrorRepository errorRepository;
    private final BankTransferClient bankTransferClient;
    private final OutboxService outboxService;
    private final ProfessionalLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;
    private final SettlementProperties properties;
    private final String currency;
    private final Clock clock;

    private final Map<UUID, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public SettlementOrchestrator(InvoiceService invoiceService,
                                  BalanceLedgerService balanceLedger,
                                  PayoutRepository payoutRepository,
                                  OffsetRecordRepository offsetRepository,
                                  SettlementRunRepository runRepository,
                                  SettlementErrorRepository errorRepository,
                                  BankTransferClient bankTransferClient,
                                  OutboxService outboxService,
                                  ProfessionalLockRegistry locks,
                                  TransactionTemplate transactionTemplate,
                                  SettlementMetrics metrics,
                                  SettlementProperties properties,
                                  GatewayProperties gatewayProperties,
                                  Clock clock) {
        this.invoiceService = invoiceService;
        this.balanceLedger = balanceLedger;
        this.payoutRepository = payoutRepository;
        this.offsetRepository = offsetRepository;
        this.runRepository = runRepository;
        this.errorRepository = errorRepository;
        this.bankTransferClient = bankTransferClient;
        this.outboxService = outboxService;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.properties = properties;
        this.currency = gatewayProperties.getCurrency();
        this.clock = clock;
    }

    /**
     * Invoices every professional with outstanding commissions for the period.
     * Running it again for the same period creates no second invoice: professionals
     * already invoiced are reported as skipped.
     */
    public MonthlySettlement runMonthlySettlement(int month, int year, String requestedBy) {
        BillingPeriod.of(month, year);
        List<String> eligible = balanceLedger.professionalsWithOutstanding();
        Instant startedAt = clock.instant();

        SettlementRun run = SettlementRun.start(month, year, eligible.size(), requestedBy, startedAt);
        runRepository.save(SettlementRunEntity.fromDomain(run));
        AtomicBoolean cancelled = new AtomicBoolean(false);
        activeRuns.put(run.getId(), cancelled);
        log.info("Settlement run {} started for {}/{}: {} eligible professionals",
            run.getId(), month, year, eligible.size());

        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        List<Callable<ProfessionalOutcome>> tasks = eligible.stream()
            .<Callable<ProfessionalOutcome>>map(professionalId -> () -> withContext(callerContext, professionalId,
                () -> settleProfessional(run.getId(), professionalId, month, year, requestedBy, cancelled)))
            .toList();

        List<ProfessionalOutcome> outcomes;
        ExecutorService workers = Executors.newFixedThreadPool(
            Math.max(1, properties.getWorkerThreads()), workerThreadFactory(run.getId()));
        try {
            outcomes = collect(workers.invokeAll(tasks), eligible, run.getId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            finishRun(run, true, 0, 0, 0);
            throw new InvalidStateTransitionException("Settlement run " + run.getId() + " was interrupted");
        } finally {
            workers.shutdown();
            activeRuns.remove(run.getId());
        }

        List<Invoice> invoices = new ArrayList<>();
        List<String> invoiced = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> notProcessed = new ArrayList<>();
        List<SettlementError> errors = new ArrayList<>();
        for (ProfessionalOutcome outcome : outcomes) {
            switch (outcome.kind) {
                case INVOICED -> {
                    invoices.add(outcome.invoice);
                    invoiced.add(outcome.professionalId);
                }
                case SKIPPED -> skipped.add(outcome.professionalId);
                case FAILED -> errors.add(outcome.error);
                case NOT_PROCESSED -> notProcessed.add(outcome.professionalId);
            }
        }

        SettlementRun finished = finishRun(run, cancelled.get(), invoiced.size(), skipped.size(), errors.size());
        Duration duration = Duration.between(startedAt, finished.getFinishedAt());
        metrics.recordSettlementRun(invoiced.size(), skipped.size(), errors.size(), duration);
        log.info("Settlement run {} {}: created={}, skipped={}, failed={}, notProcessed={}, duration={}ms",
            run.getId(), finished.getStatus(), invoiced.size(), skipped.size(), errors.size(),
            notProcessed.size(), duration.toMillis());

        SettlementReport report = new SettlementReport(run.getId(), month, year, finished.getStatus(),
            eligible.size(), invoiced, skipped, errors, notProcessed, duration);
        return new MonthlySettlement(invoices, report);
    }

    /**
     * Stops a running batch before its next professional. Professionals already
     * in progress finish normally. A RUNNING row with no live worker, left by a
     * restart, is closed as CANCELLED directly.
     */
    public SettlementRun cancelRun(UUID runId) {
        SettlementRunEntity entity = runRepository.findById(runId)
            .orElseThrow(() -> new ResourceNotFoundException("SettlementRun", runId));
        AtomicBoolean flag = activeRuns.get(runId);
        if (flag != null) {
            flag.set(true);
            log.info("Cancellation requested for settlement run {}", runId);
            return entity.toDomain();
        }
        SettlementRun abandoned = entity.toDomain().abandon(clock.instant());
        entity.updateFromDomain(abandoned);
        runRepository.save(entity);
        log.info("Settlement run {} had no live worker and was closed as CANCELLED", runId);
        return abandoned;
    }

    @Transactional(readOnly = true)
    public SettlementRun getRun(UUID runId) {
        return runRepository.findById(runId)
            .map(SettlementRunEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("SettlementRun", runId));
    }

    @Transactional(readOnly = true)
    public List<SettlementError> errorsForRun(UUID runId) {
        getRun(runId);
        return errorRepository.findByRunIdOrderByOccurredAtAsc(runId).stream()
            .map(SettlementErrorEntity::toDomain)
            .toList();
    }

    private ProfessionalOutcome settleProfessional(UUID runId, String professionalId, int month, int year,
                                                   String requestedBy, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            return ProfessionalOutcome.notProcessed(professionalId);
        }
        try {
            InvoiceGeneration generation = invoiceService.generateMonthlyInvoice(
                professionalId, month, year, requestedBy);
            if (!generation.isCreated()) {
                log.debug("Professional {} already invoiced as {}", professionalId,
                    generation.getInvoice().getInvoiceNumber());
                return ProfessionalOutcome.skipped(professionalId);
            }
            return ProfessionalOutcome.invoiced(professionalId, generation.getInvoice());
        } catch (ValidationException e) {
            if (ValidationException.NOTHING_TO_INVOICE.equals(e.getErrorCode())) {
                log.debug("Nothing to invoice for {}: {}", professionalId, e.getMessage());
                return ProfessionalOutcome.skipped(professionalId);
            }
            return ProfessionalOutcome.failed(recordError(runId, professionalId, e.getErrorCode(), e.getMessage()));
        } catch (SettlementEngineException e) {
            log.warn("Settlement failed for {} ({}): {}", professionalId, e.getErrorCode(), e.getMessage());
            return ProfessionalOutcome.failed(recordError(runId, professionalId, e.getErrorCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected settlement failure for {}: {}", professionalId, e.getMessage(), e);
            return ProfessionalOutcome.failed(recordError(runId, professionalId, INTERNAL_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private SettlementError recordError(UUID runId, String professionalId, String code, String message) {
        SettlementError error = SettlementError.of(runId, professionalId, code, message, clock.instant());
        errorRepository.save(SettlementErrorEntity.fromDomain(error));
        return error;
    }

    private List<ProfessionalOutcome> collect(List<Future<ProfessionalOutcome>> futures, List<String> eligible,
                                              UUID runId) throws InterruptedException {
        List<ProfessionalOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                String professionalId = eligible.get(i);
                log.error("Settlement worker crashed for {}", professionalId, e.getCause());
                outcomes.add(ProfessionalOutcome.failed(recordError(runId, professionalId, INTERNAL_ERROR,
                    String.valueOf(e.getCause()))));
            }
        }
        return outcomes;
    }

    private SettlementRun finishRun(SettlementRun run, boolean cancelled, int created, int skipped, int failed) {
        SettlementRun finished = run.finish(cancelled, created, skipped, failed, clock.instant());
        SettlementRunEntity entity = runRepository.findById(run.getId())
            .orElseThrow(() -> new ResourceNotFoundException("SettlementRun", run.getId()));
        entity.updateFromDomain(finished);
        runRepository.save(entity);
        return finished;
    }

    private static <T> T withContext(Map<String, String> callerContext, String professionalId,
                                     Supplier<T> work) {
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MDC.put(CorrelationContext.PROFESSIONAL_ID_MDC_KEY, professionalId);
        try {
            return work.get();
        } finally {
            MDC.clear();
        }
    }

    private static ThreadFactory workerThreadFactory(UUID runId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "settlement-" + runId.toString().substring(0, 8) + "-";
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Moves {@code amount} out of the professional's pending revenue shares.
     *
     * @throws ValidationException          on a bad amount, missing bank details or an amount below the minimum
     * @throws InsufficientBalanceException  if the amount exceeds pending revenue shares
     */
    public Payout createPayout(String professionalId, BigDecimal amount, PayoutMethod method,
                               BankDetails bankDetails, String reference, String requestedBy) {
        ValidationException.requirePositive(amount, "amount");
        if (method == null) {
            throw new ValidationException("payout_method is required");
        }
        BigDecimal rounded = Money.round(amount);
        if (method == PayoutMethod.BANK_TRANSFER && (bankDetails == null || !bankDetails.isComplete())) {
            throw new ValidationException(
                "BANK_TRANSFER payouts need bank_name, branch_number, account_number and account_holder_name");
        }
        BigDecimal minimum = properties.getPayout().getMinimumAmount();
        if (method.requiresMinimum() && rounded.compareTo(minimum) < 0) {
            throw new ValidationException(String.format(
                "%s payouts must be at least %s, got %s", method, minimum, rounded));
        }

        MDC.put(CorrelationContext.PROFESSIONAL_ID_MDC_KEY, professionalId);
        try {
            return locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
                Payout payout = Payout.create(professionalId, rounded, method, bankDetails, reference,
                    requestedBy, clock.instant());
                payoutRepository.save(PayoutEntity.fromDomain(payout));
                balanceLedger.applyPayout(professionalId, rounded, payout.getId());
                if (method == PayoutMethod.CREDIT_TO_NEXT_INVOICE) {
                    invoiceService.createCredit(professionalId, rounded, payout.getId());
                }
                outboxService.saveEvent(PAYOUT_AGGREGATE_TYPE, payout.getId(),
                    PayoutCreatedEvent.EVENT_TYPE, PayoutCreatedEvent.fromPayout(payout));
                metrics.recordPayoutCreated(method.name());
                log.info("Payout {} of {} created for {} via {} ({})",
                    payout.getId(), rounded, professionalId, method, payout.getStatus());
                return payout;
            }));
        } finally {
            MDC.remove(CorrelationContext.PROFESSIONAL_ID_MDC_KEY);
        }
    }

    /**
     * Sends QUEUED bank transfers and confirms PENDING_MANUAL cheques. Payouts in any
     * other status are returned unchanged. A rejected or failed transfer is marked
     * FAILED and its amount goes back to the professional's pending revenue shares.
     *
     * @throws ResourceNotFoundException if any id is unknown; nothing is processed then
     */
    public List<Payout> processBulkPayouts(List<UUID> payoutIds, String processedBy) {
        List<Payout> payouts = payoutIds.stream()
            .distinct()
            .map(this::getPayout)
            .toList();
        log.info("Bulk payout processing of {} payouts requested by {}", payouts.size(), processedBy);

        List<Payout> results = new ArrayList<>(payouts.size());
        for (Payout payout : payouts) {
            switch (payout.getStatus()) {
                case QUEUED -> results.add(sendBankTransfer(payout));
                case PENDING_MANUAL -> results.add(transition(payout.getId(), PayoutStatus.PENDING_MANUAL,
                    current -> current.complete(null, clock.instant())));
                default -> {
                    log.info("Payout {} is {}, nothing to process", payout.getId(), payout.getStatus());
                    results.add(payout);
                }
            }
        }
        return results;
    }

    @Transactional(readOnly = true)
    public List<Payout> pendingPayouts() {
        return payoutRepository.findByStatusInOrderByCreatedAtAsc(
                List.of(PayoutStatus.QUEUED, PayoutStatus.PENDING_MANUAL, PayoutStatus.PROCESSING))
            .stream()
            .map(PayoutEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Payout> payoutsForProfessional(String professionalId) {
        return payoutRepository.findByProfessionalIdOrderByCreatedAtDesc(professionalId).stream()
            .map(PayoutEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Payout getPayout(UUID payoutId) {
        return payoutRepository.findById(payoutId)
            .map(PayoutEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Payout", payoutId));
    }

    private Payout sendBankTransfer(Payout queued) {
        Payout processing = transition(queued.getId(), PayoutStatus.QUEUED, Payout::startProcessing);
        if (processing.getStatus() != PayoutStatus.PROCESSING) {
            return processing;
        }

        BankTransferResult result;
        try {
            result = bankTransferClient.transfer(
                BankTransferRequest.builder()
                    .payoutId(processing.getId())
                    .professionalId(processing.getProfessionalId())
                    .amount(processing.getAmount())
                    .currency(currency)
                    .bankDetails(processing.getBankDetails())
                    .build());
        } catch (SettlementEngineException e) {
            log.warn("Bank transfer for payout {} failed: {}", processing.getId(), e.getMessage());
            result = BankTransferResult.rejected(e.getMessage());
        }

        if (result.isAccepted()) {
            String bankReference = result.getReference();
            return transition(processing.getId(), PayoutStatus.PROCESSING,
                current -> current.complete(bankReference, clock.instant()));
        }
        String reason = result.getErrorMessage();
        return locks.withLock(processing.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            PayoutEntity entity = loadPayout(processing.getId());
            Payout failed = entity.toDomain().fail(reason, clock.instant());
            entity.updateFromDomain(failed);
            payoutRepository.save(entity);
            balanceLedger.reversePayout(failed.getProfessionalId(), failed.getAmount(), failed.getId());
            log.warn("Payout {} failed and {} was returned to {}: {}",
                failed.getId(), failed.getAmount(), failed.getProfessionalId(), reason);
            return failed;
        }));
    }

    /**
     * Applies {@code change} if the payout is still in {@code expected}; otherwise
     * returns it as found, so a concurrent bulk call does not process it twice.
     */
    private Payout transition(UUID payoutId, PayoutStatus expected,
                              UnaryOperator<Payout> change) {
        Payout snapshot = getPayout(payoutId);
        return locks.withLock(snapshot.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            PayoutEntity entity = loadPayout(payoutId);
            Payout current = entity.toDomain();
            if (current.getStatus() != expected) {
                log.info("Payout {} moved to {} concurrently, skipping", payoutId, current.getStatus());
                return current;
            }
            Payout changed = change.apply(current);
            entity.updateFromDomain(changed);
            payoutRepository.save(entity);
            log.info("Payout {} {} -> {}", payoutId, expected, changed.getStatus());
            return changed;
        }));
    }

    private PayoutEntity loadPayout(UUID payoutId) {
        return payoutRepository.findById(payoutId)
            .orElseThrow(() -> new ResourceNotFoundException("Payout", payoutId));
    }

    /**
     * Nets A's revenue shares against B's commission debt and records the offset.
     *
     * @throws InsufficientBalanceException if amount exceeds min(A pending, B outstanding)
     */
    public OffsetRecord processBalanceOffset(String professionalAId, String professionalBId, BigDecimal amount,
                                             String description, String requestedBy) {
        ValidationException.requirePositive(amount, "offset_amount");
        if (professionalAId == null || professionalBId == null) {
            throw new ValidationException("Both professional ids are required");
        }
        if (professionalAId.equals(professionalBId)) {
            throw new ValidationException("Cannot offset a professional against themself: " + professionalAId);
        }
        BigDecimal rounded = Money.round(amount);

        return locks.withLocks(List.of(professionalAId, professionalBId), () -> transactionTemplate.execute(s -> {
            OffsetRecord offset = OffsetRecord.of(professionalAId, professionalBId, rounded, description,
                requestedBy, clock.instant());
            offsetRepository.save(OffsetRecordEntity.fromDomain(offset));
            balanceLedger.applyOffset(professionalAId, professionalBId, rounded, offset.getId());
            outboxService.saveEvent(OFFSET_AGGREGATE_TYPE, offset.getId(),
                BalanceOffsetAppliedEvent.EVENT_TYPE, BalanceOffsetAppliedEvent.fromOffset(offset));
            metrics.incrementOffsetsApplied();
            log.info("Offset {} of {} applied: {} -> {}", offset.getId(), rounded, professionalAId, professionalBId);
            return offset;
        }));
    }

    @Transactional(readOnly = true)
    public List<OffsetRecord> offsetsForProfessional(String professionalId) {
        return offsetRepository.findInvolving(professionalId).stream()
            .map(OffsetRecordEntity::toDomain)
            .toList();
    }

    private static final class ProfessionalOutcome {

        enum Kind { INVOICED, SKIPPED, FAILED, NOT_PROCESSED }

        final Kind kind;
        final String professionalId;
        final Invoice invoice;
        final SettlementError error;

        private ProfessionalOutcome(Kind kind, String professionalId, Invoice invoice, SettlementError error) {
            this.kind = kind;
            this.professionalId = professionalId;
            this.invoice = invoice;
            this.error = error;
        }

        static ProfessionalOutcome invoiced(String professionalId, Invoice invoice) {
            return new ProfessionalOutcome(Kind.INVOICED, professionalId, invoice, null);
        }

        static ProfessionalOutcome skipped(String professionalId) {
            return new ProfessionalOutcome(Kind.SKIPPED, professionalId, null, null);
        }

        static ProfessionalOutcome failed(SettlementError error) {
            return new ProfessionalOutcome(Kind.FAILED, error.getProfessionalId(), null, error);
        }

        static ProfessionalOutcome notProcessed(String professionalId) {
            return new ProfessionalOutcome(Kind.NOT_PROCESSED, professionalId, null, null);
        }
    }
}
