package com.flagship.settlement_engine.commission;

import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.balance.ProfessionalLockRegistry;
import com.flagship.settlement_engine.commission.calculator.CommissionRateProperties;
import com.flagship.settlement_engine.commission.event.CommissionRecordedEvent;
import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.exception.DuplicateCommissionException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.referral.ReferralChain;
import com.flagship.settlement_engine.referral.ReferralChainResolver;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.Month;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a completed job into commission facts and balance movements.
 *
 * Flow:
 * 1. Resolve the rate (request, category default, type default)
 * 2. Resolve the referral chain and plan the allocations (no locks, no transaction)
 * 3. Under the locks of the payer and every paid referrer, in one transaction:
 *    record the facts, debit the payer with the platform share, credit each
 *    referrer with their share, write CommissionRecorded to the outbox
 */
@Service
@Slf4j
public class CommissionPostingService {

    static final String AGGREGATE_TYPE = "Commission";

    private final CommissionLedgerService commissionLedger;
    private final ReferralChainResolver chainResolver;
    private final CommissionRateProperties rates;
    private final BalanceLedgerService balanceLedger;
    private final OutboxService outboxService;
    private final ProfessionalLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;
    private final SettlementProperties settlementProperties;
    private final Clock clock;

    public CommissionPostingService(CommissionLedgerService commissionLedger,
                                    ReferralChainResolver chainResolver,
                                    CommissionRateProperties rates,
                                    BalanceLedgerService balanceLedger,
                                    OutboxService outboxService,
                                    ProfessionalLockRegistry locks,
                                    TransactionTemplate transactionTemplate,
                                    SettlementMetrics metrics,
                                    SettlementProperties settlementProperties,
                                    Clock clock) {
        this.commissionLedger = commissionLedger;
        this.chainResolver = chainResolver;
        this.rates = rates;
        this.balanceLedger = balanceLedger;
        this.outboxService = outboxService;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.settlementProperties = settlementProperties;
        this.clock = clock;
    }

    /**
     * Records the commission of a job reported over REST.
     *
     * @throws DuplicateCommissionException if the job was already recorded
     */
    public List<CommissionFact> postJobCompletion(JobCompletion job) {
        validate(job);
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, job.getJobId());
        MDC.put(CorrelationContext.PROFESSIONAL_ID_MDC_KEY, job.getProfessionalId());
        try {
            List<CommissionFact> facts = post(job);
            metrics.recordCommissionPosted(job.getCommissionType().name(), "recorded");
            return facts;
        } catch (DuplicateCommissionException e) {
            metrics.recordCommissionPosted(job.getCommissionType().name(), "duplicate");
            log.warn("Duplicate commission post for job {}", job.getJobId());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PROFESSIONAL_ID_MDC_KEY);
        }
    }

    /**
     * Event-path variant: a job that was already recorded is a success and its
     * existing facts are returned unchanged.
     */
    public List<CommissionFact> postJobCompletionIdempotently(JobCompletion job) {
        if (commissionLedger.isRecorded(job.getJobId())) {
            log.info("Job {} already has commission facts, skipping", job.getJobId());
            metrics.recordCommissionPosted(job.getCommissionType().name(), "already_recorded");
            return commissionLedger.factsForJob(job.getJobId());
        }
        try {
            return postJobCompletion(job);
        } catch (DuplicateCommissionException e) {
            return commissionLedger.factsForJob(job.getJobId());
        }
    }

    private List<CommissionFact> post(JobCompletion job) {
        String category = CommissionRateProperties.normalizeCategory(job.getCategory());
        BigDecimal rate = resolveRate(job, category);
        Instant completedAt = job.getCompletedAt() != null ? job.getCompletedAt() : clock.instant();
        Month seasonMonth = completedAt.atZone(settlementProperties.zoneId()).getMonth();

        ReferralChain chain = needsChain(job)
            ? chainResolver.resolveChain(job.getProfessionalId(), job.getReferrerId())
            : ReferralChain.empty(job.getProfessionalId());
        CommissionPlan plan = chainResolver.planCommission(chain, job.getJobValue(), rate, category, seasonMonth);

        Set<String> lockIds = new LinkedHashSet<>();
        lockIds.add(job.getProfessionalId());
        plan.getAllocations().stream()
            .filter(a -> a.getRecipientType() == RecipientType.REFERRER)
            .forEach(a -> lockIds.add(a.getRecipientId()));

        return locks.withLocks(lockIds, () -> transactionTemplate.execute(status -> {
            List<CommissionFact> facts = commissionLedger.recordCommission(job, rate, category, completedAt, plan);
            for (CommissionFact fact : facts) {
                if (fact.getAmount().signum() == 0) {
                    continue;
                }
                if (fact.isPlatformFact()) {
                    balanceLedger.addCommissionDebt(fact.getPayerProfessionalId(), fact.getAmount(), fact.getId());
                } else {
                    balanceLedger.addRevenueShare(fact.getRecipientId(), fact.getAmount(), fact.getId());
                }
            }
            outboxService.saveEvent(AGGREGATE_TYPE, job.getJobId(),
                CommissionRecordedEvent.EVENT_TYPE, CommissionRecordedEvent.from(job, facts));
            return facts;
        }));
    }

    private BigDecimal resolveRate(JobCompletion job, String category) {
        if (job.getCommissionType() == CommissionType.REFERRAL_JOB && job.getReferrerShareRate() != null) {
            return job.getReferrerShareRate();
        }
        if (job.getCommissionRate() != null) {
            return job.getCommissionRate();
        }
        return rates.defaultRate(job.getCommissionType(), category);
    }

    private static boolean needsChain(JobCompletion job) {
        return job.getCommissionType() == CommissionType.REFERRAL_JOB
            || (job.getReferrerId() != null && !job.getReferrerId().isBlank());
    }

    private static void validate(JobCompletion job) {
        if (job.getJobId() == null || job.getJobId().isBlank()) {
            throw new ValidationException("job_id is required");
        }
        if (job.getProfessionalId() == null || job.getProfessionalId().isBlank()) {
            throw new ValidationException("professional_id is required");
        }
        if (job.getCommissionType() == null) {
            throw new ValidationException("commission_type is required");
        }
        ValidationException.requirePositive(job.getJobValue(), "job_value");
        requireRate(job.getCommissionRate(), "commission_rate");
        requireRate(job.getReferrerShareRate(), "referrer_share_rate");
        if (job.getProfessionalId().equals(job.getReferrerId())) {
            throw new ValidationException("A professional cannot refer their own job: " + job.getProfessionalId());
        }
        if (job.getJobValue().scale() > Money.SCALE) {
            throw new ValidationException("job_value has more than " + Money.SCALE + " decimal places");
        }
    }

    private static void requireRate(BigDecimal rate, String field) {
        if (rate != null && (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0)) {
            throw new ValidationException(field + " must be between 0 and 1, got " + rate);
        }
    }
}
