package com.flagship.settlement_engine.commission;

import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.exception.DuplicateCommissionException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Records commission facts and moves them through RECORDED → INVOICED → PAID.
 *
 * A job is recorded at most once. The existence check covers the common case;
 * the (job_id, recipient_id) unique key covers concurrent posts of the same job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionLedgerService {

    private final CommissionFactRepository repository;

    /**
     * Persists one fact per non-zero allocation of the plan. A job whose whole commission is
     * zero still gets its zero platform fact, so a repeat of the job is caught as a duplicate.
     *
     * @throws DuplicateCommissionException if the job already has facts
     * @throws IllegalArgumentException     if recipients repeat or allocations do not add up to the computed commission
     */
    @Transactional
    public List<CommissionFact> recordCommission(JobCompletion job, BigDecimal rate, String category,
                                                 Instant completedAt, CommissionPlan plan) {
        if (repository.existsByJobId(job.getJobId())) {
            throw new DuplicateCommissionException(job.getJobId());
        }
        validatePlan(job.getJobId(), plan);

        List<CommissionAllocation> allocations = plan.getAllocations().stream()
            .filter(allocation -> allocation.getAmount().signum() > 0)
            .toList();
        if (allocations.isEmpty()) {
            allocations = plan.getAllocations().stream()
                .filter(allocation -> allocation.getRecipientType() == RecipientType.PLATFORM)
                .toList();
        }

        List<CommissionFactEntity> entities = allocations.stream()
            .map(allocation -> CommissionFact.record(job, rate, category, completedAt, allocation))
            .map(CommissionFactEntity::fromDomain)
            .toList();

        try {
            List<CommissionFact> facts = repository.saveAllAndFlush(entities).stream()
                .map(CommissionFactEntity::toDomain)
                .toList();
            log.info("Recorded {} commission facts for job {} (payer={}, total={})",
                facts.size(), job.getJobId(), job.getProfessionalId(), plan.allocatedTotal());
            return facts;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateCommissionException(job.getJobId(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<CommissionFact> factsForJob(String jobId) {
        return toDomain(repository.findByJobId(jobId));
    }

    @Transactional(readOnly = true)
    public boolean isRecorded(String jobId) {
        return repository.existsByJobId(jobId);
    }

    @Transactional
    public List<CommissionFact> markInvoiced(Collection<UUID> factIds, UUID invoiceId) {
        return transition(factIds, fact -> fact.markInvoiced(invoiceId));
    }

    @Transactional
    public List<CommissionFact> markPaid(Collection<UUID> factIds, UUID paymentId) {
        return transition(factIds, fact -> fact.markPaid(paymentId));
    }

    /**
     * Marks every fact of a paid invoice as PAID.
     */
    @Transactional
    public List<CommissionFact> markInvoicePaid(UUID invoiceId, UUID paymentId) {
        List<UUID> ids = repository.findByInvoiceId(invoiceId).stream()
            .map(CommissionFactEntity::getId)
            .toList();
        return markPaid(ids, paymentId);
    }

    /**
     * Returns the facts of a cancelled invoice to RECORDED so the next invoice picks them up.
     */
    @Transactional
    public List<CommissionFact> releaseFromInvoice(UUID invoiceId) {
        List<CommissionFactEntity> entities = repository.findByInvoiceId(invoiceId);
        List<CommissionFact> released = new ArrayList<>(entities.size());
        for (CommissionFactEntity entity : entities) {
            CommissionFact updated = entity.toDomain().releaseFromInvoice();
            entity.updateFromDomain(updated);
            released.add(updated);
        }
        repository.saveAll(entities);
        log.info("Released {} commission facts from cancelled invoice {}", released.size(), invoiceId);
        return released;
    }

    @Transactional(readOnly = true)
    public List<CommissionFact> findInvoiceableFacts(String professionalId, Instant periodEnd) {
        return toDomain(repository.findInvoiceable(professionalId, periodEnd));
    }

    @Transactional(readOnly = true)
    public List<CommissionFact> commissionsForProfessional(String professionalId,
                                                           Optional<CommissionFactStatus> status) {
        return toDomain(status
            .map(s -> repository.findInvolvingWithStatus(professionalId, s))
            .orElseGet(() -> repository.findInvolving(professionalId)));
    }

    @Transactional(readOnly = true)
    public List<CommissionFact> unpaidCommissions(String professionalId) {
        return toDomain(repository.findUnpaidOwedBy(professionalId));
    }

    @Transactional(readOnly = true)
    public MonthlyCommissionSummary monthlyCommissions(String professionalId, int month, int year, ZoneId zone) {
        ZonedDateTime start = ZonedDateTime.of(year, month, 1, 0, 0, 0, 0, zone);
        List<CommissionFact> facts = toDomain(repository.findInvolvingBetween(
            professionalId, start.toInstant(), start.plusMonths(1).toInstant()));

        BigDecimal owed = facts.stream()
            .filter(f -> f.isPlatformFact() && f.getPayerProfessionalId().equals(professionalId))
            .map(CommissionFact::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
        BigDecimal earned = facts.stream()
            .filter(f -> !f.isPlatformFact() && f.getRecipientId().equals(professionalId))
            .map(CommissionFact::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
        int jobs = (int) facts.stream().map(CommissionFact::getJobId).distinct().count();

        return new MonthlyCommissionSummary(professionalId, month, year, owed, earned, jobs, facts);
    }

    private List<CommissionFact> transition(Collection<UUID> factIds, UnaryOperator<CommissionFact> step) {
        Map<UUID, CommissionFactEntity> byId = repository.findByIdIn(factIds).stream()
            .collect(Collectors.toMap(CommissionFactEntity::getId, e -> e));
        List<CommissionFact> updated = new ArrayList<>(factIds.size());
        for (UUID factId : factIds) {
            CommissionFactEntity entity = byId.get(factId);
            if (entity == null) {
                throw new ResourceNotFoundException("CommissionFact", factId);
            }
            CommissionFact next = step.apply(entity.toDomain());
            entity.updateFromDomain(next);
            updated.add(next);
        }
        repository.saveAll(byId.values());
        return updated;
    }

    private void validatePlan(String jobId, CommissionPlan plan) {
        Set<String> recipients = new HashSet<>();
        for (CommissionAllocation allocation : plan.getAllocations()) {
            if (!recipients.add(allocation.getRecipientId())) {
                throw new IllegalArgumentException(
                    "Recipient " + allocation.getRecipientId() + " appears twice in commission for job " + jobId);
            }
            if (allocation.getAmount().signum() < 0) {
                throw new IllegalArgumentException("Negative allocation for job " + jobId);
            }
        }
        BigDecimal computed = plan.getBreakdown().total();
        if (plan.allocatedTotal().compareTo(computed) != 0) {
            throw new IllegalArgumentException(String.format(
                "Allocations %s do not match computed commission %s for job %s",
                plan.allocatedTotal(), computed, jobId));
        }
    }

    private static List<CommissionFact> toDomain(List<CommissionFactEntity> entities) {
        return entities.stream().map(CommissionFactEntity::toDomain).toList();
    }
}
