package com.flagship.settlement_engine.balance;

import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.exception.InsufficientBalanceException;
import com.flagship.settlement_engine.exception.OverpaymentException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import com.flagship.settlement_engine.exception.SettlementEngineException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * The only writer of professional balances.
 *
 * Every mutation:
 * 1. takes the professional's lock (reentrant, so callers already holding it pass straight through)
 * 2. runs in a transaction, joining the caller's if there is one
 * 3. loads or lazily creates the balance row, applies the domain operation, saves it
 * 4. appends a {@link BalanceMovement} with the resulting position
 *
 * Rejected operations (overpayment, insufficient funds) leave the row untouched.
 */
@Service
@Slf4j
public class BalanceLedgerService {

    private final BalanceRepository balanceRepository;
    private final BalanceMovementRepository movementRepository;
    private final BalanceHistoryQueries historyQueries;
    private final ProfessionalLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;
    private final BigDecimal overpaymentTolerance;

    public BalanceLedgerService(BalanceRepository balanceRepository,
                                BalanceMovementRepository movementRepository,
                                BalanceHistoryQueries historyQueries,
                                ProfessionalLockRegistry locks,
                                TransactionTemplate transactionTemplate,
                                SettlementMetrics metrics,
                                SettlementProperties properties) {
        this.balanceRepository = balanceRepository;
        this.movementRepository = movementRepository;
        this.historyQueries = historyQueries;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.overpaymentTolerance = Money.round(properties.getOverpaymentTolerance());
    }

    /**
     * Adds commission owed to the platform.
     */
    public Balance addCommissionDebt(String professionalId, BigDecimal amount, UUID commissionFactId) {
        ValidationException.requirePositive(amount, "Commission amount");
        return mutate(professionalId, MovementType.COMMISSION_DEBT, amount, commissionFactId,
            balance -> balance.addCommissionDebt(amount));
    }

    /**
     * Adds a referral share the professional has earned.
     */
    public Balance addRevenueShare(String professionalId, BigDecimal amount, UUID commissionFactId) {
        ValidationException.requirePositive(amount, "Revenue share amount");
        return mutate(professionalId, MovementType.REVENUE_SHARE, amount, commissionFactId,
            balance -> balance.addRevenueShare(amount));
    }

    /**
     * Reduces outstanding commissions by a completed payment.
     *
     * @throws OverpaymentException if the amount exceeds outstanding by more than the configured tolerance
     */
    public Balance applyPayment(String professionalId, BigDecimal amount, UUID paymentId) {
        ValidationException.requirePositive(amount, "Payment amount");
        return mutate(professionalId, MovementType.PAYMENT, amount, paymentId,
            balance -> balance.applyPayment(amount, overpaymentTolerance));
    }

    /**
     * @throws InsufficientBalanceException if the amount exceeds pending revenue shares
     */
    public Balance applyPayout(String professionalId, BigDecimal amount, UUID payoutId) {
        ValidationException.requirePositive(amount, "Payout amount");
        return mutate(professionalId, MovementType.PAYOUT, amount, payoutId,
            balance -> balance.applyPayout(amount));
    }

    /**
     * Restores revenue shares held by a payout that failed downstream.
     */
    public Balance reversePayout(String professionalId, BigDecimal amount, UUID payoutId) {
        ValidationException.requirePositive(amount, "Payout amount");
        return mutate(professionalId, MovementType.PAYOUT_REVERSAL, amount, payoutId,
            balance -> balance.reversePayout(amount));
    }

    /**
     * Nets {@code creditorId}'s revenue shares against {@code debtorId}'s commission debt.
     * Both sides change in one transaction or neither does.
     *
     * @throws InsufficientBalanceException if amount > min(creditor pending, debtor outstanding)
     */
    public void applyOffset(String creditorId, String debtorId, BigDecimal amount, UUID offsetId) {
        ValidationException.requirePositive(amount, "Offset amount");
        if (creditorId.equals(debtorId)) {
            throw new ValidationException("A professional cannot be offset against themself: " + creditorId);
        }
        locks.withLocks(List.of(creditorId, debtorId), () -> transactionTemplate.execute(status -> {
            Balance creditor = currentOrInitial(creditorId);
            Balance debtor = currentOrInitial(debtorId);
            BigDecimal max = Balance.maxOffset(creditor, debtor);
            if (amount.compareTo(max) > 0) {
                metrics.recordBalanceMutation("offset", "rejected");
                throw new InsufficientBalanceException(String.format(
                    "Offset %s exceeds maximum %s (pending of %s=%s, outstanding of %s=%s)",
                    amount, max, creditorId, creditor.getPendingRevenueShares(),
                    debtorId, debtor.getOutstandingCommissions()));
            }
            mutate(creditorId, MovementType.OFFSET_CREDIT_RELEASED, amount, offsetId,
                balance -> balance.releaseRevenueShareForOffset(amount));
            mutate(debtorId, MovementType.OFFSET_DEBT_SETTLED, amount, offsetId,
                balance -> balance.settleDebtByOffset(amount));
            return null;
        }));
    }

    /**
     * Rebuilds a balance from commission, invoice, payout and offset history and
     * overwrites the stored fields. Used to repair drift.
     */
    public Balance recalculate(String professionalId) {
        return locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
            BigDecimal outstanding = historyQueries.platformCommissionsOwed(professionalId)
                .subtract(historyQueries.paidInvoiceSubtotals(professionalId))
                .subtract(historyQueries.offsetsSettledAsDebtor(professionalId));
            BigDecimal pending = historyQueries.revenueSharesEarned(professionalId)
                .subtract(historyQueries.payoutsNotFailed(professionalId))
                .subtract(historyQueries.offsetsReleasedAsCreditor(professionalId));

            BalanceEntity entity = loadOrCreate(professionalId);
            Balance before = entity.toDomain();
            Balance after = before.reconcile(outstanding, pending);

            if (before.getOutstandingCommissions().compareTo(after.getOutstandingCommissions()) != 0
                    || before.getPendingRevenueShares().compareTo(after.getPendingRevenueShares()) != 0) {
                log.warn("Balance drift corrected for {}: outstanding {} -> {}, pending {} -> {}",
                    professionalId,
                    before.getOutstandingCommissions(), after.getOutstandingCommissions(),
                    before.getPendingRevenueShares(), after.getPendingRevenueShares());
            }

            entity.updateFromDomain(after);
            balanceRepository.save(entity);
            journal(after, MovementType.RECALCULATION, Money.ZERO, null);
            metrics.recordBalanceMutation("recalculation", "success");
            return after;
        }));
    }

    /**
     * Takes a paid invoice's subtotal off outstanding commissions. Offsets applied after the
     * invoice was built may already have cleared part of that debt; only what is still
     * outstanding is taken off.
     *
     * @return the amount actually taken off, at most {@code subtotal}
     */
    public BigDecimal settleInvoicedDebt(String professionalId, BigDecimal subtotal, UUID referenceId) {
        ValidationException.requirePositive(subtotal, "Invoice subtotal");
        return locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
            Balance current = findBalance(professionalId);
            BigDecimal outstanding = current != null ? current.getOutstandingCommissions() : Money.ZERO;
            BigDecimal applied = Money.min(Money.round(subtotal), outstanding);
            if (applied.signum() > 0) {
                applyPayment(professionalId, applied, referenceId);
            }
            if (applied.compareTo(subtotal) < 0) {
                log.info("Invoice subtotal {} for {} exceeds outstanding {}; settled {}",
                    subtotal, professionalId, outstanding, applied);
            }
            return applied;
        }));
    }

    public Balance enableAutopay(String professionalId, String paymentMethodId) {
        if (paymentMethodId == null || paymentMethodId.isBlank()) {
            throw new ValidationException("payment_method_id is required to enable autopay");
        }
        return updateSettings(professionalId, balance -> balance.enableAutopay(paymentMethodId));
    }

    public Balance disableAutopay(String professionalId, String reason) {
        log.info("Disabling autopay for {}: {}", professionalId, reason);
        return updateSettings(professionalId, Balance::disableAutopay);
    }

    /**
     * @throws ResourceNotFoundException if the professional has never had a balance
     */
    public Balance getBalance(String professionalId) {
        Balance balance = findBalance(professionalId);
        if (balance == null) {
            throw new ResourceNotFoundException("Balance", professionalId);
        }
        return balance;
    }

    public Balance findBalance(String professionalId) {
        return balanceRepository.findById(professionalId)
            .map(BalanceEntity::toDomain)
            .orElse(null);
    }

    public List<Balance> listBalances(boolean withOutstandingOnly) {
        List<BalanceEntity> entities = withOutstandingOnly
            ? balanceRepository.findWithOutstandingCommissions()
            : balanceRepository.findAllByOrderByProfessionalIdAsc();
        return entities.stream().map(BalanceEntity::toDomain).toList();
    }

    /**
     * Professionals the monthly settlement should consider.
     */
    public List<String> professionalsWithOutstanding() {
        return balanceRepository.findProfessionalIdsWithOutstandingCommissions();
    }

    public List<BalanceMovement> movements(String professionalId) {
        return movementRepository.findByProfessionalIdOrderByCreatedAtAsc(professionalId)
            .stream()
            .map(BalanceMovementEntity::toDomain)
            .toList();
    }

    private Balance currentOrInitial(String professionalId) {
        Balance balance = findBalance(professionalId);
        return balance != null ? balance : Balance.initial(professionalId);
    }

    private Balance mutate(String professionalId, MovementType type, BigDecimal amount,
                           UUID referenceId, UnaryOperator<Balance> operation) {
        String metricName = type.name().toLowerCase(Locale.ROOT);
        try {
            Balance result = locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
                BalanceEntity entity = loadOrCreate(professionalId);
                Balance updated = operation.apply(entity.toDomain());
                entity.updateFromDomain(updated);
                balanceRepository.save(entity);
                journal(updated, type, Money.round(amount), referenceId);
                return updated;
            }));
            metrics.recordBalanceMutation(metricName, "success");
            log.debug("Balance {} for {}: amount={}, outstanding={}, pending={}, net={}",
                type, professionalId, amount, result.getOutstandingCommissions(),
                result.getPendingRevenueShares(), result.getNetBalance());
            return result;
        } catch (SettlementEngineException e) {
            metrics.recordBalanceMutation(metricName, "rejected");
            throw e;
        }
    }

    private Balance updateSettings(String professionalId, UnaryOperator<Balance> operation) {
        return locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
            BalanceEntity entity = loadOrCreate(professionalId);
            Balance updated = operation.apply(entity.toDomain());
            entity.updateFromDomain(updated);
            balanceRepository.save(entity);
            return updated;
        }));
    }

    private BalanceEntity loadOrCreate(String professionalId) {
        return balanceRepository.findById(professionalId)
            .orElseGet(() -> {
                log.info("Creating balance for professional {}", professionalId);
                return balanceRepository.save(BalanceEntity.fromDomain(Balance.initial(professionalId)));
            });
    }

    private void journal(Balance after, MovementType type, BigDecimal amount, UUID referenceId) {
        movementRepository.save(BalanceMovementEntity.fromDomain(
            BalanceMovement.of(after, type, amount, referenceId)));
    }
}
