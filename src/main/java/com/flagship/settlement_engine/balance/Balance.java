package com.flagship.settlement_engine.balance;

import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.exception.InsufficientBalanceException;
import com.flagship.settlement_engine.exception.OverpaymentException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Net financial position of one professional against the platform.
 *
 * Key principles:
 * - netBalance is always pendingRevenueShares − outstandingCommissions; it is
 *   derived in the only constructor and can never be supplied from outside
 * - both underlying fields stay ≥ 0; operations that would break that are rejected
 * - every operation returns a new Balance
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Balance {
    String professionalId;
    BigDecimal outstandingCommissions;
    BigDecimal pendingRevenueShares;
    BigDecimal netBalance;
    Instant lastUpdated;
    boolean autopayEnabled;
    String autopayPaymentMethodId;

    /**
     * Zero balance for a professional seen for the first time.
     */
    public static Balance initial(String professionalId) {
        return restore(professionalId, Money.ZERO, Money.ZERO, Instant.now(), false, null);
    }

    /**
     * Rebuilds a balance from stored fields, recomputing the net value.
     */
    public static Balance restore(String professionalId, BigDecimal outstandingCommissions,
                                  BigDecimal pendingRevenueShares, Instant lastUpdated,
                                  boolean autopayEnabled, String autopayPaymentMethodId) {
        BigDecimal outstanding = Money.round(outstandingCommissions);
        BigDecimal pending = Money.round(pendingRevenueShares);
        if (outstanding.signum() < 0 || pending.signum() < 0) {
            throw new IllegalStateException(String.format(
                "Balance of %s cannot be negative: outstanding=%s, pending=%s",
                professionalId, outstanding, pending));
        }
        return new Balance(professionalId, outstanding, pending, pending.subtract(outstanding),
            lastUpdated, autopayEnabled, autopayPaymentMethodId);
    }

    public Balance addCommissionDebt(BigDecimal amount) {
        return withAmounts(outstandingCommissions.add(amount), pendingRevenueShares);
    }

    public Balance addRevenueShare(BigDecimal amount) {
        return withAmounts(outstandingCommissions, pendingRevenueShares.add(amount));
    }

    /**
     * Reduces outstanding commissions by a completed payment.
     *
     * @param tolerance how far the payment may exceed the outstanding amount
     * @throws OverpaymentException if amount > outstanding + tolerance
     */
    public Balance applyPayment(BigDecimal amount, BigDecimal tolerance) {
        if (amount.compareTo(outstandingCommissions.add(tolerance)) > 0) {
            throw new OverpaymentException(professionalId, amount, outstandingCommissions);
        }
        BigDecimal remaining = outstandingCommissions.subtract(amount).max(Money.ZERO);
        return withAmounts(remaining, pendingRevenueShares);
    }

    /**
     * @throws InsufficientBalanceException if amount > pending revenue shares
     */
    public Balance applyPayout(BigDecimal amount) {
        if (amount.compareTo(pendingRevenueShares) > 0) {
            throw new InsufficientBalanceException(professionalId, amount, pendingRevenueShares);
        }
        return withAmounts(outstandingCommissions, pendingRevenueShares.subtract(amount));
    }

    /**
     * Puts back the amount of a payout that could not be delivered.
     */
    public Balance reversePayout(BigDecimal amount) {
        return withAmounts(outstandingCommissions, pendingRevenueShares.add(amount));
    }

    /**
     * Creditor side of an offset: revenue share given up to cancel another professional's debt.
     */
    public Balance releaseRevenueShareForOffset(BigDecimal amount) {
        if (amount.compareTo(pendingRevenueShares) > 0) {
            throw new InsufficientBalanceException(professionalId, amount, pendingRevenueShares);
        }
        return withAmounts(outstandingCommissions, pendingRevenueShares.subtract(amount));
    }

    /**
     * Debtor side of an offset: commission debt cancelled by another professional's revenue share.
     */
    public Balance settleDebtByOffset(BigDecimal amount) {
        if (amount.compareTo(outstandingCommissions) > 0) {
            throw new InsufficientBalanceException(professionalId, amount, outstandingCommissions);
        }
        return withAmounts(outstandingCommissions.subtract(amount), pendingRevenueShares);
    }

    /**
     * Largest amount that can be offset from {@code creditor}'s revenue shares against {@code debtor}'s debt.
     */
    public static BigDecimal maxOffset(Balance creditor, Balance debtor) {
        return Money.min(creditor.getPendingRevenueShares(), debtor.getOutstandingCommissions());
    }

    /**
     * Replaces both fields with values recomputed from history. Negative results clamp to zero.
     */
    public Balance reconcile(BigDecimal outstanding, BigDecimal pending) {
        return withAmounts(outstanding.max(Money.ZERO), pending.max(Money.ZERO));
    }

    public Balance enableAutopay(String paymentMethodId) {
        return new Balance(professionalId, outstandingCommissions, pendingRevenueShares, netBalance,
            Instant.now(), true, paymentMethodId);
    }

    public Balance disableAutopay() {
        return new Balance(professionalId, outstandingCommissions, pendingRevenueShares, netBalance,
            Instant.now(), false, autopayPaymentMethodId);
    }

    public boolean isConsistent() {
        return outstandingCommissions.signum() >= 0
            && pendingRevenueShares.signum() >= 0
            && netBalance.compareTo(pendingRevenueShares.subtract(outstandingCommissions)) == 0;
    }

    private Balance withAmounts(BigDecimal outstanding, BigDecimal pending) {
        return restore(professionalId, outstanding, pending, Instant.now(), autopayEnabled, autopayPaymentMethodId);
    }
}
