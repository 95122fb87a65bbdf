package com.flagship.settlement_engine.balance;

import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.exception.SettlementEngineException;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random operation sequences against a single Balance.
 */
class BalanceInvariantPropertyTest {

    enum Kind { DEBT, SHARE, PAYMENT, PAYOUT, REVERSAL, RELEASE, SETTLE }

    static final class Step {
        final Kind kind;
        final BigDecimal amount;

        Step(Kind kind, BigDecimal amount) {
            this.kind = kind;
            this.amount = amount;
        }

        @Override
        public String toString() {
            return kind + "(" + amount + ")";
        }
    }

    @Provide
    Arbitrary<List<Step>> steps() {
        Arbitrary<Step> step = Combinators.combine(
            Arbitraries.of(Kind.class),
            Arbitraries.bigDecimals().between(new BigDecimal("0.01"), new BigDecimal("5000")).ofScale(2)
        ).as(Step::new);
        return step.list().ofMaxSize(40);
    }

    @Property
    @Label("Net balance is pending minus outstanding and neither side goes negative")
    void invariantsHoldAfterEveryStep(@ForAll("steps") List<Step> steps) {
        Balance balance = Balance.initial("pro-prop");
        for (Step step : steps) {
            Balance before = balance;
            try {
                balance = apply(balance, step);
            } catch (SettlementEngineException rejected) {
                balance = before;
            }
            assertTrue(balance.isConsistent(), "inconsistent after " + step + ": " + balance);
            assertEquals(0, balance.getNetBalance()
                .compareTo(balance.getPendingRevenueShares().subtract(balance.getOutstandingCommissions())));
        }
    }

    @Property
    @Label("An offset never moves more than min(creditor pending, debtor outstanding)")
    void offsetBoundedByBothSides(@ForAll("steps") List<Step> creditorSteps,
                                  @ForAll("steps") List<Step> debtorSteps) {
        Balance creditor = replay(Balance.initial("pro-a"), creditorSteps);
        Balance debtor = replay(Balance.initial("pro-b"), debtorSteps);

        BigDecimal max = Balance.maxOffset(creditor, debtor);

        assertTrue(max.compareTo(creditor.getPendingRevenueShares()) <= 0);
        assertTrue(max.compareTo(debtor.getOutstandingCommissions()) <= 0);
        if (max.signum() > 0) {
            Balance released = creditor.releaseRevenueShareForOffset(max);
            Balance settled = debtor.settleDebtByOffset(max);
            assertTrue(released.isConsistent());
            assertTrue(settled.isConsistent());
            assertEquals(0, released.getPendingRevenueShares()
                .compareTo(creditor.getPendingRevenueShares().subtract(max)));
        }
    }

    private static Balance replay(Balance balance, List<Step> steps) {
        for (Step step : steps) {
            try {
                balance = apply(balance, step);
            } catch (SettlementEngineException rejected) {
                // rejected steps leave the balance as it was
            }
        }
        return balance;
    }

    private static Balance apply(Balance balance, Step step) {
        return switch (step.kind) {
            case DEBT -> balance.addCommissionDebt(step.amount);
            case SHARE -> balance.addRevenueShare(step.amount);
            case PAYMENT -> balance.applyPayment(step.amount, Money.ZERO);
            case PAYOUT -> balance.applyPayout(step.amount);
            case REVERSAL -> balance.reversePayout(step.amount);
            case RELEASE -> balance.releaseRevenueShareForOffset(step.amount);
            case SETTLE -> balance.settleDebtByOffset(step.amount);
        };
    }
}
