package com.flagship.settlement_engine.balance;

import com.flagship.settlement_engine.AbstractIntegrationTest;
import com.flagship.settlement_engine.exception.InsufficientBalanceException;
import com.flagship.settlement_engine.exception.OverpaymentException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import com.flagship.settlement_engine.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BalanceLedgerServiceTest extends AbstractIntegrationTest {

    @Autowired
    private BalanceLedgerService balanceLedger;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("Offset moves revenue share of A against commission debt of B")
    void testOffset() {
        String creditor = newProfessionalId("a");
        String debtor = newProfessionalId("b");
        balanceLedger.addRevenueShare(creditor, new BigDecimal("50.00"), UUID.randomUUID());
        balanceLedger.addCommissionDebt(debtor, new BigDecimal("60.00"), UUID.randomUUID());

        balanceLedger.applyOffset(creditor, debtor, new BigDecimal("50.00"), UUID.randomUUID());

        assertEquals(new BigDecimal("0.00"), balanceLedger.getBalance(creditor).getPendingRevenueShares());
        assertEquals(new BigDecimal("10.00"), balanceLedger.getBalance(debtor).getOutstandingCommissions());
        assertEquals(new BigDecimal("-10.00"), balanceLedger.getBalance(debtor).getNetBalance());
    }

    @Test
    @DisplayName("Offset above min(pending, outstanding) is rejected and changes neither side")
    void testOffsetAboveMaximumRejected() {
        String creditor = newProfessionalId("a");
        String debtor = newProfessionalId("b");
        balanceLedger.addRevenueShare(creditor, new BigDecimal("50.00"), UUID.randomUUID());
        balanceLedger.addCommissionDebt(debtor, new BigDecimal("60.00"), UUID.randomUUID());

        assertThrows(InsufficientBalanceException.class,
            () -> balanceLedger.applyOffset(creditor, debtor, new BigDecimal("55.00"), UUID.randomUUID()));
        assertThrows(ValidationException.class,
            () -> balanceLedger.applyOffset(creditor, creditor, new BigDecimal("5.00"), UUID.randomUUID()));

        assertEquals(new BigDecimal("50.00"), balanceLedger.getBalance(creditor).getPendingRevenueShares());
        assertEquals(new BigDecimal("60.00"), balanceLedger.getBalance(debtor).getOutstandingCommissions());
    }

    @Test
    @DisplayName("Payment above outstanding is rejected as overpayment")
    void testOverpayment() {
        String professionalId = newProfessionalId("pro");
        balanceLedger.addCommissionDebt(professionalId, new BigDecimal("40.00"), UUID.randomUUID());

        assertThrows(OverpaymentException.class,
            () -> balanceLedger.applyPayment(professionalId, new BigDecimal("40.01"), UUID.randomUUID()));

        Balance paid = balanceLedger.applyPayment(professionalId, new BigDecimal("40.00"), UUID.randomUUID());
        assertEquals(new BigDecimal("0.00"), paid.getOutstandingCommissions());
    }

    @Test
    @DisplayName("Payout needs enough pending revenue share; a reversal puts it back")
    void testPayoutAndReversal() {
        String professionalId = newProfessionalId("pro");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("200.00"), UUID.randomUUID());
        UUID payoutId = UUID.randomUUID();

        assertThrows(InsufficientBalanceException.class,
            () -> balanceLedger.applyPayout(professionalId, new BigDecimal("200.01"), payoutId));

        balanceLedger.applyPayout(professionalId, new BigDecimal("150.00"), payoutId);
        assertEquals(new BigDecimal("50.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());

        balanceLedger.reversePayout(professionalId, new BigDecimal("150.00"), payoutId);
        assertEquals(new BigDecimal("200.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());

        List<BalanceMovement> movements = balanceLedger.movements(professionalId);
        assertEquals(3, movements.size());
        assertTrue(movements.stream().map(BalanceMovement::getMovementType).toList()
            .containsAll(List.of(MovementType.REVENUE_SHARE, MovementType.PAYOUT, MovementType.PAYOUT_REVERSAL)));
    }

    @Test
    @DisplayName("Recalculation rebuilds a drifted balance from commission history")
    void testRecalculateRepairsDrift() {
        String professionalId = newProfessionalId("drift");
        postCustomerJob(professionalId, "1000.00", midMonth(2020, 8));
        jdbcTemplate.update(
            "UPDATE balances SET outstanding_commissions = 999.00, net_balance = -999.00 WHERE professional_id = ?",
            professionalId);

        Balance repaired = balanceLedger.recalculate(professionalId);

        assertEquals(new BigDecimal("100.00"), repaired.getOutstandingCommissions());
        assertEquals(new BigDecimal("100.00"), balanceLedger.getBalance(professionalId).getOutstandingCommissions());
        assertTrue(repaired.isConsistent());
    }

    @Test
    @DisplayName("Autopay settings survive balance mutations")
    void testAutopaySettings() {
        String professionalId = newProfessionalId("auto");

        Balance enabled = balanceLedger.enableAutopay(professionalId, "pm_card_visa");
        assertTrue(enabled.isAutopayEnabled());

        balanceLedger.addCommissionDebt(professionalId, new BigDecimal("10.00"), UUID.randomUUID());
        Balance afterDebt = balanceLedger.getBalance(professionalId);
        assertTrue(afterDebt.isAutopayEnabled());
        assertEquals("pm_card_visa", afterDebt.getAutopayPaymentMethodId());

        assertFalse(balanceLedger.disableAutopay(professionalId, "test").isAutopayEnabled());
        assertThrows(ValidationException.class, () -> balanceLedger.enableAutopay(professionalId, " "));
    }

    @Test
    @DisplayName("Unknown professional has no balance")
    void testUnknownProfessional() {
        String professionalId = newProfessionalId("ghost");

        assertNull(balanceLedger.findBalance(professionalId));
        assertThrows(ResourceNotFoundException.class, () -> balanceLedger.getBalance(professionalId));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testNonPositiveAmounts() {
        String professionalId = newProfessionalId("pro");

        assertThrows(ValidationException.class,
            () -> balanceLedger.addCommissionDebt(professionalId, BigDecimal.ZERO, UUID.randomUUID()));
        assertThrows(ValidationException.class,
            () -> balanceLedger.addRevenueShare(professionalId, new BigDecimal("-1.00"), UUID.randomUUID()));
    }
}
