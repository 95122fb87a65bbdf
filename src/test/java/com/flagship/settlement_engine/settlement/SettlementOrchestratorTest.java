package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.AbstractIntegrationTest;
import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.InsufficientBalanceException;
import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceCredit;
import com.flagship.settlement_engine.invoice.InvoiceCreditStatus;
import com.flagship.settlement_engine.settlement.bank.BankTransferRequest;
import com.flagship.settlement_engine.settlement.bank.BankTransferResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettlementOrchestratorTest extends AbstractIntegrationTest {

    private static final BankDetails BANK = new BankDetails("Leumi", "800", "123456789", "Dana Levi", null);

    @Autowired
    private SettlementOrchestrator orchestrator;

    @Autowired
    private BalanceLedgerService balanceLedger;

    @Test
    @DisplayName("Monthly run invoices every eligible professional once, even when run twice")
    void testMonthlySettlementRun() {
        String first = newProfessionalId("run");
        String second = newProfessionalId("run");
        postCustomerJob(first, "1000.00", midMonth(2001, 2));
        postCustomerJob(second, "2000.00", midMonth(2001, 2));

        MonthlySettlement settlement = orchestrator.runMonthlySettlement(2, 2001, "ops");
        SettlementReport report = settlement.getReport();

        assertEquals(SettlementRunStatus.COMPLETED, report.getStatus());
        assertTrue(report.getInvoicedProfessionals().containsAll(List.of(first, second)));
        assertTrue(report.getErrors().stream()
            .noneMatch(e -> e.getProfessionalId().equals(first) || e.getProfessionalId().equals(second)));
        assertTrue(report.getNotProcessed().isEmpty());
        assertEquals(report.getEligibleCount(),
            report.getInvoicesCreated() + report.getSkippedCount() + report.getFailedCount());
        Invoice secondInvoice = settlement.getInvoices().stream()
            .filter(i -> i.getProfessionalId().equals(second))
            .findFirst()
            .orElseThrow();
        assertEquals(new BigDecimal("200.00"), secondInvoice.getSubtotal());

        SettlementReport rerun = orchestrator.runMonthlySettlement(2, 2001, "ops").getReport();

        assertFalse(rerun.getInvoicedProfessionals().contains(first));
        assertTrue(rerun.getSkippedProfessionals().containsAll(List.of(first, second)));
        assertEquals(1, invoiceService.invoicesForProfessional(first).size());

        SettlementRun stored = orchestrator.getRun(report.getRunId());
        assertEquals(SettlementRunStatus.COMPLETED, stored.getStatus());
        assertNotNull(stored.getFinishedAt());
        assertEquals(report.getInvoicesCreated(), stored.getInvoicesCreated());
        assertEquals(report.getFailedCount(), orchestrator.errorsForRun(report.getRunId()).size());
    }

    @Test
    @DisplayName("A finished run cannot be cancelled and unknown runs are not found")
    void testCancelFinishedRun() {
        UUID runId = orchestrator.runMonthlySettlement(3, 2001, "ops").getReport().getRunId();

        assertThrows(InvalidStateTransitionException.class, () -> orchestrator.cancelRun(runId));
        assertThrows(ResourceNotFoundException.class, () -> orchestrator.getRun(UUID.randomUUID()));
        assertThrows(ValidationException.class, () -> orchestrator.runMonthlySettlement(0, 2001, "ops"));
    }

    @Test
    @DisplayName("Payout validation: bank details, minimum amount and available balance")
    void testPayoutValidation() {
        String professionalId = newProfessionalId("pay");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("150.00"), UUID.randomUUID());

        assertThrows(ValidationException.class, () -> orchestrator.createPayout(professionalId,
            new BigDecimal("120.00"), PayoutMethod.BANK_TRANSFER, null, null, "ops"));
        assertThrows(ValidationException.class, () -> orchestrator.createPayout(professionalId,
            new BigDecimal("120.00"), PayoutMethod.BANK_TRANSFER,
            new BankDetails("Leumi", "800", " ", "Dana Levi", null), null, "ops"));
        assertThrows(ValidationException.class, () -> orchestrator.createPayout(professionalId,
            new BigDecimal("99.99"), PayoutMethod.MANUAL_CHECK, null, null, "ops"));
        assertThrows(InsufficientBalanceException.class, () -> orchestrator.createPayout(professionalId,
            new BigDecimal("150.01"), PayoutMethod.MANUAL_CHECK, null, null, "ops"));

        assertEquals(new BigDecimal("150.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());
        assertTrue(orchestrator.payoutsForProfessional(professionalId).isEmpty());
    }

    @Test
    @DisplayName("Credit payouts skip the minimum, complete at once and create an invoice credit")
    void testCreditPayout() {
        String professionalId = newProfessionalId("pay");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("40.00"), UUID.randomUUID());

        Payout payout = orchestrator.createPayout(professionalId, new BigDecimal("25.00"),
            PayoutMethod.CREDIT_TO_NEXT_INVOICE, null, "march", "ops");

        assertEquals(PayoutStatus.COMPLETED, payout.getStatus());
        assertEquals(new BigDecimal("15.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());
        List<InvoiceCredit> credits = invoiceService.creditsForProfessional(professionalId);
        assertEquals(1, credits.size());
        assertEquals(InvoiceCreditStatus.AVAILABLE, credits.get(0).getStatus());
        assertEquals(payout.getId(), credits.get(0).getSourcePayoutId());
        assertEquals(new BigDecimal("25.00"), credits.get(0).getRemainingAmount());
    }

    @Test
    @DisplayName("Accepted bank transfer completes the payout with the bank reference")
    void testBulkPayoutAccepted() {
        String professionalId = newProfessionalId("pay");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("500.00"), UUID.randomUUID());
        Payout queued = orchestrator.createPayout(professionalId, new BigDecimal("300.00"),
            PayoutMethod.BANK_TRANSFER, BANK, null, "ops");
        assertEquals(PayoutStatus.QUEUED, queued.getStatus());
        assertTrue(orchestrator.pendingPayouts().stream().anyMatch(p -> p.getId().equals(queued.getId())));
        when(bankTransferClient.transfer(any())).thenReturn(BankTransferResult.accepted("BANK-REF-1"));

        List<Payout> processed = orchestrator.processBulkPayouts(List.of(queued.getId(), queued.getId()), "ops");

        assertEquals(1, processed.size());
        assertEquals(PayoutStatus.COMPLETED, processed.get(0).getStatus());
        assertEquals("BANK-REF-1", processed.get(0).getReference());
        assertEquals(new BigDecimal("200.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());
        ArgumentCaptor<BankTransferRequest> request = ArgumentCaptor.forClass(BankTransferRequest.class);
        verify(bankTransferClient).transfer(request.capture());
        assertEquals(queued.getId(), request.getValue().getPayoutId());
        assertEquals(new BigDecimal("300.00"), request.getValue().getAmount());

        List<Payout> again = orchestrator.processBulkPayouts(List.of(queued.getId()), "ops");
        assertEquals(PayoutStatus.COMPLETED, again.get(0).getStatus());
    }

    @Test
    @DisplayName("Rejected or failed bank transfers fail the payout and return the money")
    void testBulkPayoutRejected() {
        String professionalId = newProfessionalId("pay");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("500.00"), UUID.randomUUID());
        Payout rejected = orchestrator.createPayout(professionalId, new BigDecimal("200.00"),
            PayoutMethod.BANK_TRANSFER, BANK, null, "ops");
        Payout unreachable = orchestrator.createPayout(professionalId, new BigDecimal("100.00"),
            PayoutMethod.BANK_TRANSFER, BANK, null, "ops");
        assertEquals(new BigDecimal("200.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());
        when(bankTransferClient.transfer(any()))
            .thenReturn(BankTransferResult.rejected("account closed"))
            .thenThrow(new GatewayException("bank unreachable", true));

        List<Payout> processed = orchestrator.processBulkPayouts(
            List.of(rejected.getId(), unreachable.getId()), "ops");

        assertEquals(PayoutStatus.FAILED, processed.get(0).getStatus());
        assertEquals("account closed", processed.get(0).getFailureReason());
        assertEquals(PayoutStatus.FAILED, processed.get(1).getStatus());
        assertEquals(new BigDecimal("500.00"), balanceLedger.getBalance(professionalId).getPendingRevenueShares());
    }

    @Test
    @DisplayName("Manual cheques are confirmed without calling the bank")
    void testManualCheckConfirmed() {
        String professionalId = newProfessionalId("pay");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("100.00"), UUID.randomUUID());
        Payout cheque = orchestrator.createPayout(professionalId, new BigDecimal("100.00"),
            PayoutMethod.MANUAL_CHECK, null, "cheque 1002", "ops");
        assertEquals(PayoutStatus.PENDING_MANUAL, cheque.getStatus());

        Payout confirmed = orchestrator.processBulkPayouts(List.of(cheque.getId()), "ops").get(0);

        assertEquals(PayoutStatus.COMPLETED, confirmed.getStatus());
        assertNotNull(confirmed.getProcessedAt());
        verify(bankTransferClient, never()).transfer(any());
    }

    @Test
    @DisplayName("Bulk processing with an unknown payout id processes nothing")
    void testBulkPayoutUnknownId() {
        String professionalId = newProfessionalId("pay");
        balanceLedger.addRevenueShare(professionalId, new BigDecimal("100.00"), UUID.randomUUID());
        Payout cheque = orchestrator.createPayout(professionalId, new BigDecimal("100.00"),
            PayoutMethod.MANUAL_CHECK, null, null, "ops");

        assertThrows(ResourceNotFoundException.class,
            () -> orchestrator.processBulkPayouts(List.of(cheque.getId(), UUID.randomUUID()), "ops"));
        assertEquals(PayoutStatus.PENDING_MANUAL, orchestrator.getPayout(cheque.getId()).getStatus());
    }

    @Test
    @DisplayName("Offset is recorded and visible to both professionals")
    void testBalanceOffset() {
        String creditor = newProfessionalId("a");
        String debtor = newProfessionalId("b");
        balanceLedger.addRevenueShare(creditor, new BigDecimal("50.00"), UUID.randomUUID());
        balanceLedger.addCommissionDebt(debtor, new BigDecimal("60.00"), UUID.randomUUID());

        OffsetRecord offset = orchestrator.processBalanceOffset(creditor, debtor, new BigDecimal("50.00"),
            "shared job", "ops");

        assertEquals(new BigDecimal("50.00"), offset.getOffsetAmount());
        assertEquals(new BigDecimal("0.00"), balanceLedger.getBalance(creditor).getPendingRevenueShares());
        assertEquals(new BigDecimal("10.00"), balanceLedger.getBalance(debtor).getOutstandingCommissions());
        assertEquals(1, orchestrator.offsetsForProfessional(creditor).size());
        assertEquals(offset.getId(), orchestrator.offsetsForProfessional(debtor).get(0).getId());

        assertThrows(InsufficientBalanceException.class,
            () -> orchestrator.processBalanceOffset(creditor, debtor, new BigDecimal("1.00"), null, "ops"));
        assertEquals(1, orchestrator.offsetsForProfessional(creditor).size());
    }
}
