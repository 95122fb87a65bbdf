package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.AbstractIntegrationTest;
import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.gateway.GatewayResult;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceStatus;
import com.flagship.settlement_engine.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutopayServiceTest extends AbstractIntegrationTest {

    private static final Instant START = Instant.parse("2022-06-01T06:00:00Z");

    @Autowired
    private AutopayService autopayService;

    @Autowired
    private BalanceLedgerService balanceLedger;

    @Autowired
    private AutopayAttemptRepository attemptRepository;

    @Autowired
    private OutboxService outboxService;

    private Invoice autopayInvoice(String professionalId, int month) {
        postCustomerJob(professionalId, "1000.00", midMonth(2022, month));
        balanceLedger.enableAutopay(professionalId, "pm_saved_card");
        return invoiceFor(professionalId, month, 2022);
    }

    @Test
    @DisplayName("Autopay charges the saved payment method and settles the invoice")
    void testAutopaySuccess() {
        String professionalId = newProfessionalId("auto");
        Invoice invoice = autopayInvoice(professionalId, 3);
        when(stripeGateway.charge(any())).thenReturn(GatewayResult.succeeded("ch_auto"));

        AutopayBatchResult result = autopayService.processAutopayBatch(START, 3, 2022);

        assertEquals(1, result.getAttempted());
        assertEquals(1, result.getSucceeded());
        assertEquals(InvoiceStatus.PAID, invoiceService.getInvoice(invoice.getId()).getStatus());
        AutopayAttempt attempt = attemptRepository.findById(invoice.getId()).orElseThrow().toDomain();
        assertEquals(AutopayAttemptStatus.SUCCEEDED, attempt.getStatus());
        assertEquals(1, attempt.getAttempts());

        AutopayBatchResult again = autopayService.processAutopayBatch(START.plus(Duration.ofDays(2)), 3, 2022);
        assertEquals(0, again.getAttempted());
        verify(stripeGateway, times(1)).charge(any());
    }

    @Test
    @DisplayName("Three declined attempts exhaust autopay and switch it off")
    void testAutopayExhausted() {
        String professionalId = newProfessionalId("auto");
        Invoice invoice = autopayInvoice(professionalId, 2);
        when(stripeGateway.charge(any()))
            .thenReturn(GatewayResult.declined("ch_x", "card_declined", "Do not honor"));

        AutopayBatchResult first = autopayService.processAutopayBatch(START, 2, 2022);
        assertEquals(1, first.getFailed());
        assertEquals(0, first.getExhausted());

        AutopayBatchResult tooEarly = autopayService.processAutopayBatch(START.plus(Duration.ofHours(1)), 2, 2022);
        assertEquals(1, tooEarly.getSkipped());
        assertEquals(0, tooEarly.getAttempted());

        autopayService.processAutopayBatch(START.plus(Duration.ofHours(25)), 2, 2022);
        AutopayBatchResult third = autopayService.processAutopayBatch(START.plus(Duration.ofHours(50)), 2, 2022);

        assertEquals(1, third.getFailed());
        assertEquals(1, third.getExhausted());
        AutopayAttempt attempt = attemptRepository.findById(invoice.getId()).orElseThrow().toDomain();
        assertEquals(AutopayAttemptStatus.EXHAUSTED, attempt.getStatus());
        assertEquals(3, attempt.getAttempts());
        assertEquals("card_declined: Do not honor", attempt.getLastError());
        assertFalse(balanceLedger.getBalance(professionalId).isAutopayEnabled());
        assertEquals(1, outboxService.getEventsForAggregate("Balance", professionalId).size());
        assertEquals(InvoiceStatus.SENT, invoiceService.getInvoice(invoice.getId()).getStatus());

        AutopayBatchResult afterwards = autopayService.processAutopayBatch(START.plus(Duration.ofDays(5)), 2, 2022);
        assertEquals(0, afterwards.getAttempted());
        verify(stripeGateway, times(3)).charge(any());
    }

    @Test
    @DisplayName("An unexpected error on one invoice does not stop the rest of the run")
    void testUnexpectedErrorIsolatedPerInvoice() {
        autopayInvoice(newProfessionalId("auto"), 7);
        autopayInvoice(newProfessionalId("auto"), 7);
        when(stripeGateway.charge(any()))
            .thenThrow(new IllegalStateException("gateway client not initialised"))
            .thenReturn(GatewayResult.succeeded("ch_auto_after_error"));

        AutopayBatchResult result = autopayService.processAutopayBatch(START, 7, 2022);

        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSucceeded());
        verify(stripeGateway, times(2)).charge(any());
    }

    @Test
    @DisplayName("A pending charge waits for the provider before the next attempt")
    void testAutopayPending() {
        String professionalId = newProfessionalId("auto");
        Invoice invoice = autopayInvoice(professionalId, 4);
        when(stripeGateway.charge(any())).thenReturn(GatewayResult.pending("ch_wait"));

        AutopayBatchResult first = autopayService.processAutopayBatch(START, 4, 2022);
        AutopayBatchResult second = autopayService.processAutopayBatch(START.plus(Duration.ofHours(30)), 4, 2022);

        assertEquals(1, first.getPending());
        assertEquals(1, second.getSkipped());
        assertEquals(1, attemptRepository.findById(invoice.getId()).orElseThrow().toDomain().getAttempts());
        verify(stripeGateway, times(1)).charge(any());
    }
}
