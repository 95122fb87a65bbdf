package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.AbstractIntegrationTest;
import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.gateway.GatewayProvider;
import com.flagship.settlement_engine.gateway.GatewayResult;
import com.flagship.settlement_engine.gateway.WebhookNotification;
import com.flagship.settlement_engine.invoice.Invoice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class PaymentControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BalanceLedgerService balanceLedger;

    private Invoice issueInvoice(String professionalId) {
        postCustomerJob(professionalId, "1000.00", midMonth(2023, 9));
        return invoiceFor(professionalId, 9, 2023);
    }

    private static String paymentBody(UUID invoiceId, String amount) {
        return """
            {"invoice_id": "%s", "amount": %s, "payment_method": "pm_card_visa"}
            """.formatted(invoiceId, amount);
    }

    @Test
    @DisplayName("POST /payments/process answers 201, then 200 for a replayed Idempotency-Key")
    void testProcessPayment_IdempotentReplay() throws Exception {
        Invoice invoice = issueInvoice(newProfessionalId("api"));
        when(stripeGateway.charge(any())).thenReturn(GatewayResult.succeeded("ch_api"));
        String key = "api-" + UUID.randomUUID();

        mockMvc.perform(post("/payments/process")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .header("X-Caller-Id", "professional-app")
                .content(paymentBody(invoice.getId(), "117.00")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.gateway_provider").value("STRIPE"))
            .andExpect(jsonPath("$.initiated_by").value("professional-app"));

        mockMvc.perform(post("/payments/process")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(paymentBody(invoice.getId(), "117.00")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.gateway_transaction_id").value("ch_api"));

        mockMvc.perform(post("/payments/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(invoice.getId(), "117.00")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INVOICE_ALREADY_PAID"));
    }

    @Test
    @DisplayName("Invalid payment requests are rejected with field details")
    void testProcessPayment_Validation() throws Exception {
        mockMvc.perform(post("/payments/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": -1, \"payment_method\": \"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.invoice_id").doesNotExist())
            .andExpect(jsonPath("$.details.invoiceId").exists())
            .andExpect(jsonPath("$.details.amount").exists());

        Invoice invoice = issueInvoice(newProfessionalId("api"));
        mockMvc.perform(post("/payments/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(invoice.getId(), "50.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("AMOUNT_MISMATCH"));
    }

    @Test
    @DisplayName("Unknown payments are 404")
    void testGetPayment_NotFound() throws Exception {
        mockMvc.perform(get("/payments/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /webhooks/{provider} reports whether the callback changed anything")
    void testWebhookEndpoint() throws Exception {
        Invoice invoice = issueInvoice(newProfessionalId("api"));
        String transactionId = "pi_" + UUID.randomUUID();
        when(stripeGateway.charge(any())).thenReturn(GatewayResult.pending(transactionId));
        when(stripeGateway.parseWebhook(anyString(), anyMap())).thenReturn(
            new WebhookNotification(GatewayProvider.STRIPE, transactionId, WebhookNotification.Status.FAILED,
                "card expired"));
        mockMvc.perform(post("/payments/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(invoice.getId(), "117.00")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PROCESSING"));

        mockMvc.perform(post("/webhooks/stripe")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Stripe-Signature", "t=1,v1=abc")
                .content("{\"type\":\"payment_intent.payment_failed\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(true));

        mockMvc.perform(post("/webhooks/stripe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"payment_intent.payment_failed\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(false));

        mockMvc.perform(get("/payments/invoice/{invoiceId}", invoice.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("FAILED"))
            .andExpect(jsonPath("$[0].failure_reason").value("card expired"));
    }

    @Test
    @DisplayName("POST /autopay/run charges enrolled professionals for the requested period")
    void testAutopayRunEndpoint() throws Exception {
        String professionalId = newProfessionalId("auto");
        postCustomerJob(professionalId, "1000.00", midMonth(2023, 8));
        invoiceFor(professionalId, 8, 2023);
        balanceLedger.enableAutopay(professionalId, "pm_saved_card");
        when(stripeGateway.charge(any())).thenReturn(GatewayResult.succeeded("ch_autopay_api"));

        mockMvc.perform(post("/autopay/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"month\": 8, \"year\": 2023}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.attempted").value(1))
            .andExpect(jsonPath("$.succeeded").value(1));

        mockMvc.perform(get("/balances/{id}", professionalId))
            .andExpect(jsonPath("$.outstanding_commissions").value(0.0));
    }
}
