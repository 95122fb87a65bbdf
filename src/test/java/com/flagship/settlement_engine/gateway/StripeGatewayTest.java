package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.GatewayTimeoutException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.ApiException;
import com.stripe.exception.CardException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.service.PaymentIntentService;
import com.stripe.service.RefundService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StripeGatewayTest {

    private static final String WEBHOOK_SECRET = "whsec_test";

    @Mock
    private StripeClient stripeClient;

    @Mock
    private PaymentIntentService paymentIntents;

    @Mock
    private RefundService refunds;

    private StripeGateway gateway;
    private ChargeRequest request;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStripe().setWebhookSecret(WEBHOOK_SECRET);
        gateway = new StripeGateway(stripeClient, properties, new ObjectMapper(),
            new SettlementMetrics(new SimpleMeterRegistry()));

        request = ChargeRequest.builder()
            .paymentId(UUID.randomUUID())
            .invoiceId(UUID.randomUUID())
            .professionalId("pro-1")
            .amount(new BigDecimal("117.50"))
            .currency("ILS")
            .paymentMethod("pm_card_visa")
            .description("Invoice INV-202401-ABCD1234")
            .build();
    }

    private static PaymentIntent intent(String id, String status) {
        PaymentIntent intent = new PaymentIntent();
        intent.setId(id);
        intent.setStatus(status);
        return intent;
    }

    private static String signatureHeader(String payload, long timestamp, String secret) throws Exception {
        return "t=" + timestamp + ",v1=" + Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
    }

    @Test
    @DisplayName("Succeeded intent is a successful charge; amount is sent in agorot, keyed by payment id")
    void testChargeSucceeded() throws Exception {
        when(stripeClient.paymentIntents()).thenReturn(paymentIntents);
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenReturn(intent("pi_1", "succeeded"));

        GatewayResult result = gateway.charge(request);

        assertTrue(result.isSucceeded());
        assertEquals("pi_1", result.getTransactionId());
        ArgumentCaptor<PaymentIntentCreateParams> params = ArgumentCaptor.forClass(PaymentIntentCreateParams.class);
        ArgumentCaptor<RequestOptions> options = ArgumentCaptor.forClass(RequestOptions.class);
        verify(paymentIntents).create(params.capture(), options.capture());
        assertEquals(11750L, params.getValue().getAmount());
        assertEquals("ils", params.getValue().getCurrency());
        assertEquals(request.getPaymentId().toString(), options.getValue().getIdempotencyKey());
    }

    @Test
    @DisplayName("Processing intent is pending")
    void testChargePending() throws Exception {
        when(stripeClient.paymentIntents()).thenReturn(paymentIntents);
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenReturn(intent("pi_2", "processing"));

        GatewayResult result = gateway.charge(request);

        assertEquals(GatewayResult.Outcome.PENDING, result.getOutcome());
        assertEquals("pi_2", result.getTransactionId());
    }

    @Test
    @DisplayName("Card error is a decline, not an exception")
    void testChargeDeclined() throws Exception {
        when(stripeClient.paymentIntents()).thenReturn(paymentIntents);
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenThrow(new CardException("Your card has insufficient funds.", "req_1", "card_declined",
                null, "insufficient_funds", null, 402, null));

        GatewayResult result = gateway.charge(request);

        assertEquals(GatewayResult.Outcome.DECLINED, result.getOutcome());
        assertEquals("insufficient_funds", result.getErrorCode());
        assertTrue(result.failureReason().startsWith("insufficient_funds: Your card has insufficient funds."));
    }

    @Test
    @DisplayName("Stripe 5xx is a retryable gateway error")
    void testServerError() throws Exception {
        when(stripeClient.paymentIntents()).thenReturn(paymentIntents);
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenThrow(new ApiException("Internal error", "req_2", null, 500, null));

        GatewayException error = assertThrows(GatewayException.class, () -> gateway.charge(request));

        assertTrue(error.isRetryable());
        assertEquals("GATEWAY_ERROR", error.getErrorCode());
    }

    @Test
    @DisplayName("Socket timeout surfaces as GATEWAY_TIMEOUT")
    void testTimeout() throws Exception {
        when(stripeClient.paymentIntents()).thenReturn(paymentIntents);
        when(paymentIntents.create(any(PaymentIntentCreateParams.class), any(RequestOptions.class)))
            .thenThrow(new ApiConnectionException("IOException during API request",
                new SocketTimeoutException("Read timed out")));

        GatewayTimeoutException error = assertThrows(GatewayTimeoutException.class, () -> gateway.charge(request));

        assertEquals("GATEWAY_TIMEOUT", error.getErrorCode());
        assertTrue(error.isRetryable());
    }

    @Test
    @DisplayName("Refund goes against the payment intent and maps the refund status")
    void testRefund() throws Exception {
        Refund refund = new Refund();
        refund.setId("re_1");
        refund.setStatus("succeeded");
        when(stripeClient.refunds()).thenReturn(refunds);
        when(refunds.create(any(RefundCreateParams.class), any(RequestOptions.class))).thenReturn(refund);

        GatewayResult result = gateway.refund(RefundRequest.builder()
            .paymentId(request.getPaymentId())
            .transactionId("pi_1")
            .amount(new BigDecimal("10.00"))
            .currency("ILS")
            .reason("duplicate")
            .build());

        assertTrue(result.isSucceeded());
        assertEquals("re_1", result.getTransactionId());
        ArgumentCaptor<RefundCreateParams> params = ArgumentCaptor.forClass(RefundCreateParams.class);
        verify(refunds).create(params.capture(), any(RequestOptions.class));
        assertEquals("pi_1", params.getValue().getPaymentIntent());
        assertEquals(1000L, params.getValue().getAmount());
        assertEquals(RefundCreateParams.Reason.DUPLICATE, params.getValue().getReason());
    }

    @Test
    @DisplayName("Freshly signed webhook is parsed into a notification")
    void testWebhookWithValidSignature() throws Exception {
        String payload = "{\"type\":\"payment_intent.payment_failed\",\"data\":{\"object\":"
            + "{\"id\":\"pi_9\",\"last_payment_error\":{\"message\":\"card expired\"}}}}";
        String header = signatureHeader(payload, Instant.now().getEpochSecond(), WEBHOOK_SECRET);

        WebhookNotification notification = gateway.parseWebhook(payload,
            Map.of(StripeGateway.SIGNATURE_HEADER, header));

        assertEquals("pi_9", notification.getExternalId());
        assertEquals(WebhookNotification.Status.FAILED, notification.getStatus());
        assertEquals("card expired", notification.getError());
        assertEquals("stripe:pi_9", notification.eventKey());
    }

    @Test
    @DisplayName("Tampered, unsigned or stale webhooks are rejected")
    void testWebhookWithBadSignature() throws Exception {
        String payload = "{\"type\":\"payment_intent.succeeded\",\"data\":{\"object\":{\"id\":\"pi_9\"}}}";
        long now = Instant.now().getEpochSecond();

        assertThrows(ValidationException.class, () -> gateway.parseWebhook(payload,
            Map.of(StripeGateway.SIGNATURE_HEADER, signatureHeader(payload, now, "another_secret"))));
        assertThrows(ValidationException.class, () -> gateway.parseWebhook(payload, Map.of()));
        assertThrows(ValidationException.class, () -> gateway.parseWebhook(payload,
            Map.of(StripeGateway.SIGNATURE_HEADER, "garbage")));
    }

    @Test
    @DisplayName("A correctly signed webhook replayed after the tolerance window is rejected")
    void testReplayedWebhookRejected() throws Exception {
        String payload = "{\"type\":\"payment_intent.succeeded\",\"data\":{\"object\":{\"id\":\"pi_old\"}}}";
        long tenMinutesAgo = Instant.now().minusSeconds(600).getEpochSecond();
        String header = signatureHeader(payload, tenMinutesAgo, WEBHOOK_SECRET);

        assertThrows(ValidationException.class, () -> gateway.parseWebhook(payload,
            Map.of(StripeGateway.SIGNATURE_HEADER, header)));
    }
}
