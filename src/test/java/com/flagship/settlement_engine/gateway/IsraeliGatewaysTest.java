package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Cardcom (JSON) and Tranzila (form-encoded) adapters against a mocked provider.
 */
class IsraeliGatewaysTest {

    private static final String CARDCOM_URL = "https://cardcom.test";
    private static final String TRANZILLA_URL = "https://tranzila.test";

    private MockRestServiceServer server;
    private CardcomGateway cardcom;
    private TranzillaGateway tranzilla;
    private ChargeRequest charge;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        GatewayProperties properties = new GatewayProperties();
        properties.getCardcom().setBaseUrl(CARDCOM_URL);
        properties.getCardcom().setTerminalNumber("1000");
        properties.getCardcom().setApiName("settlement");
        properties.getCardcom().setApiPassword("secret");
        properties.getTranzilla().setBaseUrl(TRANZILLA_URL);
        properties.getTranzilla().setSupplier("flagship");
        properties.getTranzilla().setTerminalPassword("pw");

        SettlementMetrics metrics = new SettlementMetrics(new SimpleMeterRegistry());
        cardcom = new CardcomGateway(restTemplate, properties, new ObjectMapper(), metrics);
        tranzilla = new TranzillaGateway(restTemplate, properties, metrics);

        charge = ChargeRequest.builder()
            .paymentId(UUID.randomUUID())
            .invoiceId(UUID.randomUUID())
            .professionalId("pro-7")
            .amount(new BigDecimal("117.00"))
            .currency("ILS")
            .paymentMethod("tok_4580")
            .description("Invoice-INV-202402-0000AAAA")
            .build();
    }

    @Test
    @DisplayName("Cardcom ResponseCode 0 is an approval carrying the TranzactionId")
    void testCardcomApproved() {
        server.expect(requestTo(CARDCOM_URL + "/api/v11/Transactions/Transaction"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().string(containsString("\"TerminalNumber\":\"1000\"")))
            .andExpect(content().string(containsString("\"Token\":\"tok_4580\"")))
            .andRespond(withSuccess("{\"ResponseCode\":0,\"TranzactionId\":98765}", MediaType.APPLICATION_JSON));

        GatewayResult result = cardcom.charge(charge);

        assertTrue(result.isSucceeded());
        assertEquals("98765", result.getTransactionId());
        server.verify();
    }

    @Test
    @DisplayName("Any other Cardcom ResponseCode is a decline with the provider's description")
    void testCardcomDeclined() {
        server.expect(requestTo(CARDCOM_URL + "/api/v11/Transactions/Transaction"))
            .andRespond(withSuccess("{\"ResponseCode\":5033,\"Description\":\"Card blocked\"}",
                MediaType.APPLICATION_JSON));

        GatewayResult result = cardcom.charge(charge);

        assertEquals(GatewayResult.Outcome.DECLINED, result.getOutcome());
        assertEquals("cardcom_5033: Card blocked", result.failureReason());
    }

    @Test
    @DisplayName("Cardcom refund goes through RefundByTransactionId")
    void testCardcomRefund() {
        server.expect(requestTo(CARDCOM_URL + "/api/v11/Transactions/RefundByTransactionId"))
            .andExpect(content().string(containsString("\"TransactionId\":\"98765\"")))
            .andRespond(withSuccess("{\"ResponseCode\":0,\"TranzactionId\":98766}", MediaType.APPLICATION_JSON));

        GatewayResult result = cardcom.refund(RefundRequest.builder()
            .paymentId(UUID.randomUUID())
            .transactionId("98765")
            .amount(new BigDecimal("17.00"))
            .currency("ILS")
            .reason("partial")
            .build());

        assertTrue(result.isSucceeded());
        assertEquals("98766", result.getTransactionId());
    }

    @Test
    @DisplayName("Cardcom webhooks are normalised; a payload without id is rejected")
    void testCardcomWebhook() {
        WebhookNotification approved = cardcom.parseWebhook("{\"ResponseCode\":0,\"TranzactionId\":\"555\"}", Map.of());
        WebhookNotification failed = cardcom.parseWebhook(
            "{\"ResponseCode\":33,\"TranzactionId\":\"556\",\"Description\":\"Expired\"}", Map.of());

        assertEquals(WebhookNotification.Status.SUCCEEDED, approved.getStatus());
        assertEquals("cardcom:555", approved.eventKey());
        assertEquals(WebhookNotification.Status.FAILED, failed.getStatus());
        assertEquals("Expired", failed.getError());
        assertThrows(ValidationException.class, () -> cardcom.parseWebhook("{\"ResponseCode\":0}", Map.of()));
        assertThrows(ValidationException.class, () -> cardcom.parseWebhook("not json", Map.of()));
    }

    @Test
    @DisplayName("Tranzila Response=000 approves and index is the transaction id")
    void testTranzillaApproved() {
        server.expect(requestTo(TRANZILLA_URL + "/cgi-bin/tranzila71u.cgi"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().string(containsString("supplier=flagship")))
            .andExpect(content().string(containsString("sum=117.00")))
            .andRespond(withSuccess("Response=000&index=4411", MediaType.TEXT_PLAIN));

        GatewayResult result = tranzilla.charge(charge);

        assertTrue(result.isSucceeded());
        assertEquals("4411", result.getTransactionId());
        server.verify();
    }

    @Test
    @DisplayName("Tranzila declines keep the response code; 5xx is a retryable gateway error")
    void testTranzillaDeclineAndOutage() {
        server.expect(requestTo(TRANZILLA_URL + "/cgi-bin/tranzila71u.cgi"))
            .andRespond(withSuccess("Response=004&index=4412&error_msg=refused", MediaType.TEXT_PLAIN));
        server.expect(requestTo(TRANZILLA_URL + "/cgi-bin/tranzila71u.cgi"))
            .andRespond(withServerError());

        GatewayResult declined = tranzilla.charge(charge);
        GatewayException outage = assertThrows(GatewayException.class, () -> tranzilla.charge(charge));

        assertEquals("tranzila_004: refused", declined.failureReason());
        assertTrue(outage.isRetryable());
    }

    @Test
    @DisplayName("Tranzila notifications are form-encoded")
    void testTranzillaWebhook() {
        WebhookNotification notification = tranzilla.parseWebhook("Response=000&index=4411&sum=117.00", Map.of());

        assertEquals(WebhookNotification.Status.SUCCEEDED, notification.getStatus());
        assertEquals("4411", notification.getExternalId());
        assertEquals("Response 051", tranzilla.parseWebhook("Response=051&index=9", Map.of()).getError());
        assertThrows(ValidationException.class, () -> tranzilla.parseWebhook("Response=000", Map.of()));
    }
}
