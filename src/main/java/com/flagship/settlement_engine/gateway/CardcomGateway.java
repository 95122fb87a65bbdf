package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cardcom JSON API adapter. ResponseCode 0 means approved, anything else is a decline.
 */
@Component
public class CardcomGateway extends AbstractHttpPaymentGateway {

    private static final int APPROVED = 0;
    private static final int ILS_COIN_ID = 1;

    private final GatewayProperties.Cardcom config;
    private final ObjectMapper objectMapper;

    public CardcomGateway(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                          GatewayProperties properties,
                          ObjectMapper objectMapper,
                          SettlementMetrics metrics) {
        super(restTemplate, metrics);
        this.config = properties.getCardcom();
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.CARDCOM;
    }

    @Override
    public GatewayResult charge(ChargeRequest request) {
        Map<String, Object> body = credentials();
        body.put("Amount", request.getAmount());
        body.put("Token", request.getPaymentMethod());
        body.put("ISOCoinId", ILS_COIN_ID);
        body.put("ExternalUniqTranId", request.getPaymentId().toString());
        body.put("ProductName", request.getDescription());

        return call("charge",
            () -> fromResponse(restTemplate.postForObject(
                config.getBaseUrl() + "/api/v11/Transactions/Transaction", body, JsonNode.class)),
            e -> GatewayResult.declined(null, "http_" + e.getStatusCode().value(), e.getStatusText()));
    }

    @Override
    public GatewayResult refund(RefundRequest request) {
        Map<String, Object> body = credentials();
        body.put("TransactionId", request.getTransactionId());
        body.put("PartialSum", request.getAmount());

        return call("refund",
            () -> fromResponse(restTemplate.postForObject(
                config.getBaseUrl() + "/api/v11/Transactions/RefundByTransactionId", body, JsonNode.class)),
            e -> GatewayResult.declined(null, "http_" + e.getStatusCode().value(), e.getStatusText()));
    }

    /**
     * Cardcom posts the transaction result as JSON with the same fields as the API response.
     */
    @Override
    public WebhookNotification parseWebhook(String payload, Map<String, String> headers) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Unreadable Cardcom payload: " + e.getOriginalMessage());
        }
        JsonNode id = node.get("TranzactionId");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw new ValidationException("Cardcom webhook has no TranzactionId");
        }
        int code = node.path("ResponseCode").asInt(-1);
        return code == APPROVED
            ? new WebhookNotification(GatewayProvider.CARDCOM, id.asText(), WebhookNotification.Status.SUCCEEDED, null)
            : new WebhookNotification(GatewayProvider.CARDCOM, id.asText(), WebhookNotification.Status.FAILED,
                node.path("Description").asText("ResponseCode " + code));
    }

    private GatewayResult fromResponse(JsonNode response) {
        if (response == null) {
            return GatewayResult.declined(null, "empty_response", "Cardcom returned no body");
        }
        String transactionId = response.hasNonNull("TranzactionId") ? response.get("TranzactionId").asText() : null;
        int code = response.path("ResponseCode").asInt(-1);
        if (code == APPROVED) {
            return GatewayResult.succeeded(transactionId);
        }
        return GatewayResult.declined(transactionId, "cardcom_" + code, response.path("Description").asText(null));
    }

    private Map<String, Object> credentials() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("TerminalNumber", config.getTerminalNumber());
        body.put("ApiName", config.getApiName());
        body.put("ApiPassword", config.getApiPassword());
        return body;
    }
}
