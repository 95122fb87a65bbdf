package com.flagship.settlement_engine.gateway;

import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Tranzila CGI adapter. Requests and responses are form-encoded; Response=000 is an approval
 * and {@code index} identifies the transaction.
 */
@Component
public class TranzillaGateway extends AbstractHttpPaymentGateway {

    private static final String APPROVED = "000";
    private static final String ILS_CURRENCY = "1";
    private static final String ENDPOINT = "/cgi-bin/tranzila71u.cgi";

    private final GatewayProperties.Tranzilla config;

    public TranzillaGateway(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                            GatewayProperties properties,
                            SettlementMetrics metrics) {
        super(restTemplate, metrics);
        this.config = properties.getTranzilla();
    }

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.TRANZILLA;
    }

    @Override
    public GatewayResult charge(ChargeRequest request) {
        MultiValueMap<String, String> form = credentials();
        form.add("sum", request.getAmount().toPlainString());
        form.add("currency", ILS_CURRENCY);
        form.add("TranzilaTK", request.getPaymentMethod());
        form.add("myid", request.getProfessionalId());
        form.add("pdesc", request.getDescription());
        return call("charge", () -> post(form),
            e -> GatewayResult.declined(null, "http_" + e.getStatusCode().value(), e.getStatusText()));
    }

    @Override
    public GatewayResult refund(RefundRequest request) {
        MultiValueMap<String, String> form = credentials();
        form.add("sum", request.getAmount().toPlainString());
        form.add("currency", ILS_CURRENCY);
        form.add("tranmode", "C" + request.getTransactionId());
        return call("refund", () -> post(form),
            e -> GatewayResult.declined(null, "http_" + e.getStatusCode().value(), e.getStatusText()));
    }

    @Override
    public WebhookNotification parseWebhook(String payload, Map<String, String> headers) {
        MultiValueMap<String, String> fields = parseForm(payload);
        String index = fields.getFirst("index");
        if (index == null || index.isBlank()) {
            throw new ValidationException("Tranzila notification has no index");
        }
        String response = fields.getFirst("Response");
        return APPROVED.equals(response)
            ? new WebhookNotification(GatewayProvider.TRANZILLA, index, WebhookNotification.Status.SUCCEEDED, null)
            : new WebhookNotification(GatewayProvider.TRANZILLA, index, WebhookNotification.Status.FAILED,
                "Response " + response);
    }

    private GatewayResult post(MultiValueMap<String, String> form) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        String body = restTemplate.postForObject(config.getBaseUrl() + ENDPOINT,
            new HttpEntity<>(form, headers), String.class);
        MultiValueMap<String, String> fields = parseForm(body);
        String response = fields.getFirst("Response");
        String index = fields.getFirst("index");
        if (APPROVED.equals(response)) {
            return GatewayResult.succeeded(index);
        }
        return GatewayResult.declined(index, "tranzila_" + response, fields.getFirst("error_msg"));
    }

    private MultiValueMap<String, String> credentials() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("supplier", config.getSupplier());
        form.add("TranzilaPW", config.getTerminalPassword());
        return form;
    }

    static MultiValueMap<String, String> parseForm(String body) {
        if (body == null || body.isBlank()) {
            return new LinkedMultiValueMap<>();
        }
        return UriComponentsBuilder.newInstance().query(body.trim()).build(true).getQueryParams();
    }
}
