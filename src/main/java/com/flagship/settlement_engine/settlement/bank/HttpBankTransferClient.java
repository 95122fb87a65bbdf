package com.flagship.settlement_engine.settlement.bank;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.settlement.BankDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bank transfer API over HTTP.
 *
 * POST {base-url}/transfers with an X-Api-Key header. A 2xx answer carries
 * {"status": "ACCEPTED" | "REJECTED", "reference", "message"}; a 4xx is a rejection.
 * The payout id is sent as the idempotency key so a retried request cannot pay twice.
 */
@Component
@Slf4j
public class HttpBankTransferClient implements BankTransferClient {

    private static final String ACCEPTED = "ACCEPTED";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public HttpBankTransferClient(@Qualifier("bankTransferRestTemplate") RestTemplate restTemplate,
                                  @Value("${bank-transfer.base-url}") String baseUrl,
                                  @Value("${bank-transfer.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public BankTransferResult transfer(BankTransferRequest request) {
        BankDetails bank = request.getBankDetails();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payout_id", request.getPayoutId().toString());
        body.put("amount", request.getAmount());
        body.put("currency", request.getCurrency());
        body.put("bank_name", bank.getBankName());
        body.put("branch_number", bank.getBranchNumber());
        body.put("account_number", bank.getAccountNumber());
        body.put("account_holder_name", bank.getAccountHolderName());
        body.put("swift_code", bank.getSwiftCode());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Api-Key", apiKey);
        headers.set("Idempotency-Key", request.getPayoutId().toString());

        log.info("Sending transfer of {} for payout {} to account {}",
            request.getAmount(), request.getPayoutId(), bank.maskedAccount());
        try {
            JsonNode response = restTemplate.postForObject(baseUrl + "/transfers",
                new HttpEntity<>(body, headers), JsonNode.class);
            if (response == null) {
                throw new GatewayException("Bank returned no body for payout " + request.getPayoutId(), true);
            }
            if (ACCEPTED.equalsIgnoreCase(response.path("status").asText())) {
                return BankTransferResult.accepted(response.path("reference").asText(null));
            }
            return BankTransferResult.rejected(response.path("message").asText("rejected by bank"));
        } catch (HttpClientErrorException e) {
            log.warn("Bank rejected payout {} with HTTP {}", request.getPayoutId(), e.getStatusCode().value());
            return BankTransferResult.rejected("HTTP " + e.getStatusCode().value() + ": "
                + e.getResponseBodyAsString());
        } catch (RestClientException e) {
            throw new GatewayException("Bank transfer failed for payout " + request.getPayoutId()
                + ": " + e.getMessage(), true, e);
        }
    }
}
