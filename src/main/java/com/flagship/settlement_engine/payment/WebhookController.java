package com.flagship.settlement_engine.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Provider callbacks. The raw body is passed through untouched because Stripe
 * signs the exact bytes it sent.
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final PaymentProcessingService paymentService;

    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, Boolean>> receive(
            @PathVariable("provider") String provider,
            @RequestBody String payload,
            @RequestHeader Map<String, String> headers) {
        log.debug("Webhook from {} ({} bytes)", provider, payload.length());
        boolean processed = paymentService.processWebhook(provider, payload, headers);
        return ResponseEntity.ok(Map.of("processed", processed));
    }
}
