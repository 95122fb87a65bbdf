package com.flagship.settlement_engine.gateway;

import com.stripe.StripeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
@Slf4j
public class GatewayClientConfig {

    /**
     * Shared HTTP client for the payment providers. The read timeout is the gateway
     * call timeout; exceeding it fails the payment.
     */
    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        log.info("Gateway client configured with connect timeout {}s, read timeout {}s",
            properties.getConnectTimeoutSeconds(), properties.getTimeoutSeconds());
        return builder
            .setConnectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .setReadTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
            .build();
    }

    /**
     * Stripe SDK client. Network retries stay off: a failed charge is retried by the
     * autopay batch, never inside the request.
     */
    @Bean
    public StripeClient stripeClient(GatewayProperties properties) {
        return StripeClient.builder()
            .setApiKey(properties.getStripe().getSecretKey())
            .setConnectTimeout(properties.getConnectTimeoutSeconds() * 1000)
            .setReadTimeout(properties.getTimeoutSeconds() * 1000)
            .setMaxNetworkRetries(0)
            .build();
    }
}
