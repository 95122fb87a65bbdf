package com.flagship.settlement_engine.settlement.bank;

import com.flagship.settlement_engine.gateway.GatewayProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class BankTransferClientConfig {

    /**
     * Same timeouts as the payment providers; kept separate so the gateway client can be swapped alone.
     */
    @Bean
    public RestTemplate bankTransferRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .setReadTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
            .build();
    }
}
