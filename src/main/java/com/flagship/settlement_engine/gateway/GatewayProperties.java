package com.flagship.settlement_engine.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Payment provider endpoints and credentials bound from {@code gateway.*}.
 */
@ConfigurationProperties(prefix = "gateway")
@Getter
@Setter
public class GatewayProperties {

    private int timeoutSeconds = 30;
    private int connectTimeoutSeconds = 5;
    private GatewayProvider defaultProvider = GatewayProvider.STRIPE;
    private String currency = "ILS";
    private Stripe stripe = new Stripe();
    private Cardcom cardcom = new Cardcom();
    private Tranzilla tranzilla = new Tranzilla();

    @Getter
    @Setter
    public static class Stripe {
        private String secretKey = "sk_test_unset";
        /** Webhook signatures are only checked when this is set. */
        private String webhookSecret;
    }

    @Getter
    @Setter
    public static class Cardcom {
        private String baseUrl = "https://secure.cardcom.solutions";
        private String terminalNumber;
        private String apiName;
        private String apiPassword;
    }

    @Getter
    @Setter
    public static class Tranzilla {
        private String baseUrl = "https://secure5.tranzila.com";
        private String supplier;
        private String terminalPassword;
    }
}
