package com.flagship.settlement_engine.gateway;

import com.flagship.settlement_engine.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Looks up the adapter for a provider. Adapters are matched on every call
 * rather than indexed at startup.
 */
@Component
public class PaymentGatewayRegistry {

    private final List<PaymentGateway> adapters;
    private final GatewayProperties properties;

    public PaymentGatewayRegistry(List<PaymentGateway> adapters, GatewayProperties properties) {
        this.adapters = List.copyOf(adapters);
        this.properties = properties;
    }

    /**
     * @param provider null selects the configured default provider
     */
    public PaymentGateway get(GatewayProvider provider) {
        GatewayProvider wanted = provider != null ? provider : properties.getDefaultProvider();
        return adapters.stream()
            .filter(adapter -> adapter.provider() == wanted)
            .findFirst()
            .orElseThrow(() -> new ValidationException("No gateway adapter for provider " + wanted));
    }

    public GatewayProvider defaultProvider() {
        return properties.getDefaultProvider();
    }

    public String currency() {
        return properties.getCurrency();
    }
}
