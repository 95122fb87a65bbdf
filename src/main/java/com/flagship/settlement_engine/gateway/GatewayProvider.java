package com.flagship.settlement_engine.gateway;

import com.flagship.settlement_engine.exception.ValidationException;

import java.util.Locale;

public enum GatewayProvider {
    STRIPE,
    CARDCOM,
    TRANZILLA;

    /**
     * Parses a provider name from a path segment or request field, case-insensitively.
     */
    public static GatewayProvider fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Gateway provider is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown gateway provider: " + value);
        }
    }
}
