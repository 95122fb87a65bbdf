package com.flagship.settlement_engine.gateway;

import lombok.Value;

import java.util.Locale;

/**
 * A provider callback reduced to the transaction it concerns and its new status.
 */
@Value
public class WebhookNotification {

    public enum Status {
        SUCCEEDED,
        FAILED,
        PENDING
    }

    GatewayProvider provider;
    String externalId;
    Status status;
    String error;

    public boolean isFinal() {
        return status != Status.PENDING;
    }

    public String eventKey() {
        return provider.name().toLowerCase(Locale.ROOT) + ":" + externalId;
    }
}
