package com.flagship.settlement_engine.gateway;

import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.GatewayTimeoutException;

import java.util.Map;

/**
 * One payment provider.
 *
 * Implementations return declines as {@link GatewayResult}s and throw
 * {@link GatewayTimeoutException} or {@link GatewayException} only when the
 * provider could not give an answer.
 */
public interface PaymentGateway {

    GatewayProvider provider();

    GatewayResult charge(ChargeRequest request);

    GatewayResult refund(RefundRequest request);

    /**
     * Normalizes a webhook body.
     *
     * @param headers request headers, keys lower-cased
     */
    WebhookNotification parseWebhook(String payload, Map<String, String> headers);
}
