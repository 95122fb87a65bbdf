package com.flagship.settlement_engine.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.GatewayTimeoutException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.google.gson.JsonSyntaxException;
import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.ApiException;
import com.stripe.exception.AuthenticationException;
import com.stripe.exception.CardException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.model.StripeError;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.Map;

/**
 * Stripe PaymentIntents adapter over the official SDK.
 *
 * Charges confirm the intent immediately; "processing" and "requires_action"
 * intents are PENDING and settle through the payment_intent.* webhooks.
 * Webhook signatures are verified with {@link Webhook#constructEvent}, which
 * also rejects signatures older than the SDK's five-minute tolerance.
 */
@Component
@Slf4j
public class StripeGateway implements PaymentGateway {

    static final String SIGNATURE_HEADER = "stripe-signature";

    private final StripeClient stripeClient;
    private final GatewayProperties.Stripe config;
    private final ObjectMapper objectMapper;
    private final SettlementMetrics metrics;

    public StripeGateway(StripeClient stripeClient,
                         GatewayProperties properties,
                         ObjectMapper objectMapper,
                         SettlementMetrics metrics) {
        this.stripeClient = stripeClient;
        this.config = properties.getStripe();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.STRIPE;
    }

    @Override
    public GatewayResult charge(ChargeRequest request) {
        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
            .setAmount(AbstractHttpPaymentGateway.toMinorUnits(request.getAmount()))
            .setCurrency(AbstractHttpPaymentGateway.lowerCase(request.getCurrency()))
            .setPaymentMethod(request.getPaymentMethod())
            .setConfirm(true)
            .setDescription(request.getDescription())
            .putMetadata("invoice_id", request.getInvoiceId().toString())
            .putMetadata("payment_id", request.getPaymentId().toString())
            .build();
        RequestOptions options = RequestOptions.builder()
            .setIdempotencyKey(request.getPaymentId().toString())
            .build();

        return call("charge", () -> fromIntent(stripeClient.paymentIntents().create(params, options)));
    }

    @Override
    public GatewayResult refund(RefundRequest request) {
        RefundCreateParams params = RefundCreateParams.builder()
            .setPaymentIntent(request.getTransactionId())
            .setAmount(AbstractHttpPaymentGateway.toMinorUnits(request.getAmount()))
            .setReason(refundReason(request.getReason()))
            .putMetadata("payment_id", request.getPaymentId().toString())
            .build();

        return call("refund", () -> {
            Refund refund = stripeClient.refunds().create(params, RequestOptions.getDefault());
            if ("succeeded".equals(refund.getStatus())) {
                return GatewayResult.succeeded(refund.getId());
            }
            if ("pending".equals(refund.getStatus())) {
                return GatewayResult.pending(refund.getId());
            }
            return GatewayResult.declined(refund.getId(), "refund_" + refund.getStatus(), refund.getFailureReason());
        });
    }

    @Override
    public WebhookNotification parseWebhook(String payload, Map<String, String> headers) {
        String type;
        if (config.getWebhookSecret() != null && !config.getWebhookSecret().isBlank()) {
            type = verifiedEvent(payload, headers.get(SIGNATURE_HEADER)).getType();
        } else {
            type = text(readTree(payload), "type");
        }
        JsonNode object = readTree(payload).path("data").path("object");
        String intentId = text(object, "id");
        if (intentId == null) {
            throw new ValidationException("Stripe webhook has no data.object.id");
        }

        WebhookNotification.Status status;
        String error = null;
        if ("payment_intent.succeeded".equals(type)) {
            status = WebhookNotification.Status.SUCCEEDED;
        } else if ("payment_intent.payment_failed".equals(type) || "payment_intent.canceled".equals(type)) {
            status = WebhookNotification.Status.FAILED;
            error = text(object.path("last_payment_error"), "message");
            if (error == null) {
                error = type;
            }
        } else {
            status = WebhookNotification.Status.PENDING;
        }
        return new WebhookNotification(GatewayProvider.STRIPE, intentId, status, error);
    }

    private Event verifiedEvent(String payload, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new ValidationException("Missing Stripe-Signature header");
        }
        try {
            return Webhook.constructEvent(payload, signatureHeader, config.getWebhookSecret());
        } catch (SignatureVerificationException e) {
            log.warn("Rejected Stripe webhook: {}", e.getMessage());
            throw new ValidationException("Invalid Stripe webhook signature");
        } catch (JsonSyntaxException e) {
            throw new ValidationException("Unreadable Stripe payload: " + e.getMessage());
        }
    }

    private GatewayResult call(String operation, StripeCall exchange) {
        String provider = provider().name();
        return metrics.timeGatewayCall(provider, operation, () -> {
            try {
                GatewayResult result = exchange.execute();
                log.debug("{} {} returned {} (tx={})", provider, operation, result.getOutcome(),
                    result.getTransactionId());
                return result;
            } catch (CardException e) {
                log.warn("{} {} declined: {}", provider, operation, e.getCode());
                String code = e.getDeclineCode() != null ? e.getDeclineCode() : e.getCode();
                return GatewayResult.declined(intentId(e), code != null ? code : "card_error", errorMessage(e));
            } catch (RateLimitException e) {
                throw new GatewayException(provider + " " + operation + " rate limited", true, e);
            } catch (InvalidRequestException e) {
                log.warn("{} {} rejected with HTTP {}", provider, operation, e.getStatusCode());
                return GatewayResult.declined(intentId(e),
                    e.getCode() != null ? e.getCode() : "http_" + e.getStatusCode(), errorMessage(e));
            } catch (ApiConnectionException e) {
                if (e.getCause() instanceof SocketTimeoutException) {
                    throw new GatewayTimeoutException(provider, e);
                }
                throw new GatewayException(provider + " unreachable: " + e.getMessage(), true, e);
            } catch (AuthenticationException e) {
                throw new GatewayException(provider + " rejected the API key", false, e);
            } catch (ApiException e) {
                boolean serverSide = e.getStatusCode() == null || e.getStatusCode() >= 500;
                throw new GatewayException(String.format("%s %s failed with HTTP %s",
                    provider, operation, e.getStatusCode()), serverSide, e);
            } catch (StripeException e) {
                throw new GatewayException(provider + " " + operation + " failed: " + e.getMessage(), false, e);
            }
        });
    }

    private static GatewayResult fromIntent(PaymentIntent intent) {
        String status = intent.getStatus();
        if ("succeeded".equals(status)) {
            return GatewayResult.succeeded(intent.getId());
        }
        if ("processing".equals(status) || "requires_action".equals(status)) {
            return GatewayResult.pending(intent.getId());
        }
        StripeError error = intent.getLastPaymentError();
        if (error == null) {
            return GatewayResult.declined(intent.getId(), status, null);
        }
        return GatewayResult.declined(intent.getId(),
            error.getCode() != null ? error.getCode() : status,
            error.getMessage());
    }

    private static RefundCreateParams.Reason refundReason(String reason) {
        if (reason == null) {
            return RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER;
        }
        return switch (reason.toLowerCase(Locale.ROOT)) {
            case "duplicate" -> RefundCreateParams.Reason.DUPLICATE;
            case "fraudulent" -> RefundCreateParams.Reason.FRAUDULENT;
            default -> RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER;
        };
    }

    private static String intentId(StripeException e) {
        StripeError error = e.getStripeError();
        return error != null && error.getPaymentIntent() != null ? error.getPaymentIntent().getId() : null;
    }

    private static String errorMessage(StripeException e) {
        StripeError error = e.getStripeError();
        return error != null && error.getMessage() != null ? error.getMessage() : e.getMessage();
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Unreadable Stripe payload: " + e.getOriginalMessage());
        }
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    @FunctionalInterface
    private interface StripeCall {
        GatewayResult execute() throws StripeException;
    }
}
