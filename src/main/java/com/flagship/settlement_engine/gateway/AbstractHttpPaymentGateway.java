package com.flagship.settlement_engine.gateway;

import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.GatewayTimeoutException;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shared HTTP error mapping for provider adapters:
 * - read timeout → {@link GatewayTimeoutException}
 * - connection failure or 5xx → retryable {@link GatewayException}
 * - 4xx → a declined result built by the adapter from the error body
 */
@Slf4j
public abstract class AbstractHttpPaymentGateway implements PaymentGateway {

    protected final RestTemplate restTemplate;
    private final SettlementMetrics metrics;

    protected AbstractHttpPaymentGateway(RestTemplate restTemplate, SettlementMetrics metrics) {
        this.restTemplate = restTemplate;
        this.metrics = metrics;
    }

    protected GatewayResult call(String operation, Supplier<GatewayResult> exchange,
                                 Function<HttpClientErrorException, GatewayResult> onClientError) {
        String provider = provider().name();
        return metrics.timeGatewayCall(provider, operation, () -> {
            try {
                GatewayResult result = exchange.get();
                log.debug("{} {} returned {} (tx={})", provider, operation, result.getOutcome(),
                    result.getTransactionId());
                return result;
            } catch (HttpClientErrorException e) {
                log.warn("{} {} rejected with HTTP {}", provider, operation, e.getStatusCode().value());
                return onClientError.apply(e);
            } catch (HttpServerErrorException e) {
                throw new GatewayException(String.format("%s %s failed with HTTP %d",
                    provider, operation, e.getStatusCode().value()), true, e);
            } catch (ResourceAccessException e) {
                if (e.getCause() instanceof SocketTimeoutException) {
                    throw new GatewayTimeoutException(provider, e);
                }
                throw new GatewayException(provider + " unreachable: " + e.getMessage(), true, e);
            } catch (RestClientException e) {
                throw new GatewayException(provider + " " + operation + " failed: " + e.getMessage(), false, e);
            }
        });
    }

    /**
     * Amount in the currency's minor unit (agorot, cents).
     */
    protected static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    protected static String lowerCase(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
