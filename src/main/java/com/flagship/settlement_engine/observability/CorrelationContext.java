package com.flagship.settlement_engine.observability;

import org.slf4j.MDC;

import java.util.List;
import java.util.UUID;

/**
 * MDC keys shared by the engine and the correlation id that ties a request,
 * a Kafka delivery or a settlement run to its log lines.
 *
 * Settlement workers inherit the caller's MDC, so the id also appears on lines
 * written from the worker pool.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PROFESSIONAL_ID_MDC_KEY = "professionalId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";
    public static final String JOB_ID_MDC_KEY = "jobId";

    private static final List<String> ENGINE_KEYS = List.of(
        CORRELATION_ID_MDC_KEY, PROFESSIONAL_ID_MDC_KEY, INVOICE_ID_MDC_KEY, PAYMENT_ID_MDC_KEY, JOB_ID_MDC_KEY);

    private CorrelationContext() {
    }

    /**
     * Binds the given id, or a fresh one when it is blank, to the current thread.
     *
     * @return the id now in the MDC
     */
    public static String begin(String incomingId) {
        String id = incomingId == null || incomingId.isBlank() ? newCorrelationId() : incomingId;
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Removes every engine key; other MDC entries are left alone.
     */
    public static void end() {
        ENGINE_KEYS.forEach(MDC::remove);
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
