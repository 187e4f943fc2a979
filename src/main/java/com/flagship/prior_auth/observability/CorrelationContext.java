package com.flagship.prior_auth.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - Gateway worker threads (via the MDC copy each attempt carries)
 * - Outgoing payer and pharmacy requests (as header)
 * - Kafka update events (in the payload)
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String AUTHORIZATION_ID_MDC_KEY = "authorizationId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID. Worker threads that only received the MDC
     * copy read it from there; otherwise a new one is generated.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = MDC.get(CORRELATION_ID_MDC_KEY);
        }
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /** Binds {@code id} to this thread, or a fresh id when it is blank. */
    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /** Unbinds the correlation id from this thread. */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /** Whether this thread or its MDC already carries a correlation id. */
    public static boolean hasCorrelationId() {
        return correlationId.get() != null || MDC.get(CORRELATION_ID_MDC_KEY) != null;
    }
}
