package com.flagship.coop_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id arrives in {@code X-Correlation-ID} (or is generated),
 * is stamped on every log line through MDC and is stored with each audit record.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String TENANT_ID_HEADER = "X-Tenant-Id";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String DAY_BOOK_ID_MDC_KEY = "dayBookId";
    public static final String SETTLEMENT_ID_MDC_KEY = "settlementId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Current correlation id, generating one for work that did not start from a request.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
