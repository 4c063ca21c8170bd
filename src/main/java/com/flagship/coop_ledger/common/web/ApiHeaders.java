package com.flagship.coop_ledger.common.web;

import com.flagship.coop_ledger.observability.CorrelationContext;

/**
 * Request headers every tenant-scoped endpoint reads.
 */
public final class ApiHeaders {

    public static final String TENANT_ID = CorrelationContext.TENANT_ID_HEADER;
    public static final String USER_ID = "X-User-Id";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ApiHeaders() {
    }
}
