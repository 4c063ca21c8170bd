package com.flagship.coop_ledger.common.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for every business rule the ledger refuses to break.
 *
 * Carries a stable {@link ErrorCode} so the REST layer and callers can branch on
 * the reason without parsing messages. Thrown inside a transactional service
 * method, it rolls back everything that method wrote.
 */
public class CoopLedgerException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public CoopLedgerException(ErrorCode code, String message) {
        this(code, message, Map.of());
    }

    public CoopLedgerException(ErrorCode code, String message, Map<String, ?> details) {
        super(message);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
