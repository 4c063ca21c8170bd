package com.flagship.coop_ledger.common.error;

import java.util.Map;

/**
 * Another writer changed the record between our read and our conditional write.
 * Callers may re-read and retry.
 */
public class ConcurrencyConflictException extends CoopLedgerException {

    public ConcurrencyConflictException(ErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
        if (code.getCategory() != ErrorCategory.CONTENTION) {
            throw new IllegalArgumentException("Not a contention code: " + code);
        }
    }
}
