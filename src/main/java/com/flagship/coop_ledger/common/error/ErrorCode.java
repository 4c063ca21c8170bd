package com.flagship.coop_ledger.common.error;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable reason codes returned to API clients.
 */
public enum ErrorCode {

    // Ledger
    DOUBLE_ENTRY_MISMATCH(ErrorCategory.INVARIANT, HttpStatus.UNPROCESSABLE_ENTITY),
    ACCOUNT_NOT_POSTABLE(ErrorCategory.PRECONDITION, HttpStatus.UNPROCESSABLE_ENTITY),
    ACCOUNT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND),
    JOURNAL_ENTRY_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND),
    INVALID_ACCOUNT_CODE(ErrorCategory.PRECONDITION, HttpStatus.BAD_REQUEST),
    DUPLICATE_ACCOUNT_CODE(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    ACCOUNT_ROLE_NOT_CONFIGURED(ErrorCategory.PRECONDITION, HttpStatus.UNPROCESSABLE_ENTITY),

    // Day book
    PREVIOUS_DAY_NOT_CLOSED(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    DAY_ALREADY_OPEN(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    CANNOT_START_PAST_DAY(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    NO_ACTIVE_DAY(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    TELLER_PENDING_SETTLEMENT(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    ALREADY_CLOSED(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    CONCURRENT_CLOSE_IN_PROGRESS(ErrorCategory.CONTENTION, HttpStatus.CONFLICT),
    DAY_MODIFIED(ErrorCategory.CONTENTION, HttpStatus.CONFLICT),
    NO_DAY_FOR_TODAY(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND),
    CANNOT_REOPEN_PAST_DAY(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    NOT_CLOSED(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),

    // Settlement
    TELLER_ACCOUNT_NOT_MAPPED(ErrorCategory.PRECONDITION, HttpStatus.UNPROCESSABLE_ENTITY),
    DENOMINATION_MISMATCH(ErrorCategory.PRECONDITION, HttpStatus.UNPROCESSABLE_ENTITY),
    SETTLEMENT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND),
    DAY_NOT_OPEN(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    ALREADY_APPROVED(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),
    ALREADY_REVERTED(ErrorCategory.PRECONDITION, HttpStatus.CONFLICT),

    INVALID_REQUEST(ErrorCategory.PRECONDITION, HttpStatus.BAD_REQUEST),
    INVALID_STATE(ErrorCategory.INVARIANT, HttpStatus.CONFLICT),
    INTERNAL_ERROR(ErrorCategory.INVARIANT, HttpStatus.INTERNAL_SERVER_ERROR);

    private final ErrorCategory category;
    private final HttpStatus httpStatus;

    ErrorCode(ErrorCategory category, HttpStatus httpStatus) {
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
