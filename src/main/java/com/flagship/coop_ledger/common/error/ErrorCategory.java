package com.flagship.coop_ledger.common.error;

/**
 * Broad classes of failure a caller can react to.
 *
 * PRECONDITION failures mean the request does not fit the current state and
 * will fail the same way until something else changes. CONTENTION failures
 * mean another writer got there first, so re-reading and retrying may succeed.
 */
public enum ErrorCategory {
    PRECONDITION,
    INVARIANT,
    CONTENTION,
    NOT_FOUND
}
