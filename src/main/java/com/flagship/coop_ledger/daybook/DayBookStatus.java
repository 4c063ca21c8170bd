package com.flagship.coop_ledger.daybook;

/**
 * Lifecycle of a business day.
 *
 * Valid transitions:
 * - OPEN → EOD_IN_PROGRESS (day end locks the day)
 * - EOD_IN_PROGRESS → CLOSED
 * - CLOSED → OPEN (reopen, today's date only)
 *
 * EOD_IN_PROGRESS is the close lock. A close that fails rolls back with it, so the
 * status is only ever observed by a concurrent close racing for the same row.
 */
public enum DayBookStatus {
    OPEN,
    EOD_IN_PROGRESS,
    CLOSED;

    /**
     * At most one day per tenant may be in an active status.
     */
    public boolean isActive() {
        return this != CLOSED;
    }
}
