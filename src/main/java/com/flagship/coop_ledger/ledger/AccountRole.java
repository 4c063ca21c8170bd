package com.flagship.coop_ledger.ledger;

/**
 * Accounts the day-control engine needs to find without knowing their codes.
 * Each tenant maps every role to exactly one account.
 */
public enum AccountRole {
    /** Central cash vault that teller settlements sweep into. */
    VAULT_CASH,
    /** Receivable booked against staff for teller shortages. */
    STAFF_RECEIVABLE,
    /** Income booked for teller overages. */
    SUNDRY_INCOME,
    /** Holding account for variances absorbed by a force close. */
    SUSPENSE
}
