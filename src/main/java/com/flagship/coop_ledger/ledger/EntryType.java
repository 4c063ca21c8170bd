package com.flagship.coop_ledger.ledger;

/**
 * The two sides of a double-entry posting. Also used as an account's normal side:
 * the side on which its balance grows.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
