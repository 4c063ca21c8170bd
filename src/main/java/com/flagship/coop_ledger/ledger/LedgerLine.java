package com.flagship.coop_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One account-level effect of a journal entry.
 *
 * {@code balance} is the account's running balance right after this line was
 * applied; the source of truth is the account's balance accumulator.
 */
@Value
public class LedgerLine {
    UUID id;
    UUID journalEntryId;
    UUID accountId;
    int lineNumber;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal balance;
    Long sequenceNumber;
}
