package com.flagship.coop_ledger.ledger;

import lombok.Value;

import java.util.List;

@Value
public class PostingResult {
    JournalEntry journalEntry;
    List<LedgerLine> ledgerLines;
}
