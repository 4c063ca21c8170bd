package com.flagship.coop_ledger.daybook;

import com.flagship.coop_ledger.ledger.JournalEntry;
import com.flagship.coop_ledger.settlement.TellerSettlement;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * End-of-day figures of one business day. Totals count only settlements that were not reverted.
 */
@Value
public class EodSummary {
    DayBook day;
    int settlementCount;
    BigDecimal totalPhysicalCash;
    BigDecimal totalSystemCash;
    BigDecimal totalDifference;
    List<TellerSettlement> settlements;
    List<JournalEntry> journalEntries;
}
