package com.flagship.coop_ledger.settlement;

import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.JournalLine;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything a settlement would post, computed before anything is written.
 * A preview returns it as-is; a settlement posts {@link #getEntries()} in order.
 */
@Value
public class SettlementPlan {
    Account tellerAccount;
    SettlementFigures figures;
    List<PlannedEntry> entries;

    @Value
    public static class PlannedEntry {
        String description;
        List<PlannedLine> lines;

        public List<JournalLine> toJournalLines() {
            return lines.stream()
                .map(line -> JournalLine.of(line.getAccount().getId(), line.getDebit(), line.getCredit()))
                .toList();
        }
    }

    @Value
    public static class PlannedLine {
        Account account;
        BigDecimal debit;
        BigDecimal credit;
    }
}
