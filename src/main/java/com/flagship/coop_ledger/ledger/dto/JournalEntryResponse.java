package com.flagship.coop_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.ledger.JournalEntry;
import com.flagship.coop_ledger.ledger.LedgerLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Value
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("description")
    String description;

    @JsonProperty("effective_date")
    LocalDateTime effectiveDate;

    @JsonProperty("lines")
    List<Line> lines;

    public static JournalEntryResponse from(JournalEntry entry, List<LedgerLine> lines) {
        return new JournalEntryResponse(entry.getId(), entry.getEntryNumber(), entry.getDescription(),
            entry.getEffectiveDate(), lines.stream().map(Line::from).toList());
    }

    @Value
    public static class Line {
        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("sequence_number")
        long sequenceNumber;

        static Line from(LedgerLine line) {
            return new Line(line.getLineNumber(), line.getAccountId(), line.getDebit(), line.getCredit(),
                line.getBalance(), line.getSequenceNumber());
        }
    }
}
