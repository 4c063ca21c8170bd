package com.flagship.coop_ledger.daybook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.daybook.EodSummary;
import com.flagship.coop_ledger.ledger.JournalEntry;
import com.flagship.coop_ledger.settlement.dto.SettlementResponse;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Value
public class EodSummaryResponse {

    @JsonProperty("day")
    DayBookResponse day;

    @JsonProperty("settlement_count")
    int settlementCount;

    @JsonProperty("total_physical_cash")
    BigDecimal totalPhysicalCash;

    @JsonProperty("total_system_cash")
    BigDecimal totalSystemCash;

    @JsonProperty("total_difference")
    BigDecimal totalDifference;

    @JsonProperty("settlements")
    List<SettlementResponse> settlements;

    @JsonProperty("journal_entries")
    List<Entry> journalEntries;

    public static EodSummaryResponse from(EodSummary summary) {
        return new EodSummaryResponse(
            DayBookResponse.from(summary.getDay()),
            summary.getSettlementCount(),
            summary.getTotalPhysicalCash(),
            summary.getTotalSystemCash(),
            summary.getTotalDifference(),
            summary.getSettlements().stream().map(SettlementResponse::from).toList(),
            summary.getJournalEntries().stream().map(Entry::from).toList()
        );
    }

    @Value
    public static class Entry {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("entry_number")
        String entryNumber;

        @JsonProperty("description")
        String description;

        @JsonProperty("effective_date")
        LocalDateTime effectiveDate;

        static Entry from(JournalEntry entry) {
            return new Entry(entry.getId(), entry.getEntryNumber(), entry.getDescription(), entry.getEffectiveDate());
        }
    }
}
