package com.flagship.coop_ledger.daybook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.daybook.DayBook;
import com.flagship.coop_ledger.daybook.DayBookStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class DayBookResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("status")
    DayBookStatus status;

    @JsonProperty("opening_cash")
    BigDecimal openingCash;

    @JsonProperty("closing_cash")
    BigDecimal closingCash;

    @JsonProperty("transactions_count")
    int transactionsCount;

    @JsonProperty("day_begin_by")
    String dayBeginBy;

    @JsonProperty("day_end_by")
    String dayEndBy;

    @JsonProperty("force_close_reason")
    String forceCloseReason;

    @JsonProperty("reopen_reason")
    String reopenReason;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("closed_at")
    Instant closedAt;

    public static DayBookResponse from(DayBook day) {
        return DayBookResponse.builder()
            .id(day.getId())
            .date(day.getDate())
            .status(day.getStatus())
            .openingCash(day.getOpeningCash())
            .closingCash(day.getClosingCash())
            .transactionsCount(day.getTransactionsCount())
            .dayBeginBy(day.getDayBeginBy())
            .dayEndBy(day.getDayEndBy())
            .forceCloseReason(day.getForceCloseReason())
            .reopenReason(day.getReopenReason())
            .version(day.getVersion())
            .createdAt(day.getCreatedAt())
            .closedAt(day.getClosedAt())
            .build();
    }
}
