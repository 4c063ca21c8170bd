package com.flagship.coop_ledger.daybook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.daybook.DayBook;
import lombok.Value;

import java.time.LocalDate;

/**
 * {@code state} is the day's status, or NO_DAY_OPEN for a tenant that never began a day.
 */
@Value
public class DayStatusResponse {

    public static final String NO_DAY_OPEN = "NO_DAY_OPEN";

    @JsonProperty("state")
    String state;

    @JsonProperty("today")
    LocalDate today;

    @JsonProperty("day")
    DayBookResponse day;

    public static DayStatusResponse of(DayBook day, LocalDate today) {
        return new DayStatusResponse(day.getStatus().name(), today, DayBookResponse.from(day));
    }

    public static DayStatusResponse noDay(LocalDate today) {
        return new DayStatusResponse(NO_DAY_OPEN, today, null);
    }
}
