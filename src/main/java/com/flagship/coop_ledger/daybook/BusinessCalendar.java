package com.flagship.coop_ledger.daybook;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * "Today" and posting timestamps in the business zone.
 */
@Component
@RequiredArgsConstructor
public class BusinessCalendar {

    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Effective date for a posting made during a business day: the day's date at
     * the current wall-clock time, so late postings still count toward that day.
     */
    public LocalDateTime postingTimestamp(LocalDate businessDate) {
        return businessDate.atTime(LocalTime.now(clock));
    }
}
