package com.flagship.coop_ledger.daybook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class DayBookStatusTest {

    @Test
    @DisplayName("OPEN and EOD_IN_PROGRESS count as the tenant's active day")
    void activeStatuses() {
        assertTrue(DayBookStatus.OPEN.isActive());
        assertTrue(DayBookStatus.EOD_IN_PROGRESS.isActive());
        assertFalse(DayBookStatus.CLOSED.isActive());
    }

    @Test
    @DisplayName("Active-day lookups search exactly the active statuses")
    void activeLookupStatuses() {
        assertEquals(EnumSet.of(DayBookStatus.OPEN, DayBookStatus.EOD_IN_PROGRESS), DayBookService.ACTIVE_STATUSES);
    }
}
