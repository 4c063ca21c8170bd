package com.flagship.coop_ledger.daybook;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read model of one tenant's business day.
 */
@Value
public class DayBook {
    UUID id;
    String tenantId;
    LocalDate date;
    DayBookStatus status;
    BigDecimal openingCash;
    BigDecimal closingCash;
    int transactionsCount;
    String dayBeginBy;
    String dayEndBy;
    String forceCloseReason;
    String reopenReason;
    long version;
    Instant createdAt;
    Instant updatedAt;
    Instant closedAt;

    public boolean isOpen() {
        return status == DayBookStatus.OPEN;
    }
}
