package com.flagship.coop_ledger.daybook.event;

import com.flagship.coop_ledger.daybook.DayBook;
import com.flagship.coop_ledger.daybook.DayBookStatus;
import com.flagship.coop_ledger.outbox.DomainEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a day begins, closes (normally or forced) or reopens.
 * {@code fromStatus} is null for a newly created day.
 */
@Value
public class DayBookTransitionedEvent implements DomainEvent {
    UUID eventId;
    String tenantId;
    UUID dayBookId;
    LocalDate businessDate;
    DayBookStatus fromStatus;
    DayBookStatus toStatus;
    long version;
    BigDecimal openingCash;
    BigDecimal closingCash;
    String actorId;
    boolean forced;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DayBookTransitioned";
    public static final String AGGREGATE_TYPE = "DayBook";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return dayBookId;
    }

    public static DayBookTransitionedEvent of(DayBook day, DayBookStatus fromStatus, String actorId,
                                              boolean forced, String reason) {
        return new DayBookTransitionedEvent(
            UUID.randomUUID(),
            day.getTenantId(),
            day.getId(),
            day.getDate(),
            fromStatus,
            day.getStatus(),
            day.getVersion(),
            day.getOpeningCash(),
            day.getClosingCash(),
            actorId,
            forced,
            reason,
            Instant.now()
        );
    }
}
