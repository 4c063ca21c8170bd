package com.flagship.coop_ledger.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact written to the outbox in the transaction that caused it.
 */
public interface DomainEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * Tenant the fact belongs to; also the Kafka key, so one tenant's events stay ordered.
     */
    String getTenantId();

    /**
     * Type of the aggregate this event is about, e.g. "DayBook". Selects the topic.
     */
    String getAggregateType();

    UUID getAggregateId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
