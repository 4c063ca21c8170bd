package com.flagship.coop_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized domain event waiting in (or already drained from) the outbox table.
 */
@Value
public class OutboxEvent {
    UUID id;
    String tenantId;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Wraps an already-serialized event. The outbox row shares the event's id.
     */
    public static OutboxEvent pending(DomainEvent event, String payload) {
        return new OutboxEvent(
            event.getEventId(),
            event.getTenantId(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            payload,
            event.getOccurredAt(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
