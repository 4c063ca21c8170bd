package com.flagship.coop_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes domain events to the outbox inside the business transaction.
 *
 * "If the business operation commits, the event is guaranteed to be written."
 * A rolled back settlement or day close leaves no event behind. Publishing to
 * Kafka happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the caller's transaction.
     *
     * MANDATORY propagation: an event written outside a business transaction
     * would describe a change that might never commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(DomainEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.pending(event, serializePayload(event));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
            event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch. The lock lasts only for this call, so a
     * second publisher instance may pick the same rows up once they are returned;
     * consumers deduplicate on event id.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForTenant(String tenantId, String eventType) {
        return repository.findByTenantIdAndEventTypeOrderBySequenceNumberAsc(tenantId, eventType)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload: " + event.getEventType(), e);
        }
    }
}
