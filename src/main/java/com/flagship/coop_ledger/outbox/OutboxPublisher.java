package com.flagship.coop_ledger.outbox;

import com.flagship.coop_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Background publisher that drains the outbox to Kafka.
 *
 * Ledger entries go to the ledger topic (AML and monitoring subscribe there),
 * day book and settlement events to the day-book topic. The tenant id is the
 * record key, so each tenant's events keep their order within a partition.
 *
 * A failed send increments the row's retry count; after {@code max-retries}
 * the row stays in the table as a dead letter for manual replay.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String LEDGER_AGGREGATE = "JournalEntry";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger:ledger-events}")
    private String ledgerTopic;

    @Value("${kafka.topic.day-book:day-book-events}")
    private String dayBookTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result =
                kafkaTemplate.send(topic, event.getTenantId(), event.getPayload()).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
        } catch (ExecutionException | RuntimeException e) {
            String error = e instanceof ExecutionException && e.getCause() != null
                ? e.getCause().getMessage()
                : e.getMessage();
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), error);
            outboxService.markFailed(event.getId(), error);
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), left as dead letter. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return LEDGER_AGGREGATE.equals(event.getAggregateType()) ? ledgerTopic : dayBookTopic;
    }
}
