package com.flagship.coop_ledger.outbox;

import com.flagship.coop_ledger.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher routing and retry bookkeeping, against a mocked Kafka template.
 */
class OutboxPublisherTest {

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry meterRegistry;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        meterRegistry = new SimpleMeterRegistry();
        OutboxMetrics metrics = new OutboxMetrics(mock(OutboxEventRepository.class), meterRegistry);
        metrics.init();

        publisher = new OutboxPublisher(outboxService, kafkaTemplate, metrics);
        ReflectionTestUtils.setField(publisher, "ledgerTopic", "ledger-events");
        ReflectionTestUtils.setField(publisher, "dayBookTopic", "day-book-events");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    @Test
    @DisplayName("Journal entries go to the ledger topic, everything else to the day-book topic")
    void routesByAggregateType() {
        OutboxEvent journal = event("JournalEntry", "JournalEntryPosted", 0);
        OutboxEvent day = event("DayBook", "DayBookTransitioned", 0);
        OutboxEvent settlement = event("TellerSettlement", "TellerSettlementRecorded", 0);

        assertEquals("ledger-events", publisher.topicFor(journal));
        assertEquals("day-book-events", publisher.topicFor(day));
        assertEquals("day-book-events", publisher.topicFor(settlement));
    }

    @Test
    @DisplayName("A successful send is keyed by tenant and marks the row published")
    void publishesAndMarks() {
        OutboxEvent event = event("DayBook", "DayBookTransitioned", 0);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send("day-book-events", "coop-a", event.getPayload()))
            .thenReturn(CompletableFuture.completedFuture(sendResult("day-book-events", event)));

        publisher.publishPendingEvents();

        verify(kafkaTemplate).send("day-book-events", "coop-a", event.getPayload());
        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        assertEquals(1.0, meterRegistry.counter("outbox.events.published",
            "event_type", "DayBookTransitioned", "status", "success").count());
    }

    @Test
    @DisplayName("A failed send records the broker error and leaves the row for retry")
    void failedSendMarksFailed() {
        OutboxEvent event = event("JournalEntry", "JournalEntryPosted", 0);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(event.getId(), "broker down");
        verify(outboxService, never()).markPublished(any());
    }

    @Test
    @DisplayName("The last allowed failure counts the event as dead-lettered")
    void lastRetryDeadLetters() {
        OutboxEvent event = event("DayBook", "DayBookTransitioned", 2);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("serializer failure"));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), eq("serializer failure"));
        assertEquals(1.0, meterRegistry.counter("outbox.events.dead_lettered",
            "event_type", "DayBookTransitioned").count());
    }

    @Test
    @DisplayName("A failing poll is logged and does not escape the scheduler thread")
    void pollFailureContained() {
        when(outboxService.findUnpublishedEvents(anyInt(), anyInt()))
            .thenThrow(new IllegalStateException("database unavailable"));

        assertDoesNotThrow(() -> publisher.publishPendingEvents());
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    private static OutboxEvent event(String aggregateType, String eventType, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "coop-a", aggregateType, UUID.randomUUID(), eventType,
            "{\"eventType\":\"" + eventType + "\"}", Instant.now(), null, retryCount, null, 1L);
    }

    private static SendResult<String, String> sendResult(String topic, OutboxEvent event) {
        return new SendResult<>(new ProducerRecord<>(topic, event.getTenantId(), event.getPayload()),
            new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, System.currentTimeMillis(), 0, 0));
    }
}
