package com.flagship.coop_ledger.observability;

import com.flagship.coop_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks beyond the defaults Spring Boot contributes.
 */
public class HealthIndicators {

    /**
     * Down when the outbox backlog is large enough that ledger events reach AML late.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

                return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("deadLettered", deadLettered)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();

            } catch (Exception e) {
                return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
            }
        }
    }

    /**
     * Settlement idempotency cache. Redis being down only degrades the service:
     * lookups fall back to the settlements table.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public IdempotencyCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                    ? Health.up().withDetail("response", result).build()
                    : degraded("Unexpected ping response: " + result);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                .withDetail("error", error)
                .withDetail("note", "Settlement idempotency falls back to the database")
                .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                        .withDetail("error", "No Kafka producer connections established")
                        .build();
                }
                return Health.up()
                    .withDetail("metricsCount", metrics.size())
                    .build();
            } catch (Exception e) {
                return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
            }
        }
    }
}
