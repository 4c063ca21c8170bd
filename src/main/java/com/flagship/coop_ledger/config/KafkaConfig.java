package com.flagship.coop_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to.
 *
 * Records are keyed by tenant id, so partitions split the load by tenant.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger:ledger-events}")
    private String ledgerTopic;

    @Value("${kafka.topic.day-book:day-book-events}")
    private String dayBookTopic;

    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
            .partitions(3)
            .replicas(1)
            .build();
    }

    @Bean
    public NewTopic dayBookTopic() {
        return TopicBuilder.name(dayBookTopic)
            .partitions(3)
            .replicas(1)
            .build();
    }
}
