package com.flagship.credits_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for credit events relayed from the outbox.
 *
 * Events are keyed by wallet id, so partitions only need to preserve per-wallet order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.credits:credits}")
    private String creditsTopic;

    @Value("${kafka.topic.credits-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic creditsTopic() {
        return TopicBuilder.name(creditsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
