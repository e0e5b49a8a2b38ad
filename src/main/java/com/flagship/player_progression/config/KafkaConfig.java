package com.flagship.player_progression.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service.
 *
 * progression-events carries facts written through the outbox (level ups,
 * unlocks, prestige, currency changes). match-results is consumed from the
 * match service; it is declared here so local environments get it created.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.progression-events:progression-events}")
    private String progressionEventsTopic;

    @Value("${kafka.topic.match-results:match-results}")
    private String matchResultsTopic;

    /**
     * Keyed by player id, so partitions preserve per-player ordering.
     */
    @Bean
    public NewTopic progressionEventsTopic() {
        return TopicBuilder.name(progressionEventsTopic)
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic matchResultsTopic() {
        return TopicBuilder.name(matchResultsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
