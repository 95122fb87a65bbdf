package com.flagship.settlement_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the engine reads from and publishes to.
 *
 * Job events come in keyed by job id; commission and settlement events go out
 * keyed by aggregate id. Three partitions each.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.jobs:job-events}")
    private String jobsTopic;

    @Value("${kafka.topic.commission-events:commission-events}")
    private String commissionTopic;

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String settlementTopic;

    @Bean
    public NewTopic jobEventsTopic() {
        return TopicBuilder.name(jobsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic commissionEventsTopic() {
        return TopicBuilder.name(commissionTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic settlementEventsTopic() {
        return TopicBuilder.name(settlementTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
