package com.flagship.prior_auth.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.authorization-updates:authorization-updates}")
    private String updatesTopic;

    /**
     * Keyed by authorization ID, so per-authorization order holds within a partition.
     */
    @Bean
    public NewTopic authorizationUpdatesTopic() {
        return TopicBuilder.name(updatesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
