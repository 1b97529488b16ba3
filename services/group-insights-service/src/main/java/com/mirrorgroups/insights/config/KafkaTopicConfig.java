package com.mirrorgroups.insights.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic analysisJobsTopic(GroupInsightsProperties properties) {
        return TopicBuilder.name(properties.getQueue().getNotificationTopic())
            .partitions(3)
            .replicas(1)
            .build();
    }

    @Bean
    public NewTopic analysisCompletedTopic(GroupInsightsProperties properties) {
        return TopicBuilder.name(properties.getEvents().getAnalysisCompletedTopic())
            .partitions(3)
            .replicas(1)
            .build();
    }
}
