package com.koni.sensordata.infrastructure.messaging;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the readings topic and its dead letter topic so they are created on startup.
 * Disabled with {@code sensordata.kafka.create-topics=false} when no broker is around.
 */
@Configuration
@ConditionalOnProperty(name = "sensordata.kafka.create-topics", havingValue = "true", matchIfMissing = true)
public class KafkaTopicConfig {
    
    @Value("${sensordata.kafka.readings-topic}")
    private String topicName;
    
    @Value("${sensordata.kafka.partitions:3}")
    private int partitions;
    
    @Value("${sensordata.kafka.replication-factor:1}")
    private short replicationFactor;
    
    @Bean
    public NewTopic sensorReadingsTopic() {
        return TopicBuilder.name(topicName)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }
    
    @Bean
    public NewTopic sensorReadingsDlqTopic() {
        return TopicBuilder.name(KafkaErrorHandlingConfig.dlqTopic(topicName))
                .partitions(1)
                .replicas(replicationFactor)
                .build();
    }
}
