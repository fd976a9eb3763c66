package com.koni.sensordata.infrastructure.messaging;

import com.koni.sensordata.infrastructure.observability.SensorDataMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Kafka error handling for the readings listener.
 * 
 * - Exponential backoff retry (1s, 2s, 4s), at most 3 retries
 * - Afterwards the record is published to "&lt;readings-topic&gt;.dlq"
 * - Undeserializable records go to the dead letter topic without retry
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaErrorHandlingConfig {
    
    private static final long INITIAL_INTERVAL = 1000L;
    private static final double MULTIPLIER = 2.0;
    private static final int MAX_ATTEMPTS = 3;
    
    private final SensorDataMetrics metrics;
    
    @Value("${sensordata.kafka.readings-topic}")
    private String readingsTopic;
    
    static String dlqTopic(String topic) {
        return topic + ".dlq";
    }
    
    @Bean
    public CommonErrorHandler errorHandler(KafkaTemplate<String, Object> kafkaTemplate) {
        String dlq = dlqTopic(readingsTopic);
        
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending reading to DLQ {}. Topic: {}, Key: {}, Value: {}, Error: {}",
                            dlq,
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            consumerRecord.value(),
                            exception.getMessage(),
                            exception);
                    metrics.recordDlqMessageSent();
                    return new TopicPartition(dlq, -1);
                }
        );
        
        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);
        
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(DeserializationException.class);
        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) ->
                log.warn("Retry attempt {} for reading: topic={}, key={}, value={}, error={}",
                        deliveryAttempt,
                        consumerRecord.topic(),
                        consumerRecord.key(),
                        consumerRecord.value(),
                        exception.getMessage()));
        
        return errorHandler;
    }
}
