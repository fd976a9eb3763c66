package com.koni.sensordata.application.consumer;

import com.koni.sensordata.application.command.RecordValueCommand;
import com.koni.sensordata.application.command.RecordValueCommandHandler;
import com.koni.sensordata.domain.event.SensorReadingSampled;
import com.koni.sensordata.infrastructure.observability.SensorDataMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * SensorReadingConsumer is the ingestion path for sampled sensor readings.
 * 
 * It listens to the readings topic and records every event as a Value through
 * {@link RecordValueCommandHandler}, so an unknown value type id is created on the fly.
 * 
 * The offset is committed only after the value is stored. A failure is rethrown and
 * left to the container's error handler (retry with backoff, then dead letter topic).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SensorReadingConsumer {
    
    private final RecordValueCommandHandler recordValueCommandHandler;
    private final SensorDataMetrics metrics;
    
    /**
     * Consumes SensorReadingSampled events from the Kafka topic.
     * 
     * @param event the sampled reading
     * @param acknowledgment the Kafka acknowledgment for manual offset commit
     */
    @KafkaListener(
            topics = "${sensordata.kafka.readings-topic}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory",
            autoStartup = "${sensordata.kafka.auto-startup:true}"
    )
    public void consume(SensorReadingSampled event, Acknowledgment acknowledgment) {
        log.debug("Received SensorReadingSampled event: {}", event);
        
        try {
            recordValueCommandHandler.handle(new RecordValueCommand(
                    event.getTime(),
                    event.getValueTypeId(),
                    event.getValue()
            ));
            metrics.recordReadingConsumed();
            acknowledgment.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing SensorReadingSampled event: {}", event, e);
            // Don't acknowledge - let the error handler retry
            throw e;
        }
    }
}
