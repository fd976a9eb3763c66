package com.koni.sensordata.application.command;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.model.Value;
import com.koni.sensordata.domain.repository.ValueRepository;
import com.koni.sensordata.infrastructure.observability.SensorDataMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Command handler for recording measurement values.
 * 
 * Responsibilities:
 * - Validate the incoming sample
 * - Resolve the owning ValueType, creating it with default name/unit when unknown
 * - Append the Value (no deduplication: identical samples are all stored)
 * 
 * Dimension resolution and the insert share one transaction, so a failed insert
 * never leaves a freshly created ValueType or an orphaned Value behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordValueCommandHandler {
    
    private final UpsertValueTypeCommandHandler valueTypeResolver;
    private final ValueRepository valueRepository;
    private final SensorDataMetrics metrics;
    
    /**
     * Handles the RecordValueCommand.
     * 
     * @param command the command containing the sample to record
     * @throws com.koni.sensordata.domain.exception.ValidationException if a field is missing
     * @throws ConflictException if the write violates a store constraint; not retried
     */
    @Transactional
    @Observed(name = "command.handler", contextualName = "record-value")
    public void handle(RecordValueCommand command) {
        log.debug("Handling RecordValueCommand: time={}, valueTypeId={}, value={}",
                command.getTime(), command.getValueTypeId(), command.getValue());
        
        metrics.recordWriteTime(() -> {
            Value value = new Value(command.getTime(), command.getValueTypeId(), command.getValue());
            value.validate();
            
            valueTypeResolver.handle(UpsertValueTypeCommand.ensureExists(value.getValueTypeId()));
            
            Value saved;
            try {
                saved = valueRepository.save(value);
            } catch (ConflictException e) {
                metrics.recordConflict();
                throw e;
            }
            metrics.recordValueRecorded();
            log.info("Value recorded: id={}, time={}, valueTypeId={}, value={}",
                    saved.getId(), saved.getTime(), saved.getValueTypeId(), saved.getValue());
        });
    }
}
