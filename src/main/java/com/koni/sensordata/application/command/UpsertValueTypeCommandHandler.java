package com.koni.sensordata.application.command;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.exception.ValidationException;
import com.koni.sensordata.domain.model.ValueType;
import com.koni.sensordata.domain.repository.ValueTypeRepository;
import com.koni.sensordata.infrastructure.observability.SensorDataMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Command handler resolving ValueType dimension records.
 * 
 * Responsibilities:
 * - Create the ValueType when the id is unknown (a normal path, not an error)
 * - Overwrite name/unit only when a non-empty value is supplied
 * - Synthesize TYPE_&lt;id&gt; / UNIT_&lt;id&gt; for fields that would otherwise stay empty
 * 
 * Joins the caller's transaction when there is one, which is how the measurement
 * writer creates the dimension and the fact atomically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpsertValueTypeCommandHandler {
    
    private final ValueTypeRepository valueTypeRepository;
    private final SensorDataMetrics metrics;
    
    /**
     * Handles the UpsertValueTypeCommand.
     * 
     * @param command the command carrying the id and the optional name/unit
     * @return the ValueType as persisted
     * @throws ValidationException if the id is missing
     * @throws ConflictException if a concurrent writer created the same id first
     */
    @Transactional
    @Observed(name = "command.handler", contextualName = "upsert-value-type")
    public ValueType handle(UpsertValueTypeCommand command) {
        if (command.getId() == null) {
            throw new ValidationException("id is required");
        }
        log.debug("Handling UpsertValueTypeCommand: id={}, name={}, unit={}",
                command.getId(), command.getName(), command.getUnit());
        
        Optional<ValueType> existing = valueTypeRepository.findById(command.getId());
        ValueType valueType = existing.orElseGet(() -> new ValueType(command.getId()));
        valueType.mergeWith(command.getName(), command.getUnit());
        
        ValueType saved;
        try {
            saved = existing.isPresent()
                    ? valueTypeRepository.update(valueType)
                    : valueTypeRepository.insert(valueType);
        } catch (ConflictException e) {
            metrics.recordConflict();
            throw e;
        }
        
        if (existing.isEmpty()) {
            metrics.recordValueTypeCreated();
            log.info("Value type created: {}", saved);
        } else {
            log.info("Value type updated: {}", saved);
        }
        return saved;
    }
}
