package com.koni.sensordata.application.command;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.exception.ValidationException;
import com.koni.sensordata.domain.model.DeviceType;
import com.koni.sensordata.domain.repository.DeviceTypeRepository;
import com.koni.sensordata.infrastructure.observability.SensorDataMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Command handler resolving DeviceType dimension records.
 * Same create-or-merge rules as {@link UpsertValueTypeCommandHandler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpsertDeviceTypeCommandHandler {
    
    private final DeviceTypeRepository deviceTypeRepository;
    private final SensorDataMetrics metrics;
    
    @Transactional
    @Observed(name = "command.handler", contextualName = "upsert-device-type")
    public DeviceType handle(UpsertDeviceTypeCommand command) {
        if (command.getId() == null) {
            throw new ValidationException("id is required");
        }
        log.debug("Handling UpsertDeviceTypeCommand: id={}, name={}, location={}",
                command.getId(), command.getName(), command.getLocation());
        
        Optional<DeviceType> existing = deviceTypeRepository.findById(command.getId());
        DeviceType deviceType = existing.orElseGet(() -> new DeviceType(command.getId()));
        deviceType.mergeWith(command.getName(), command.getLocation());
        
        try {
            DeviceType saved = existing.isPresent()
                    ? deviceTypeRepository.update(deviceType)
                    : deviceTypeRepository.insert(deviceType);
            log.info("Device type {}: {}", existing.isPresent() ? "updated" : "created", saved);
            return saved;
        } catch (ConflictException e) {
            metrics.recordConflict();
            throw e;
        }
    }
}
