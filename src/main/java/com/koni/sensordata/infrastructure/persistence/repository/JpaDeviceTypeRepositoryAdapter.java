package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.exception.MultipleResultsException;
import com.koni.sensordata.domain.exception.NotFoundException;
import com.koni.sensordata.domain.model.DeviceType;
import com.koni.sensordata.domain.repository.DeviceTypeRepository;
import com.koni.sensordata.infrastructure.persistence.entity.DeviceTypeEntity;
import io.micrometer.tracing.annotation.ContinueSpan;
import io.micrometer.tracing.annotation.SpanTag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * JPA adapter for DeviceTypeRepository.
 * Mirrors {@link JpaValueTypeRepositoryAdapter} for the device_type table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDeviceTypeRepositoryAdapter implements DeviceTypeRepository {
    
    private final DeviceTypeJpaRepository jpaRepository;
    
    @Override
    @ContinueSpan(log = "device-type-find")
    public Optional<DeviceType> findById(@SpanTag("deviceTypeId") Long id) {
        if (id == null) {
            throw new IllegalArgumentException("DeviceType id cannot be null");
        }
        
        List<DeviceTypeEntity> matches = jpaRepository.findAllMatching(id);
        if (matches.size() > 1) {
            log.error("Found {} device_type rows for id={}", matches.size(), id);
            throw new MultipleResultsException(
                    "Expected at most one DeviceType with id " + id + " but found " + matches.size());
        }
        return matches.stream().findFirst().map(this::toDomain);
    }
    
    @Override
    @ContinueSpan(log = "device-type-insert")
    public DeviceType insert(DeviceType deviceType) {
        if (deviceType == null) {
            throw new IllegalArgumentException("DeviceType cannot be null");
        }
        
        return write(DeviceTypeEntity.newRow(deviceType.getId(), deviceType.getName(), deviceType.getLocation()));
    }
    
    @Override
    @ContinueSpan(log = "device-type-update")
    public DeviceType update(DeviceType deviceType) {
        if (deviceType == null) {
            throw new IllegalArgumentException("DeviceType cannot be null");
        }
        
        DeviceTypeEntity entity = jpaRepository.findById(deviceType.getId())
                .orElseThrow(() -> new NotFoundException("DeviceType with id " + deviceType.getId() + " not found"));
        entity.setName(deviceType.getName());
        entity.setLocation(deviceType.getLocation());
        return write(entity);
    }
    
    private DeviceType write(DeviceTypeEntity entity) {
        try {
            return toDomain(jpaRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.warn("Conflict while writing device type id={}: {}", entity.getId(), e.getMessage());
            throw new ConflictException("Conflicting write for DeviceType with id " + entity.getId(), e);
        }
    }
    
    private DeviceType toDomain(DeviceTypeEntity entity) {
        return new DeviceType(entity.getId(), entity.getName(), entity.getLocation());
    }
}
