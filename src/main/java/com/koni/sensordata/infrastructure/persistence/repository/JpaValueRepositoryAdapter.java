package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.model.Value;
import com.koni.sensordata.domain.repository.ValueRepository;
import com.koni.sensordata.infrastructure.persistence.entity.ValueEntity;
import com.koni.sensordata.infrastructure.persistence.entity.ValueTypeEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * JPA adapter for ValueRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 * 
 * Values are linked to their ValueType through a lazy reference, so saving a Value
 * never reloads the dimension row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaValueRepositoryAdapter implements ValueRepository {
    
    private final ValueJpaRepository jpaRepository;
    private final ValueTypeJpaRepository valueTypeJpaRepository;
    
    @Override
    @Observed(name = "repository.save", contextualName = "value-save")
    public Value save(Value value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        
        ValueTypeEntity valueType = valueTypeJpaRepository.getReferenceById(value.getValueTypeId());
        try {
            ValueEntity saved = jpaRepository.saveAndFlush(
                    new ValueEntity(value.getTime(), value.getValue(), valueType));
            log.debug("Value saved with id={}", saved.getId());
            return new Value(saved.getId(), saved.getTime(), value.getValueTypeId(), saved.getValue());
        } catch (DataIntegrityViolationException e) {
            log.error("Integrity violation while saving {}", value, e);
            throw new ConflictException("Integrity violation while saving value for ValueType "
                    + value.getValueTypeId(), e);
        }
    }
    
    @Override
    @Observed(name = "repository.findValues", contextualName = "value-find")
    public List<Value> findValues(Long valueTypeId, Long start, Long end) {
        log.debug("Querying values: valueTypeId={}, start={}, end={}", valueTypeId, start, end);
        return jpaRepository.findByFilters(valueTypeId, start, end).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }
    
    private Value toDomain(ValueEntity entity) {
        return new Value(
            entity.getId(),
            entity.getTime(),
            entity.getValueType().getId(),
            entity.getValue()
        );
    }
}
