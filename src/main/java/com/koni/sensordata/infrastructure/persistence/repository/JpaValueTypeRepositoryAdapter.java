package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.exception.MultipleResultsException;
import com.koni.sensordata.domain.exception.NotFoundException;
import com.koni.sensordata.domain.model.ValueType;
import com.koni.sensordata.domain.repository.ValueTypeRepository;
import com.koni.sensordata.infrastructure.persistence.entity.ValueTypeEntity;
import io.micrometer.tracing.annotation.ContinueSpan;
import io.micrometer.tracing.annotation.SpanTag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA adapter for ValueTypeRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 * 
 * It handles mapping between the domain model (ValueType) and the JPA entity (ValueTypeEntity)
 * and translates constraint failures into domain exceptions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaValueTypeRepositoryAdapter implements ValueTypeRepository {
    
    private final ValueTypeJpaRepository jpaRepository;
    
    @Override
    @ContinueSpan(log = "value-type-find")
    public Optional<ValueType> findById(@SpanTag("valueTypeId") Long id) {
        if (id == null) {
            throw new IllegalArgumentException("ValueType id cannot be null");
        }
        
        List<ValueTypeEntity> matches = jpaRepository.findAllMatching(id);
        if (matches.size() > 1) {
            log.error("Found {} value_type rows for id={}", matches.size(), id);
            throw new MultipleResultsException(
                    "Expected at most one ValueType with id " + id + " but found " + matches.size());
        }
        return matches.stream().findFirst().map(this::toDomain);
    }
    
    /**
     * Inserts the ValueType and flushes immediately so that a primary key clash with a
     * concurrent creator surfaces here rather than at commit time.
     * 
     * @param valueType the ValueType to create
     * @return the persisted ValueType
     * @throws ConflictException if the id is already taken
     */
    @Override
    @ContinueSpan(log = "value-type-insert")
    public ValueType insert(ValueType valueType) {
        if (valueType == null) {
            throw new IllegalArgumentException("ValueType cannot be null");
        }
        
        return write(ValueTypeEntity.newRow(valueType.getId(), valueType.getName(), valueType.getUnit()));
    }
    
    /**
     * Copies name and unit onto the managed row. The version check on flush rejects
     * the write if another transaction committed a change in the meantime.
     */
    @Override
    @ContinueSpan(log = "value-type-update")
    public ValueType update(ValueType valueType) {
        if (valueType == null) {
            throw new IllegalArgumentException("ValueType cannot be null");
        }
        
        ValueTypeEntity entity = jpaRepository.findById(valueType.getId())
                .orElseThrow(() -> new NotFoundException("ValueType with id " + valueType.getId() + " not found"));
        entity.setName(valueType.getName());
        entity.setUnit(valueType.getUnit());
        return write(entity);
    }
    
    private ValueType write(ValueTypeEntity entity) {
        try {
            return toDomain(jpaRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.warn("Conflict while writing value type id={}: {}", entity.getId(), e.getMessage());
            throw new ConflictException("Conflicting write for ValueType with id " + entity.getId(), e);
        }
    }
    
    @Override
    @ContinueSpan(log = "value-type-findAll")
    public List<ValueType> findAll() {
        return jpaRepository.findAllByOrderByIdAsc().stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }
    
    private ValueType toDomain(ValueTypeEntity entity) {
        return new ValueType(entity.getId(), entity.getName(), entity.getUnit());
    }
}
