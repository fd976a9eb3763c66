package com.koni.sensordata.domain.repository;

import com.koni.sensordata.domain.model.ValueType;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for ValueType persistence operations.
 * This interface is part of the domain layer and defines the contract
 * for ValueType data access without coupling to specific infrastructure implementations.
 */
public interface ValueTypeRepository {
    
    /**
     * Finds a ValueType by its identifier.
     * 
     * @param id the identifier of the ValueType
     * @return an Optional containing the ValueType if found, or empty if not found
     * @throws com.koni.sensordata.domain.exception.MultipleResultsException if more than one record matches
     * @throws IllegalArgumentException if id is null
     */
    Optional<ValueType> findById(Long id);
    
    /**
     * Inserts a ValueType that was absent when looked up and flushes it to the store.
     * Never overwrites an existing row.
     * 
     * @param valueType the ValueType to create
     * @return the ValueType as persisted
     * @throws com.koni.sensordata.domain.exception.ConflictException if a row with the same id
     *         already exists, e.g. created by a concurrent caller
     * @throws IllegalArgumentException if valueType is null
     */
    ValueType insert(ValueType valueType);
    
    /**
     * Writes name and unit onto the stored ValueType and flushes the change.
     * 
     * @param valueType the ValueType with its merged fields
     * @return the ValueType as persisted
     * @throws com.koni.sensordata.domain.exception.ConflictException if a concurrent writer
     *         changed the row since it was read
     * @throws com.koni.sensordata.domain.exception.NotFoundException if the row does not exist
     */
    ValueType update(ValueType valueType);
    
    /**
     * Retrieves all ValueTypes ordered by identifier.
     * 
     * @return all ValueTypes, or an empty list if none exist
     */
    List<ValueType> findAll();
}
