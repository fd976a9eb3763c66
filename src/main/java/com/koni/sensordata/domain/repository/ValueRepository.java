package com.koni.sensordata.domain.repository;

import com.koni.sensordata.domain.model.Value;

import java.util.List;

/**
 * Repository interface for Value persistence operations.
 * Values are append-only: there is no update or delete.
 */
public interface ValueRepository {
    
    /**
     * Appends a Value. The referenced ValueType must already exist.
     * 
     * @param value the Value to persist
     * @return the persisted Value carrying its generated id
     * @throws com.koni.sensordata.domain.exception.ConflictException on an integrity violation
     * @throws IllegalArgumentException if value is null
     */
    Value save(Value value);
    
    /**
     * Retrieves Values matching all of the given filters, ordered by ascending time
     * and then by insertion order. Every filter is optional.
     * 
     * @param valueTypeId only Values of this ValueType, or null for all types
     * @param start inclusive lower bound on time, or null for no bound
     * @param end inclusive upper bound on time, or null for no bound
     * @return the matching Values, or an empty list if none match
     */
    List<Value> findValues(Long valueTypeId, Long start, Long end);
}
