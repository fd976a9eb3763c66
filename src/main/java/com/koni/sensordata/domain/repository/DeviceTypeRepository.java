package com.koni.sensordata.domain.repository;

import com.koni.sensordata.domain.model.DeviceType;

import java.util.Optional;

/**
 * Repository interface for DeviceType persistence operations.
 * Follows the same lookup and conflict contract as {@link ValueTypeRepository}.
 */
public interface DeviceTypeRepository {
    
    /**
     * Finds a DeviceType by its identifier.
     * 
     * @param id the identifier of the DeviceType
     * @return an Optional containing the DeviceType if found, or empty if not found
     * @throws com.koni.sensordata.domain.exception.MultipleResultsException if more than one record matches
     */
    Optional<DeviceType> findById(Long id);
    
    /**
     * Inserts a DeviceType that was absent when looked up.
     * 
     * @throws com.koni.sensordata.domain.exception.ConflictException if the id already exists
     */
    DeviceType insert(DeviceType deviceType);
    
    /**
     * Writes name and location onto the stored DeviceType.
     * 
     * @throws com.koni.sensordata.domain.exception.ConflictException if a concurrent writer
     *         changed the row since it was read
     */
    DeviceType update(DeviceType deviceType);
}
