package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.infrastructure.persistence.entity.ValueEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository for ValueEntity persistence operations.
 * 
 * Spring Data JPA will automatically implement this interface at runtime,
 * providing standard CRUD operations and custom query methods.
 */
@Repository
public interface ValueJpaRepository extends JpaRepository<ValueEntity, Long> {
    
    /**
     * Retrieves values filtered by ValueType and an inclusive time window.
     * A null parameter disables its filter. The type filter goes through the
     * join on value_type; ties on time are ordered by the generated id.
     * 
     * @param valueTypeId the ValueType identifier, or null
     * @param start the inclusive lower time bound, or null
     * @param end the inclusive upper time bound, or null
     * @return the matching values ordered by time, then id
     */
    @Query("SELECT v FROM ValueEntity v JOIN v.valueType t WHERE " +
           "(:valueTypeId IS NULL OR t.id = :valueTypeId) AND " +
           "(:start IS NULL OR v.time >= :start) AND " +
           "(:end IS NULL OR v.time <= :end) " +
           "ORDER BY v.time ASC, v.id ASC")
    List<ValueEntity> findByFilters(
            @Param("valueTypeId") Long valueTypeId,
            @Param("start") Long start,
            @Param("end") Long end);
    
    long countByValueTypeId(Long valueTypeId);
}
