package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.infrastructure.persistence.entity.ValueTypeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository for ValueTypeEntity persistence operations.
 * 
 * Spring Data JPA will automatically implement this interface at runtime,
 * providing standard CRUD operations and custom query methods.
 */
@Repository
public interface ValueTypeJpaRepository extends JpaRepository<ValueTypeEntity, Long> {
    
    /**
     * Returns every row carrying the given id. The primary key guarantees at most one;
     * the list form lets the adapter detect a violated uniqueness invariant.
     * 
     * @param id the ValueType identifier
     * @return the matching rows
     */
    @Query("SELECT t FROM ValueTypeEntity t WHERE t.id = :id")
    List<ValueTypeEntity> findAllMatching(@Param("id") Long id);
    
    List<ValueTypeEntity> findAllByOrderByIdAsc();
}
