package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.infrastructure.persistence.entity.DeviceTypeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository for DeviceTypeEntity persistence operations.
 */
@Repository
public interface DeviceTypeJpaRepository extends JpaRepository<DeviceTypeEntity, Long> {
    
    @Query("SELECT d FROM DeviceTypeEntity d WHERE d.id = :id")
    List<DeviceTypeEntity> findAllMatching(@Param("id") Long id);
}
