package com.koni.sensordata.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * JPA entity for the device_type dimension table.
 * Same insert/update discipline as {@link ValueTypeEntity}.
 */
@Entity
@Table(name = "device_type")
@Getter
@Setter
@NoArgsConstructor
public class DeviceTypeEntity implements Persistable<Long> {
    
    @Id
    @Column(name = "id")
    private Long id;
    
    @Column(name = "name", nullable = false)
    private String name;
    
    @Column(name = "location", nullable = false)
    private String location;
    
    @Version
    @Column(name = "version")
    private Long version;
    
    @Transient
    private boolean pendingInsert;
    
    public DeviceTypeEntity(Long id, String name, String location) {
        this.id = id;
        this.name = name;
        this.location = location;
    }
    
    public static DeviceTypeEntity newRow(Long id, String name, String location) {
        DeviceTypeEntity entity = new DeviceTypeEntity(id, name, location);
        entity.pendingInsert = true;
        return entity;
    }
    
    @Override
    public boolean isNew() {
        return pendingInsert;
    }
    
    @PostPersist
    @PostLoad
    void markStored() {
        pendingInsert = false;
    }
}
