package com.koni.sensordata.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * JPA entity for the value_type dimension table.
 * The primary key is assigned by the caller, never generated, so newness is tracked
 * explicitly: a row built with {@link #newRow} is always INSERTed and clashes with a
 * concurrent creator on the primary key. Updates are guarded by the version column.
 */
@Entity
@Table(name = "value_type")
@Getter
@Setter
@NoArgsConstructor
public class ValueTypeEntity implements Persistable<Long> {
    
    @Id
    @Column(name = "id")
    private Long id;
    
    @Column(name = "name", nullable = false)
    private String name;
    
    @Column(name = "unit", nullable = false)
    private String unit;
    
    @Version
    @Column(name = "version")
    private Long version;
    
    @Transient
    private boolean pendingInsert;
    
    public ValueTypeEntity(Long id, String name, String unit) {
        this.id = id;
        this.name = name;
        this.unit = unit;
    }
    
    public static ValueTypeEntity newRow(Long id, String name, String unit) {
        ValueTypeEntity entity = new ValueTypeEntity(id, name, unit);
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
