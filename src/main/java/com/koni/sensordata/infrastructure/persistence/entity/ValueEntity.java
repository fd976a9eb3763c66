package com.koni.sensordata.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the value fact table.
 * Each row references its ValueType through the value_type_id foreign key;
 * the generated id doubles as the insertion sequence used to order equal timestamps.
 */
@Entity
@Table(
    name = "value",
    indexes = {
        @Index(
            name = "idx_value_time",
            columnList = "time"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ValueEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;
    
    @Column(name = "time", nullable = false, updatable = false)
    private Long time;
    
    @Column(name = "value", nullable = false, updatable = false)
    private Double value;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "value_type_id", nullable = false, updatable = false)
    private ValueTypeEntity valueType;
    
    /**
     * Constructor for a new, not yet persisted row.
     *
     * @param time the unix timestamp of the sample
     * @param value the measured value
     * @param valueType the owning ValueType
     */
    public ValueEntity(Long time, Double value, ValueTypeEntity valueType) {
        this.time = time;
        this.value = value;
        this.valueType = valueType;
    }
}
