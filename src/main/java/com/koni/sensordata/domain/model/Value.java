package com.koni.sensordata.domain.model;

import com.koni.sensordata.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Value fact representing one measurement sample of a given ValueType.
 * Immutable once created; the store assigns {@code id} on insert.
 */
@Getter
@EqualsAndHashCode
public class Value {
    
    private final Long id;
    private final Long time;
    private final Double value;
    private final Long valueTypeId;
    
    /**
     * Creates a Value that has not been persisted yet.
     *
     * @param time the unix timestamp of the sample
     * @param valueTypeId the identifier of the owning ValueType
     * @param value the measured value
     */
    public Value(Long time, Long valueTypeId, Double value) {
        this(null, time, valueTypeId, value);
    }
    
    public Value(Long id, Long time, Long valueTypeId, Double value) {
        this.id = id;
        this.time = time;
        this.valueTypeId = valueTypeId;
        this.value = value;
    }
    
    /**
     * Validates that every field required for an insert is present.
     *
     * @throws ValidationException if validation fails
     */
    public void validate() {
        if (time == null) {
            throw new ValidationException("time is required");
        }
        if (valueTypeId == null) {
            throw new ValidationException("valueTypeId is required");
        }
        if (value == null) {
            throw new ValidationException("value is required");
        }
    }
    
    @Override
    public String toString() {
        return "Value{" +
                "id=" + id +
                ", time=" + time +
                ", valueTypeId=" + valueTypeId +
                ", value=" + value +
                '}';
    }
}
