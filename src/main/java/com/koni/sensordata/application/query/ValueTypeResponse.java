package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.model.ValueType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object representing a ValueType.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ValueTypeResponse {
    
    private Long id;
    private String name;
    private String unit;
    
    public static ValueTypeResponse from(ValueType valueType) {
        return new ValueTypeResponse(valueType.getId(), valueType.getName(), valueType.getUnit());
    }
}
