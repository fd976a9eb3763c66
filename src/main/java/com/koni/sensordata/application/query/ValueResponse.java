package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.model.Value;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object representing one stored measurement.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ValueResponse {
    
    private Long id;
    private Long time;
    private Double value;
    private Long valueTypeId;
    
    public static ValueResponse from(Value value) {
        return new ValueResponse(value.getId(), value.getTime(), value.getValue(), value.getValueTypeId());
    }
}
