package com.koni.sensordata.infrastructure.web.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object for a measurement posted via REST API.
 * 
 * Contains:
 * - time: unix timestamp of the sample
 * - valueTypeId: identifier of the measured ValueType (created on the fly if unknown)
 * - value: the measured value
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ValueRequest {
    
    @NotNull(message = "time is required")
    private Long time;
    
    @NotNull(message = "valueTypeId is required")
    private Long valueTypeId;
    
    @NotNull(message = "value is required")
    private Double value;
}
