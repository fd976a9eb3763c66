package com.koni.sensordata.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of a ValueType upsert. Both fields are optional; omitted or empty fields keep
 * their stored value.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ValueTypeRequest {
    
    private String name;
    private String unit;
}
