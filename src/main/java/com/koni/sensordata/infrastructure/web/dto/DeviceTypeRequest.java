package com.koni.sensordata.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of a DeviceType upsert. Both fields are optional.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTypeRequest {
    
    private String name;
    private String location;
}
