package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.model.DeviceType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object representing a DeviceType.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTypeResponse {
    
    private Long id;
    private String name;
    private String location;
    
    public static DeviceTypeResponse from(DeviceType deviceType) {
        return new DeviceTypeResponse(deviceType.getId(), deviceType.getName(), deviceType.getLocation());
    }
}
