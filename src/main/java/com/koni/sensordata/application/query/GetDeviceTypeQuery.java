package com.koni.sensordata.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class GetDeviceTypeQuery {
    
    private final Long id;
}
