package com.koni.sensordata.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class GetValueTypeQuery {
    
    private final Long id;
}
