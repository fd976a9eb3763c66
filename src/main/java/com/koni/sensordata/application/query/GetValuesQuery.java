package com.koni.sensordata.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for stored values. Every filter is optional; null means "no restriction".
 * {@code start} and {@code end} are inclusive.
 */
@Getter
@AllArgsConstructor
public class GetValuesQuery {
    
    private final Long valueTypeId;
    private final Long start;
    private final Long end;
    
    public static GetValuesQuery all() {
        return new GetValuesQuery(null, null, null);
    }
}
