package com.koni.sensordata.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * SensorReadingSampled event.
 * Emitted by the sensor reader for every sample it takes and consumed from Kafka
 * by the ingestion listener, which turns it into a stored Value.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SensorReadingSampled {
    
    private final Long time;
    private final Long valueTypeId;
    private final Double value;
    
    /**
     * Creates a new SensorReadingSampled event.
     * This constructor is used by Jackson for JSON deserialization.
     *
     * @param time the unix timestamp of the sample
     * @param valueTypeId the identifier of the measured ValueType
     * @param value the sampled value
     */
    @JsonCreator
    public SensorReadingSampled(
            @JsonProperty("time") Long time,
            @JsonProperty("valueTypeId") Long valueTypeId,
            @JsonProperty("value") Double value) {
        this.time = time;
        this.valueTypeId = valueTypeId;
        this.value = value;
    }
}
