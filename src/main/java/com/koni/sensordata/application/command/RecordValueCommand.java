package com.koni.sensordata.application.command;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to record one measurement sample.
 */
@Getter
@AllArgsConstructor
public class RecordValueCommand {

    /**
     * Unix timestamp of the sample.
     */
    @NotNull(message = "time is required")
    private final Long time;

    /**
     * Identifier of the ValueType; created with default name/unit if unknown.
     */
    @NotNull(message = "valueTypeId is required")
    private final Long valueTypeId;

    @NotNull(message = "value is required")
    private final Double value;
}
