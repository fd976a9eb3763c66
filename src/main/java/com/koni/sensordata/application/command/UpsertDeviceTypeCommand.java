package com.koni.sensordata.application.command;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to create a DeviceType or partially update an existing one.
 */
@Getter
@AllArgsConstructor
public class UpsertDeviceTypeCommand {

    @NotNull(message = "id is required")
    private final Long id;

    private final String name;

    private final String location;
}
