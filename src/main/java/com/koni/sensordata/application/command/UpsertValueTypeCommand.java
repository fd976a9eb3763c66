package com.koni.sensordata.application.command;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to create a ValueType or partially update an existing one.
 * A null or empty name/unit means "leave as is".
 */
@Getter
@AllArgsConstructor
public class UpsertValueTypeCommand {

    @NotNull(message = "id is required")
    private final Long id;

    private final String name;

    private final String unit;

    /**
     * Command that only makes sure the ValueType exists, filling in defaults if needed.
     *
     * @param id the ValueType identifier
     * @return a command carrying neither name nor unit
     */
    public static UpsertValueTypeCommand ensureExists(Long id) {
        return new UpsertValueTypeCommand(id, null, null);
    }
}
