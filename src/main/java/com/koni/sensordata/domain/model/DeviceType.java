package com.koni.sensordata.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * DeviceType dimension describing a physical device and where it is installed.
 * Standalone: measurements do not reference it.
 */
@Getter
@AllArgsConstructor
public class DeviceType {
    
    private final Long id;
    private String name;
    private String location;
    
    public DeviceType(Long id) {
        this.id = id;
    }
    
    /**
     * Same partial-update rules as {@link ValueType#mergeWith(String, String)}, with the
     * defaults {@code DEVICE_TYPE_<id>} and {@code DEVICE_LOCATION_<id>}.
     *
     * @param newName the requested name, or null/empty to leave it untouched
     * @param newLocation the requested location, or null/empty to leave it untouched
     */
    public void mergeWith(String newName, String newLocation) {
        if (newName != null && !newName.isEmpty()) {
            this.name = newName;
        } else if (name == null || name.isEmpty()) {
            this.name = "DEVICE_TYPE_" + id;
        }
        
        if (newLocation != null && !newLocation.isEmpty()) {
            this.location = newLocation;
        } else if (location == null || location.isEmpty()) {
            this.location = "DEVICE_LOCATION_" + id;
        }
    }
    
    @Override
    public String toString() {
        return "DeviceType{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", location='" + location + '\'' +
                '}';
    }
}
