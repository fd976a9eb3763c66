package com.koni.sensordata.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * ValueType dimension describing a kind of measurement (e.g. temperature in degC).
 * The identifier is assigned externally; name and unit are never empty once the
 * record has been through {@link #mergeWith(String, String)}.
 */
@Getter
@AllArgsConstructor
public class ValueType {
    
    private final Long id;
    private String name;
    private String unit;
    
    /**
     * Creates a ValueType that does not exist in the store yet.
     *
     * @param id the externally assigned identifier
     */
    public ValueType(Long id) {
        this.id = id;
    }
    
    /**
     * Applies partial-update semantics: a non-empty argument overwrites the stored field,
     * an absent or empty argument keeps it, and a field that is still empty afterwards
     * receives its synthesized default ({@code TYPE_<id>} / {@code UNIT_<id>}).
     *
     * @param newName the requested name, or null/empty to leave it untouched
     * @param newUnit the requested unit, or null/empty to leave it untouched
     */
    public void mergeWith(String newName, String newUnit) {
        if (hasText(newName)) {
            this.name = newName;
        } else if (!hasText(this.name)) {
            this.name = defaultName(id);
        }
        
        if (hasText(newUnit)) {
            this.unit = newUnit;
        } else if (!hasText(this.unit)) {
            this.unit = defaultUnit(id);
        }
    }
    
    public static String defaultName(Long id) {
        return "TYPE_" + id;
    }
    
    public static String defaultUnit(Long id) {
        return "UNIT_" + id;
    }
    
    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }
    
    @Override
    public String toString() {
        return "ValueType{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", unit='" + unit + '\'' +
                '}';
    }
}
