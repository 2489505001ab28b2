package by.greenmobile.retainingwall.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Материал стенки (stem). Фундамент всегда монолитный бетон.
 */
public enum Material {
    CONCRETE("Concrete"),
    CMU("CMU");

    private final String label;

    Material(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Material fromLabel(String value) {
        for (Material m : values()) {
            if (m.label.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value)) return m;
        }
        throw new IllegalArgumentException("Unknown material: " + value);
    }
}
