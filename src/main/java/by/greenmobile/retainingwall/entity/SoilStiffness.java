package by.greenmobile.retainingwall.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SoilStiffness {
    STIFF("Stiff"),
    SOFT("Soft");

    private final String label;

    SoilStiffness(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static SoilStiffness fromLabel(String value) {
        for (SoilStiffness s : values()) {
            if (s.label.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown soil stiffness: " + value);
    }
}
