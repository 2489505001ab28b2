package by.greenmobile.retainingwall.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Уклон грунта над стенкой (rise:run).
 * Slope1_2 = подъём 1 на 2 по горизонтали, т.е. atan(0.5) ≈ 26.6°.
 */
public enum Surcharge {
    FLAT("Flat", 0.0),
    SLOPE_1_1("Slope1_1", 1.0),
    SLOPE_1_2("Slope1_2", 0.5),
    SLOPE_1_4("Slope1_4", 0.25);

    private final String label;
    private final double riseOverRun;

    Surcharge(String label, double riseOverRun) {
        this.label = label;
        this.riseOverRun = riseOverRun;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** tan(beta). */
    public double getRiseOverRun() {
        return riseOverRun;
    }

    /** Угол откоса beta, рад. */
    public double angleRadians() {
        return Math.atan(riseOverRun);
    }

    @JsonCreator
    public static Surcharge fromLabel(String value) {
        for (Surcharge s : values()) {
            if (s.label.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown surcharge: " + value);
    }
}
