package by.greenmobile.retainingwall.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * Цель оптимизации. Каждая цель задаёт порядок, по которому выбирается победитель
 * среди устойчивых кандидатов.
 */
public enum OptimizationObjective {
    /** Минимальная глубина выемки: толщина фундамента, затем footprint, затем носок. */
    MINIMIZE_EXCAVATION("MinimizeExcavation",
            Comparator.comparingInt((CandidateDesign c) -> c.getFooting().getThickness())
                    .thenComparingInt(c -> c.getFooting().footprint())
                    .thenComparingInt(c -> c.getFooting().getToe())),

    /** Минимальный footprint (toe + heel), затем толщина, затем более тонкая стенка. */
    MINIMIZE_FOOTING("MinimizeFooting",
            Comparator.comparingInt((CandidateDesign c) -> c.getFooting().footprint())
                    .thenComparingInt(c -> c.getFooting().getThickness())
                    .thenComparingInt(CandidateDesign::getWidthStep));

    private final String label;
    private final Comparator<CandidateDesign> preference;

    OptimizationObjective(String label, Comparator<CandidateDesign> preference) {
        this.label = label;
        this.preference = preference;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public Comparator<CandidateDesign> preference() {
        return preference;
    }

    @JsonCreator
    public static OptimizationObjective fromLabel(String value) {
        for (OptimizationObjective o : values()) {
            if (o.label.equalsIgnoreCase(value) || o.name().equalsIgnoreCase(value)) return o;
        }
        throw new IllegalArgumentException("Unknown optimization objective: " + value);
    }
}
