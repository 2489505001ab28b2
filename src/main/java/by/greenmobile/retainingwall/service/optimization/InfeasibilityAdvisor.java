package by.greenmobile.retainingwall.service.optimization;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.InfeasibilityReason;
import by.greenmobile.retainingwall.entity.SoilStiffness;
import by.greenmobile.retainingwall.entity.StabilityCheck;
import by.greenmobile.retainingwall.entity.StabilityResult;
import by.greenmobile.retainingwall.entity.Surcharge;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Текст для пользователя, когда устойчивого решения нет: какой коэффициент не прошёл
 * (значение против минимума) и что можно поменять во входных параметрах.
 */
@Service
@RequiredArgsConstructor
public class InfeasibilityAdvisor {

    public static final String HEADLINE = "Unable to generate a compliant design for these parameters.";

    private final WallDesignProperties properties;

    public String generateRecommendation(DesignInput input, OptimizationOutcome outcome) {
        StringBuilder sb = new StringBuilder(HEADLINE);

        if (outcome.getReason() == InfeasibilityReason.FOOTING_LIMIT_EXCEEDED) {
            sb.append(" The required footing is wider than the practical maximum of ")
                    .append(properties.getFooting().getMaxWidth()).append(" in.");
        } else if (outcome.getReason() == InfeasibilityReason.ITERATION_LIMIT_REACHED) {
            sb.append(" The search limit was reached before a stable footing was found.");
        }

        StabilityResult last = outcome.getLastResult();
        if (last != null && !last.getFailedChecks().isEmpty()) {
            WallDesignProperties.Safety safety = properties.getSafety();
            sb.append(" Failing check(s):");
            for (StabilityCheck check : last.getFailedChecks()) {
                switch (check) {
                    case OVERTURNING:
                        sb.append(" overturning factor ").append(fmt2(last.getOverturningFactor()))
                                .append(" < ").append(fmt2(safety.getMinOverturning())).append(';');
                        break;
                    case SLIDING:
                        sb.append(" sliding factor ").append(fmt2(last.getSlidingFactor()))
                                .append(" < ").append(fmt2(safety.getMinSliding())).append(';');
                        break;
                    case BEARING:
                        sb.append(" bearing factor ").append(fmt2(last.getBearingFactor()))
                                .append(" < ").append(fmt2(safety.getMinBearing())).append(';');
                        break;
                    default:
                        throw new IllegalStateException("Unhandled stability check: " + check);
                }
            }
            sb.setLength(sb.length() - 1);
            sb.append('.');
        }

        List<String> hints = new ArrayList<>();
        if (input.getSurcharge() != Surcharge.FLAT) {
            hints.add("flattening the slope above the wall");
        }
        if (input.isAdjacentSlab()) {
            hints.add("moving the adjacent slab back");
        }
        if (input.getSoilStiffness() == SoilStiffness.SOFT) {
            hints.add("a geotechnical evaluation of the soft soil");
        }
        hints.add("reducing the retained height");

        sb.append(" Consider ");
        if (hints.size() > 1) {
            sb.append(String.join(", ", hints.subList(0, hints.size() - 1))).append(" or ");
        }
        sb.append(hints.get(hints.size() - 1)).append('.');
        return sb.toString();
    }

    private String fmt2(double v) {
        return String.format(Locale.US, "%.2f", v);
    }
}
