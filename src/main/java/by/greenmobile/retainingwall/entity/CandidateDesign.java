package by.greenmobile.retainingwall.entity;

import lombok.Value;

import java.util.List;

/**
 * Кандидат перебора: геометрия стенки + фундамент + результат проверки.
 */
@Value
public class CandidateDesign {
    List<WallSection> sections;
    int widthStep;
    Footing footing;
    int heelExtension;
    StabilityResult stability;

    public boolean isStable() {
        return stability != null && stability.isPassed();
    }
}
