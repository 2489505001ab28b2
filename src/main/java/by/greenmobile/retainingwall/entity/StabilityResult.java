package by.greenmobile.retainingwall.entity;

import lombok.Value;

import java.util.List;

/**
 * Коэффициенты запаса по трём формам потери устойчивости.
 * passed == true только если прошли все три; частичного зачёта нет.
 */
@Value
public class StabilityResult {
    double overturningFactor;
    double slidingFactor;
    double bearingFactor;
    boolean passed;
    List<StabilityCheck> failedChecks;

    public StabilityResult(double overturningFactor,
                           double slidingFactor,
                           double bearingFactor,
                           List<StabilityCheck> failedChecks) {
        this.overturningFactor = overturningFactor;
        this.slidingFactor = slidingFactor;
        this.bearingFactor = bearingFactor;
        this.failedChecks = List.copyOf(failedChecks);
        this.passed = this.failedChecks.isEmpty();
    }
}
