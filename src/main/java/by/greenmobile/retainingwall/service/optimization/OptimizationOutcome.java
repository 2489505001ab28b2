package by.greenmobile.retainingwall.service.optimization;

import by.greenmobile.retainingwall.entity.CandidateDesign;
import by.greenmobile.retainingwall.entity.InfeasibilityReason;
import by.greenmobile.retainingwall.entity.SearchState;
import by.greenmobile.retainingwall.entity.StabilityResult;
import lombok.Value;

/**
 * Итог перебора: CONVERGED с победителем либо INFEASIBLE с причиной и последним
 * оценённым результатом проверки.
 */
@Value
public class OptimizationOutcome {
    SearchState state;
    CandidateDesign winner;
    StabilityResult lastResult;
    InfeasibilityReason reason;
    int evaluations;

    public static OptimizationOutcome converged(CandidateDesign winner, int evaluations) {
        return new OptimizationOutcome(SearchState.CONVERGED, winner, winner.getStability(), null, evaluations);
    }

    public static OptimizationOutcome infeasible(StabilityResult last, InfeasibilityReason reason, int evaluations) {
        return new OptimizationOutcome(SearchState.INFEASIBLE, null, last, reason, evaluations);
    }

    public boolean isConverged() {
        return state == SearchState.CONVERGED;
    }
}
