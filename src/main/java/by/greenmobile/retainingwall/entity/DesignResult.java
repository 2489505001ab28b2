package by.greenmobile.retainingwall.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Результат одного прогона движка: либо спецификация, либо диагноз недостижимости.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DesignResult {

    boolean feasible;

    /** null, если недостижимо. */
    WallSpecification specification;

    /** Последний оценённый кандидат (для диагностики) либо результат победителя. */
    StabilityResult lastStabilityResult;

    /** null, если достижимо. */
    InfeasibilityReason reason;

    /** Текст для пользователя; null, если достижимо. */
    String recommendation;

    /** Сколько кандидатов было оценено. */
    int evaluations;

    public static DesignResult feasible(WallSpecification specification, int evaluations) {
        return new DesignResult(true, specification, specification.getStabilityResult(), null, null, evaluations);
    }

    public static DesignResult infeasible(StabilityResult last,
                                          InfeasibilityReason reason,
                                          String recommendation,
                                          int evaluations) {
        return new DesignResult(false, null, last, reason, recommendation, evaluations);
    }

    public List<StabilityCheck> failedChecks() {
        return lastStabilityResult != null ? lastStabilityResult.getFailedChecks() : List.of();
    }
}
