package by.greenmobile.retainingwall.service;

import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.DesignResult;
import by.greenmobile.retainingwall.entity.LoadCase;
import by.greenmobile.retainingwall.entity.WallSpecification;
import by.greenmobile.retainingwall.service.engine.LoadModel;
import by.greenmobile.retainingwall.service.optimization.DesignOptimizer;
import by.greenmobile.retainingwall.service.optimization.InfeasibilityAdvisor;
import by.greenmobile.retainingwall.service.optimization.OptimizationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Единая точка расчёта стенки:
 * - проверка контракта DesignInput
 * - нагрузки (LoadModel) - один раз на прогон
 * - перебор кандидатов (DesignOptimizer)
 * - спецификация (SpecificationBuilder) или диагноз недостижимости
 *
 * Без состояния между вызовами: параллельные прогоны ничего не делят.
 * Недостижимость - нормальный результат, а не исключение.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WallDesignFacade {

    private final LoadModel loadModel;
    private final DesignOptimizer optimizer;
    private final SpecificationBuilder specificationBuilder;
    private final InfeasibilityAdvisor advisor;

    public DesignResult run(DesignInput input) {
        input.requireValid();

        LoadCase lc = loadModel.deriveLoadCase(input);
        OptimizationOutcome outcome = optimizer.optimize(input, lc);

        if (outcome.isConverged()) {
            WallSpecification spec = specificationBuilder.build(input, outcome.getWinner());
            log.info("DESIGN: H={} material={} slope={} soil={} objective={} => sections={} footing={} " +
                            "OT={} SL={} BR={} evaluations={}",
                    input.getHeight(), input.getMaterial(), input.getSurcharge(), input.getSoilStiffness(),
                    input.getOptimizationObjective(), spec.getSections(), spec.getFooting(),
                    spec.getStabilityResult().getOverturningFactor(),
                    spec.getStabilityResult().getSlidingFactor(),
                    spec.getStabilityResult().getBearingFactor(),
                    outcome.getEvaluations());
            return DesignResult.feasible(spec, outcome.getEvaluations());
        }

        String recommendation = advisor.generateRecommendation(input, outcome);
        log.warn("DESIGN: infeasible H={} material={} slope={} soil={} objective={} reason={} failed={} evaluations={}",
                input.getHeight(), input.getMaterial(), input.getSurcharge(), input.getSoilStiffness(),
                input.getOptimizationObjective(), outcome.getReason(),
                outcome.getLastResult() != null ? outcome.getLastResult().getFailedChecks() : null,
                outcome.getEvaluations());
        return DesignResult.infeasible(outcome.getLastResult(), outcome.getReason(), recommendation,
                outcome.getEvaluations());
    }
}
