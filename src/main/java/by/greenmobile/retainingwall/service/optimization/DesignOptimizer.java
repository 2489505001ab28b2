package by.greenmobile.retainingwall.service.optimization;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.CandidateDesign;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.Footing;
import by.greenmobile.retainingwall.entity.InfeasibilityReason;
import by.greenmobile.retainingwall.entity.LoadCase;
import by.greenmobile.retainingwall.entity.SearchState;
import by.greenmobile.retainingwall.entity.StabilityResult;
import by.greenmobile.retainingwall.entity.WallSection;
import by.greenmobile.retainingwall.service.engine.FootingSizer;
import by.greenmobile.retainingwall.service.engine.SectionBuilder;
import by.greenmobile.retainingwall.service.statics.StabilityChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Перебор кандидатов: SEARCHING -> CONVERGED | INFEASIBLE.
 *
 * Пространство поиска одномерное на каждую цель, чтобы результат был воспроизводим
 * и объясним проверяющему инженеру:
 *
 * MinimizeExcavation:
 *   геометрия стенки фиксирована (seed step), толщина фундамента - минимальная по правилу;
 *   перебирается удлинение пяты (heel extension): сначала "галоп" 1, 2, 4, ... дюймов
 *   до первого устойчивого кандидата, затем бисекция между последним неустойчивым и первым
 *   устойчивым. Принимается наименьший устойчивый фундамент.
 *
 * MinimizeFooting:
 *   шаги ширины стенки перебираются от самого широкого допустимого нижнего участка к seed step.
 *   Первый шаг, давший устойчивый фундамент, задаёт потолок footprint; каждый следующий
 *   (более узкий) шаг проверяется сразу на потолке и, если там устойчив, спускается вниз
 *   галопом и бисекцией. Шаг без устойчивого кандидата в пределах потолка отсекается одной
 *   оценкой или вовсе без неё. Seed step входит в перебор всегда, поэтому footprint никогда
 *   не больше, чем у MinimizeExcavation.
 *
 * Каждая оценка кандидата - итерация; лимит wall.search.max-iterations общий на весь прогон.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DesignOptimizer {

    private final SectionBuilder sectionBuilder;
    private final FootingSizer footingSizer;
    private final StabilityChecker stabilityChecker;
    private final WallDesignProperties properties;

    @Value("${wall.search.max-iterations:50}")
    private int maxIterations = 50;

    /** Наименьший геометрически допустимый шаг ширины. */
    @Value("${wall.search.seed-width-step:0}")
    private int seedWidthStep = 0;

    public OptimizationOutcome optimize(DesignInput input, LoadCase lc) {
        switch (input.getOptimizationObjective()) {
            case MINIMIZE_EXCAVATION:
                return minimizeExcavation(input, lc);
            case MINIMIZE_FOOTING:
                return minimizeFooting(input, lc);
            default:
                throw new IllegalStateException("Unhandled objective: " + input.getOptimizationObjective());
        }
    }

    private OptimizationOutcome minimizeExcavation(DesignInput input, LoadCase lc) {
        Budget budget = new Budget(maxIterations);
        Sweep sweep = sweep(input, seedWidthStep, lc, budget).gallopUp();
        if (sweep.state == SearchState.CONVERGED) {
            return OptimizationOutcome.converged(sweep.best, budget.used);
        }
        return OptimizationOutcome.infeasible(sweep.last, sweep.reason, budget.used);
    }

    private OptimizationOutcome minimizeFooting(DesignInput input, LoadCase lc) {
        Budget budget = new Budget(maxIterations);
        Comparator<CandidateDesign> order = input.getOptimizationObjective().preference();

        CandidateDesign best = null;
        StabilityResult last = null;
        InfeasibilityReason reason = InfeasibilityReason.NO_STABLE_CANDIDATE;

        for (int step = widestStep(input); step >= seedWidthStep && !budget.spent(); step--) {
            Sweep sweep = sweep(input, step, lc, budget);
            if (best == null) {
                sweep.fromLimit();
            } else {
                sweep.withinFootprint(best.getFooting().footprint());
            }
            if (sweep.last != null) {
                last = sweep.last;
            }

            if (sweep.state == SearchState.CONVERGED) {
                if (best == null || order.compare(sweep.best, best) <= 0) {
                    best = sweep.best;
                }
            } else if (best == null) {
                reason = sweep.reason;
            }
        }

        if (best != null) {
            return OptimizationOutcome.converged(best, budget.used);
        }
        if (budget.spent()) {
            reason = InfeasibilityReason.ITERATION_LIMIT_REACHED;
        }
        return OptimizationOutcome.infeasible(last, reason, budget.used);
    }

    /** Самый широкий шаг, при котором нижний участок не шире maxSectionWidth (не меньше seed). */
    int widestStep(DesignInput input) {
        int maxSections = properties.getSections().getMaxSections();
        int maxWidth = properties.getSections().getMaxSectionWidth();
        int step = seedWidthStep;
        while (step + 1 < seedWidthStep + maxIterations
                && sectionBuilder.bottomWidth(input.getHeight(), input.getMaterial(), maxSections, step + 1) <= maxWidth) {
            step++;
        }
        return step;
    }

    private Sweep sweep(DesignInput input, int widthStep, LoadCase lc, Budget budget) {
        List<WallSection> sections = sectionBuilder.proposeSections(
                input.getHeight(), input.getMaterial(), properties.getSections().getMaxSections(), widthStep);
        return new Sweep(sections, widthStep, lc, input.getToeLength(),
                input.getOptimizationObjective().preference(), budget);
    }

    /** Счётчик оценок, общий для всех шагов одного прогона. */
    static final class Budget {
        private final int limit;
        int used;

        Budget(int limit) {
            this.limit = limit;
        }

        boolean spent() {
            return used >= limit;
        }
    }

    /**
     * Поиск минимального удлинения пяты для одной геометрии стенки.
     * Удлинение не меняет носок, поэтому footprint = footprint(base) + ext.
     */
    final class Sweep {
        private final List<WallSection> sections;
        private final int widthStep;
        private final LoadCase lc;
        private final int minToe;
        private final Comparator<CandidateDesign> order;
        private final Budget budget;
        private final Footing base;

        SearchState state = SearchState.SEARCHING;
        CandidateDesign best;
        StabilityResult last;
        InfeasibilityReason reason;

        Sweep(List<WallSection> sections, int widthStep, LoadCase lc, int minToe,
              Comparator<CandidateDesign> order, Budget budget) {
            this.sections = sections;
            this.widthStep = widthStep;
            this.lc = lc;
            this.minToe = minToe;
            this.order = order;
            this.budget = budget;
            this.base = footingSizer.sizeFooting(sections, lc, minToe, 0);
        }

        /** Наибольшее удлинение, при котором подошва не шире footing.maxWidth; < 0 - не влезает и без него. */
        int maxExtension() {
            return properties.getFooting().getMaxWidth() - base.baseWidth(sections.get(0).getWidth());
        }

        /** Галоп 1, 2, 4, ... вверх от базового фундамента, затем бисекция. */
        Sweep gallopUp() {
            if (!startAtBase()) return this;
            int maxExtension = maxExtension();

            int lo = 0;
            int rise = 1;
            while (true) {
                if (budget.spent()) return fail(InfeasibilityReason.ITERATION_LIMIT_REACHED);
                int ext = Math.min(rise, maxExtension);
                if (at(ext).isStable()) {
                    return bisect(lo, ext);
                }
                lo = ext;
                if (ext >= maxExtension) return fail(InfeasibilityReason.NO_STABLE_CANDIDATE);
                rise *= 2;
            }
        }

        /** Сразу наибольшее допустимое удлинение: неустойчив там - неустойчив везде. */
        Sweep fromLimit() {
            if (!startAtBase()) return this;
            int limit = maxExtension();

            if (budget.spent()) return fail(InfeasibilityReason.ITERATION_LIMIT_REACHED);
            if (!at(limit).isStable()) return fail(InfeasibilityReason.NO_STABLE_CANDIDATE);
            return bisect(0, limit);
        }

        /**
         * Только кандидаты с footprint не больше cap. Проверка начинается с потолка,
         * затем галоп вниз 1, 2, 4, ... до первого неустойчивого и бисекция.
         */
        Sweep withinFootprint(int cap) {
            int limit = Math.min(cap - base.footprint(), maxExtension());
            if (limit < 0) return fail(InfeasibilityReason.NO_STABLE_CANDIDATE);
            if (budget.spent()) return fail(InfeasibilityReason.ITERATION_LIMIT_REACHED);
            if (!at(limit).isStable()) return fail(InfeasibilityReason.NO_STABLE_CANDIDATE);

            // lo = -1: устойчив весь диапазон до нуля
            int lo = -1;
            int hi = limit;
            int drop = 1;
            while (hi > 0 && !budget.spent()) {
                int ext = Math.max(hi - drop, 0);
                if (!at(ext).isStable()) {
                    lo = ext;
                    break;
                }
                hi = ext;
                drop *= 2;
            }
            return bisect(lo, hi);
        }

        /** Базовый фундамент без удлинения; false - поиск уже завершён. */
        private boolean startAtBase() {
            if (budget.spent()) {
                fail(InfeasibilityReason.ITERATION_LIMIT_REACHED);
                return false;
            }
            CandidateDesign candidate = at(0);
            int maxExtension = maxExtension();
            if (maxExtension < 0) {
                fail(InfeasibilityReason.FOOTING_LIMIT_EXCEEDED);
                return false;
            }
            if (candidate.isStable()) {
                converge();
                return false;
            }
            if (maxExtension == 0) {
                fail(InfeasibilityReason.NO_STABLE_CANDIDATE);
                return false;
            }
            return true;
        }

        /** lo - неустойчив (или -1), hi - устойчив. */
        private Sweep bisect(int lo, int hi) {
            while (hi - lo > 1 && !budget.spent()) {
                int mid = (lo + hi) / 2;
                if (at(mid).isStable()) {
                    hi = mid;
                } else {
                    lo = mid;
                }
            }
            return converge();
        }

        private CandidateDesign at(int extension) {
            Footing footing = extension == 0 ? base : footingSizer.sizeFooting(sections, lc, minToe, extension);
            StabilityResult r = stabilityChecker.evaluate(sections, footing, lc);
            budget.used++;
            last = r;
            CandidateDesign candidate = new CandidateDesign(sections, widthStep, footing, extension, r);
            if (candidate.isStable() && (best == null || order.compare(candidate, best) <= 0)) {
                best = candidate;
            }
            return candidate;
        }

        private Sweep converge() {
            this.state = SearchState.CONVERGED;
            return this;
        }

        private Sweep fail(InfeasibilityReason reason) {
            this.reason = reason;
            this.state = SearchState.INFEASIBLE;
            return this;
        }
    }
}
