package by.greenmobile.retainingwall.service.statics;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.Footing;
import by.greenmobile.retainingwall.entity.LoadCase;
import by.greenmobile.retainingwall.entity.StabilityCheck;
import by.greenmobile.retainingwall.entity.StabilityResult;
import by.greenmobile.retainingwall.entity.WallSection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static by.greenmobile.retainingwall.service.statics.Units.feet;

/**
 * Проверка кандидата (сечение + фундамент) на опрокидывание, сдвиг и давление на грунт.
 *
 * - опрокидывание: Mr / Mo относительно кромки носка;
 * - сдвиг: (mu * V [+ пассивный отпор]) / (Pa + Pq);
 * - грунт: q_allow / q_max, трапециевидная эпюра при |e| <= B/6, иначе треугольная
 *   на части подошвы (отрыв); равнодействующая за пределами подошвы - коэффициент 0.
 *
 * Бетон фундамента сверх минимальной толщины в удерживающих силах (опрокидывание, сдвиг)
 * не учитывается, в давлении на грунт - учитывается полностью.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StabilityChecker {

    private final WallDesignProperties properties;
    private final WallStatics statics;

    public StabilityResult evaluate(List<WallSection> sections, Footing footing, LoadCase lc) {
        WallStatics.StaticsTally s = statics.tally(sections, footing, lc);
        WallDesignProperties.Safety safety = properties.getSafety();

        double uncredited = uncreditedFootingWeight(s, lc);
        double overturning = (s.getResistingMoment() - uncredited * s.getBaseWidth() / 2.0) / s.getOverturningMoment();

        double resisting = lc.getBaseFrictionCoefficient() * (s.getVerticalLoad() - uncredited);
        if (properties.isPassiveResistanceEnabled()) {
            double depth = lc.getToppingDepth() + s.getThickness();
            resisting += 0.5 * lc.getPassiveEarthPressureCoefficient() * lc.getEffectiveSoilUnitWeight() * depth * depth;
        }
        double sliding = resisting / s.getHorizontalLoad();

        double qMax = maxBearingPressure(s);
        double bearing = Double.isInfinite(qMax) ? 0.0 : lc.getAllowableBearingPressure() / qMax;

        List<StabilityCheck> failed = new ArrayList<>(3);
        if (overturning < safety.getMinOverturning()) failed.add(StabilityCheck.OVERTURNING);
        if (sliding < safety.getMinSliding()) failed.add(StabilityCheck.SLIDING);
        if (bearing < safety.getMinBearing()) failed.add(StabilityCheck.BEARING);

        StabilityResult result = new StabilityResult(overturning, sliding, bearing, failed);
        if (log.isDebugEnabled()) {
            log.debug("CHECK: footing={} V={} Mr={} Mo={} Wx={} e={} qMax={} => OT={} SL={} BR={} failed={}",
                    footing, s.getVerticalLoad(), s.getResistingMoment(), s.getOverturningMoment(), uncredited,
                    s.eccentricity(), qMax, overturning, sliding, bearing, failed);
        }
        return result;
    }

    /** Вес бетона фундамента сверх minThickness, lb/ft; центр тяжести - середина подошвы. */
    double uncreditedFootingWeight(WallStatics.StaticsTally s, LoadCase lc) {
        double excess = s.getThickness() - feet(properties.getFooting().getMinThickness());
        return excess > 0 ? lc.getFootingUnitWeight() * s.getBaseWidth() * excess : 0.0;
    }

    /** Максимальное давление под подошвой, psf; бесконечность, если равнодействующая вне подошвы. */
    static double maxBearingPressure(WallStatics.StaticsTally s) {
        double b = s.getBaseWidth();
        double v = s.getVerticalLoad();
        double x = s.resultantFromToe();
        if (x <= 0 || x >= b) {
            return Double.POSITIVE_INFINITY;
        }
        double e = b / 2.0 - x;
        if (Math.abs(e) <= b / 6.0) {
            return v / b * (1.0 + 6.0 * Math.abs(e) / b);
        }
        double toNearEdge = e > 0 ? x : b - x;
        return 2.0 * v / (3.0 * toNearEdge);
    }
}
