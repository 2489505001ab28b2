package by.greenmobile.retainingwall.service.engine;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.Footing;
import by.greenmobile.retainingwall.entity.LoadCase;
import by.greenmobile.retainingwall.entity.WallSection;
import by.greenmobile.retainingwall.service.statics.WallStatics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

import static by.greenmobile.retainingwall.service.statics.Units.ceilInches;
import static by.greenmobile.retainingwall.service.statics.Units.feet;

/**
 * Подбор фундамента в замкнутой форме (без перебора), один Footing на вызов.
 *
 * 1) толщина: max(minThickness, ceil(cover + k * H));
 * 2) пята: минимальная длина L, при которой равнодействующая в средней трети подошвы:
 *    3(Mr - Mo) - B*V >= 0 - квадратное уравнение по L; вес фундамента берётся
 *    по минимальной толщине, как в проверке устойчивости, поэтому пята не короче,
 *    чем у более низкой стенки;
 * 3) носок: если давление под носком выше допустимого, носок удлиняется на минимальное d,
 *    при котором (4B'V' - 6N') <= q_allow * B'^2 - тоже квадратное уравнение;
 * 4) heelExtension (от оптимизатора) добавляется к пяте после подбора.
 *
 * Внутри всё в футах и фунтах на фут длины, наружу - целые дюймы (округление вверх).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FootingSizer {

    private final WallDesignProperties properties;
    private final WallStatics statics;

    public Footing sizeFooting(List<WallSection> sections, LoadCase lc, int minToe) {
        return sizeFooting(sections, lc, minToe, 0);
    }

    public Footing sizeFooting(List<WallSection> sections, LoadCase lc, int minToe, int heelExtension) {
        if (heelExtension < 0) throw new IllegalArgumentException("heelExtension must be >= 0: " + heelExtension);

        WallDesignProperties.FootingRules rules = properties.getFooting();
        int thickness = thicknessFor(WallStatics.wallHeight(sections));

        int toe = Math.max(minToe, rules.getMinimumToe());

        double heelFt = middleThirdHeel(sections, lc, toe, thickness);
        int heel = Math.max(rules.getMinimumHeel(), ceilInches(heelFt));

        toe = growToeForBearing(sections, lc, toe, heel, thickness);

        Footing f = new Footing(toe, heel + heelExtension, thickness);
        if (log.isDebugEnabled()) {
            log.debug("FOOTING: H={} minToe={} ext={} heelFt={} => {}",
                    WallStatics.wallHeight(sections), minToe, heelExtension, heelFt, f);
        }
        return f;
    }

    /** Толщина фундамента по правилу минимального защитного слоя, дюймы. */
    public int thicknessFor(int wallHeight) {
        WallDesignProperties.FootingRules rules = properties.getFooting();
        int byHeight = (int) Math.ceil(rules.getCover() + rules.getThicknessPerHeight() * wallHeight - 1e-9);
        return Math.max(rules.getMinThickness(), byHeight);
    }

    /**
     * f(L) = A L^2 + Bc L + C >= 0, где L - длина пяты (ft), a = toe + w1:
     * A  = (gs*H + gc*tw) / 2
     * Bc = -V0 + 2a*gs*H + gc*tw*a
     * C  = 3*M0 - 3*Mo - a*V0 + gc*tw*a^2 / 2
     * V0/M0 - стенка, уступы и грунт над носком; tw - минимальная толщина фундамента,
     * Mo - на полную высоту H + t. A > 0, поэтому при C < 0 ответ - больший корень.
     */
    double middleThirdHeel(List<WallSection> sections, LoadCase lc, int toe, int thickness) {
        double toeFt = feet(toe);
        double t = feet(thickness);
        double h = feet(WallStatics.wallHeight(sections));
        double a = toeFt + feet(sections.get(0).getWidth());
        double gs = lc.getEffectiveSoilUnitWeight();
        double gc = lc.getFootingUnitWeight();
        double tw = Math.min(t, feet(properties.getFooting().getMinThickness()));

        WallStatics.LoadMoment stem = statics.stemGroup(sections, toeFt, lc);
        double v0 = stem.getVertical();
        double m0 = stem.getMoment();
        double mo = statics.overturningMoment(h + t, lc);

        double qa = 0.5 * gs * h + 0.5 * gc * tw;
        double qb = -v0 + 2.0 * a * gs * h + gc * tw * a;
        double qc = 3.0 * m0 - 3.0 * mo - a * v0 + 0.5 * gc * tw * a * a;

        if (qc >= 0) return 0.0;
        double disc = qb * qb - 4.0 * qa * qc;
        return (-qb + Math.sqrt(disc)) / (2.0 * qa);
    }

    /**
     * Удлинение носка на d (ft): B' = B + d, V' = V + k d, N' = N + V d + k d^2 / 2,
     * k = gc*t + gs*topping. Условие по давлению под носком:
     * (k - q) d^2 + (4(Bk + V) - 6V - 2qB) d + (4BV - 6N - qB^2) <= 0.
     */
    int growToeForBearing(List<WallSection> sections, LoadCase lc, int toe, int heel, int thickness) {
        WallStatics.StaticsTally s = statics.tally(sections, new Footing(toe, heel, thickness), lc);
        double allow = lc.getAllowableBearingPressure();
        double b = s.getBaseWidth();
        double v = s.getVerticalLoad();
        double e = s.eccentricity();
        double toePressure = v / b * (1.0 + 6.0 * e / b);

        if (e <= b / 6.0 && toePressure <= allow) {
            return toe;
        }

        double k = lc.getFootingUnitWeight() * s.getThickness() + lc.toppingOverburden();
        double n = s.getResistingMoment() - s.getOverturningMoment();

        double a2 = k - allow;
        double a1 = 4.0 * (b * k + v) - 6.0 * v - 2.0 * allow * b;
        double a0 = 4.0 * b * v - 6.0 * n - allow * b * b;

        double d = smallestNonNegativeRoot(a2, a1, a0);
        if (Double.isNaN(d)) {
            return toe;
        }
        return toe + ceilInches(d);
    }

    /** Наименьший корень >= 0 либо NaN, если его нет. */
    static double smallestNonNegativeRoot(double a, double b, double c) {
        if (a == 0.0) {
            if (b == 0.0) return Double.NaN;
            double r = -c / b;
            return r >= 0 ? r : Double.NaN;
        }
        double disc = b * b - 4.0 * a * c;
        if (disc < 0) return Double.NaN;
        double sq = Math.sqrt(disc);
        double r1 = (-b + sq) / (2.0 * a);
        double r2 = (-b - sq) / (2.0 * a);
        double lo = Math.min(r1, r2);
        double hi = Math.max(r1, r2);
        if (lo >= 0) return lo;
        if (hi >= 0) return hi;
        return Double.NaN;
    }
}
