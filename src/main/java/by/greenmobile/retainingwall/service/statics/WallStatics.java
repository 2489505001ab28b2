package by.greenmobile.retainingwall.service.statics;

import by.greenmobile.retainingwall.entity.Footing;
import by.greenmobile.retainingwall.entity.LoadCase;
import by.greenmobile.retainingwall.entity.WallSection;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;

import static by.greenmobile.retainingwall.service.statics.Units.feet;

/**
 * Вертикальные силы и моменты относительно кромки носка, на 1 фут длины стенки.
 *
 * Геометрия (ось x от кромки носка к пяте):
 * - лицевая грань стенки вертикальна и стоит на x = toe;
 * - уступы участков - со стороны грунта, засыпаны грунтом;
 * - пята начинается за нижним (самым широким) участком;
 * - над носком лежит слой грунта толщиной toppingDepth.
 *
 * Активное давление действует на вертикальную плоскость через конец пяты,
 * высота Hd = высота стенки + толщина фундамента.
 */
@Component
public class WallStatics {

    /**
     * Стенка + грунт на уступах + грунт над носком. Без пяты и без фундамента:
     * эти части зависят от размеров подошвы и считаются отдельно.
     */
    public LoadMoment stemGroup(List<WallSection> sections, double toeFt, LoadCase lc) {
        double w1 = feet(sections.get(0).getWidth());
        double v = 0;
        double m = 0;

        for (WallSection s : sections) {
            double w = feet(s.getWidth());
            double h = feet(s.getHeightAboveFooting());

            double stem = lc.getStemUnitWeight() * w * h;
            v += stem;
            m += stem * (toeFt + w / 2.0);

            if (w < w1) {
                double step = lc.getEffectiveSoilUnitWeight() * (w1 - w) * h;
                v += step;
                m += step * (toeFt + w + (w1 - w) / 2.0);
            }
        }

        double topping = lc.toppingOverburden() * toeFt;
        v += topping;
        m += topping * toeFt / 2.0;

        return new LoadMoment(v, m);
    }

    /** Горизонтальная равнодействующая: треугольная эпюра грунта + равномерная от пригрузки, lb/ft. */
    public double drivingForce(double hdFt, LoadCase lc) {
        double ka = lc.getActiveEarthPressureCoefficient();
        return 0.5 * ka * lc.getEffectiveSoilUnitWeight() * hdFt * hdFt
                + ka * lc.getSurchargeLoad() * hdFt;
    }

    /** Опрокидывающий момент относительно подошвы, ft-lb/ft. */
    public double overturningMoment(double hdFt, LoadCase lc) {
        double ka = lc.getActiveEarthPressureCoefficient();
        double pa = 0.5 * ka * lc.getEffectiveSoilUnitWeight() * hdFt * hdFt;
        double pq = ka * lc.getSurchargeLoad() * hdFt;
        return pa * hdFt / 3.0 + pq * hdFt / 2.0;
    }

    public StaticsTally tally(List<WallSection> sections, Footing footing, LoadCase lc) {
        double toe = feet(footing.getToe());
        double heel = feet(footing.getHeel());
        double t = feet(footing.getThickness());
        double w1 = feet(sections.get(0).getWidth());
        double height = feet(wallHeight(sections));
        double b = toe + w1 + heel;

        LoadMoment stem = stemGroup(sections, toe, lc);
        double v = stem.getVertical();
        double m = stem.getMoment();

        double heelSoil = lc.getEffectiveSoilUnitWeight() * heel * height;
        v += heelSoil;
        m += heelSoil * (toe + w1 + heel / 2.0);

        double slab = lc.getFootingUnitWeight() * b * t;
        v += slab;
        m += slab * b / 2.0;

        double hd = height + t;
        return new StaticsTally(v, m, overturningMoment(hd, lc), drivingForce(hd, lc), b, t);
    }

    public static int wallHeight(List<WallSection> sections) {
        int sum = 0;
        for (WallSection s : sections) sum += s.getHeightAboveFooting();
        return sum;
    }

    @Value
    public static class LoadMoment {
        /** lb/ft */
        double vertical;
        /** ft-lb/ft относительно кромки носка */
        double moment;
    }

    @Value
    public static class StaticsTally {
        double verticalLoad;
        double resistingMoment;
        double overturningMoment;
        double horizontalLoad;
        /** Ширина подошвы, ft. */
        double baseWidth;
        /** Толщина фундамента, ft. */
        double thickness;

        /** Расстояние равнодействующей от кромки носка, ft. */
        public double resultantFromToe() {
            return (resistingMoment - overturningMoment) / verticalLoad;
        }

        /** Эксцентриситет (положительный - к носку), ft. */
        public double eccentricity() {
            return baseWidth / 2.0 - resultantFromToe();
        }
    }
}
