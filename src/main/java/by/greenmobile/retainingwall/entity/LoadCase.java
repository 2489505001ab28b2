package by.greenmobile.retainingwall.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Нагрузки для одного DesignInput. Считается один раз и переиспользуется всеми кандидатами.
 *
 * Единицы: удельные веса pcf, давления psf, длины ft.
 */
@Value
@Builder
public class LoadCase {

    /** Ka (Rankine, с учётом уклона). */
    double activeEarthPressureCoefficient;

    /** Kp для упора грунта перед носком (используется только если включено). */
    double passiveEarthPressureCoefficient;

    /** Эквивалентная равномерная пригрузка от откоса и соседней плиты, psf. */
    double surchargeLoad;

    /** Удельный вес грунта, pcf. */
    double effectiveSoilUnitWeight;

    /** Слой грунта над носком, ft. */
    double toppingDepth;

    /** Коэффициент трения подошвы по грунту. */
    double baseFrictionCoefficient;

    /** Допустимое давление на грунт, psf. */
    double allowableBearingPressure;

    /** Удельный вес материала стенки, pcf. */
    double stemUnitWeight;

    /** Удельный вес бетона фундамента, pcf. */
    double footingUnitWeight;

    /** Пригрузка от слоя грунта над носком, psf. */
    public double toppingOverburden() {
        return effectiveSoilUnitWeight * toppingDepth;
    }
}
