package by.greenmobile.retainingwall.entity;

import lombok.Value;

/**
 * Фундамент стенки, дюймы.
 * toe - носок (со стороны выемки), heel - пята (под удерживаемым грунтом).
 */
@Value
public class Footing {
    int toe;
    int heel;
    int thickness;

    /** Footprint без ширины стенки: toe + heel. */
    public int footprint() {
        return toe + heel;
    }

    /** Полная ширина подошвы при заданной ширине нижнего участка стенки. */
    public int baseWidth(int stemBaseWidth) {
        return toe + stemBaseWidth + heel;
    }
}
