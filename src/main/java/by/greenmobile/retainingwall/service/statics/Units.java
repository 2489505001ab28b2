package by.greenmobile.retainingwall.service.statics;

/**
 * Дюймы на границе движка, футы внутри статики.
 */
public final class Units {

    public static final double INCHES_PER_FOOT = 12.0;

    /** Допуск при округлении вверх, чтобы 14.0000000001 не превращалось в 15. */
    private static final double CEIL_EPS = 1e-9;

    private Units() {
    }

    public static double feet(int inches) {
        return inches / INCHES_PER_FOOT;
    }

    /** Длина в футах -> целые дюймы с округлением вверх. */
    public static int ceilInches(double feet) {
        return (int) Math.ceil(feet * INCHES_PER_FOOT - CEIL_EPS);
    }
}
