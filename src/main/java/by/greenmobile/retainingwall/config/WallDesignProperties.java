package by.greenmobile.retainingwall.config;

import by.greenmobile.retainingwall.entity.Material;
import by.greenmobile.retainingwall.entity.SoilStiffness;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Инженерные константы расчёта. Все значения - настраиваемые умолчания, а не нормы:
 * требования конкретной юрисдикции задаются через application.yml (prefix "wall.design").
 *
 * Единицы: удельные веса pcf, давления psf, длины дюймы (кроме явно указанных).
 */
@Data
@ConfigurationProperties(prefix = "wall.design")
public class WallDesignProperties {

    private SoilPreset stiff = new SoilPreset(120.0, 34.0, 0.45, 3000.0);
    private SoilPreset soft = new SoilPreset(110.0, 28.0, 0.35, 2000.0);

    private MaterialPreset concrete = new MaterialPreset(150.0, 8, 1);
    /** Grouted CMU, номинальные размеры блоков. */
    private MaterialPreset cmu = new MaterialPreset(130.0, 8, 2);

    private Safety safety = new Safety();
    private SurchargeRules surcharge = new SurchargeRules();
    private FootingRules footing = new FootingRules();
    private SectionRules sections = new SectionRules();

    /** Учитывать пассивный отпор грунта перед носком при проверке сдвига. */
    private boolean passiveResistanceEnabled = false;

    public SoilPreset soil(SoilStiffness stiffness) {
        switch (stiffness) {
            case STIFF:
                return stiff;
            case SOFT:
                return soft;
            default:
                throw new IllegalStateException("Unhandled soil stiffness: " + stiffness);
        }
    }

    public MaterialPreset material(Material material) {
        switch (material) {
            case CONCRETE:
                return concrete;
            case CMU:
                return cmu;
            default:
                throw new IllegalStateException("Unhandled material: " + material);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SoilPreset {
        private double unitWeight;
        private double frictionAngleDeg;
        private double baseFrictionCoefficient;
        private double allowableBearingPressure;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MaterialPreset {
        private double unitWeight;
        /** Минимальная (верхняя) ширина участка, дюймы. */
        private int minWidth;
        /** Шаг изменения ширины, дюймы. */
        private int widthModule;
    }

    @Data
    public static class Safety {
        private double minOverturning = 1.5;
        private double minSliding = 1.5;
        private double minBearing = 1.0;
    }

    @Data
    public static class SurchargeRules {
        /** Горизонтальная зона откоса за стенкой в долях высоты стенки. */
        private double slopeRunRatio = 0.5;
        /** Пригрузка от соседней плиты, psf. */
        private double adjacentSlabLoad = 100.0;
    }

    @Data
    public static class FootingRules {
        private double unitWeight = 150.0;
        private int minThickness = 8;
        private int cover = 3;
        /** Прирост толщины на дюйм высоты стенки. */
        private double thicknessPerHeight = 0.08;
        private int minimumToe = 6;
        private int minimumHeel = 6;
        /** Практический максимум полной ширины подошвы, дюймы. */
        private int maxWidth = 216;
    }

    @Data
    public static class SectionRules {
        private int maxSections = 3;
        private int maxSectionHeight = 48;
        /** Практический максимум ширины нижнего участка, дюймы. */
        private int maxSectionWidth = 24;
    }
}
