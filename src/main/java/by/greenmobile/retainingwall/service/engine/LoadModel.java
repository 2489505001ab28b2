package by.greenmobile.retainingwall.service.engine;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.LoadCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static by.greenmobile.retainingwall.service.statics.Units.feet;

/**
 * Нагрузки на стенку: Ka/Kp по Ренкину, пригрузка от откоса и соседней плиты.
 * Чистая функция: одинаковый вход -> одинаковый LoadCase.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoadModel {

    private final WallDesignProperties properties;

    public LoadCase deriveLoadCase(DesignInput input) {
        WallDesignProperties.SoilPreset soil = properties.soil(input.getSoilStiffness());
        WallDesignProperties.MaterialPreset material = properties.material(input.getMaterial());

        double phi = Math.toRadians(soil.getFrictionAngleDeg());
        double beta = input.getSurcharge().angleRadians();

        double ka = activeCoefficient(beta, phi);
        double kp = passiveCoefficient(phi);

        double surcharge = slopeSurcharge(input, soil.getUnitWeight());
        if (input.isAdjacentSlab()) {
            surcharge += properties.getSurcharge().getAdjacentSlabLoad();
        }

        LoadCase lc = LoadCase.builder()
                .activeEarthPressureCoefficient(ka)
                .passiveEarthPressureCoefficient(kp)
                .surchargeLoad(surcharge)
                .effectiveSoilUnitWeight(soil.getUnitWeight())
                .toppingDepth(feet(input.getToppingDepth()))
                .baseFrictionCoefficient(soil.getBaseFrictionCoefficient())
                .allowableBearingPressure(soil.getAllowableBearingPressure())
                .stemUnitWeight(material.getUnitWeight())
                .footingUnitWeight(properties.getFooting().getUnitWeight())
                .build();

        log.debug("LOADS: soil={} slope={} slab={} => Ka={} Kp={} q={}psf",
                input.getSoilStiffness(), input.getSurcharge(), input.isAdjacentSlab(), ka, kp, surcharge);
        return lc;
    }

    /**
     * Rankine для наклонной засыпки:
     * Ka = cos b * (cos b - sqrt(cos^2 b - cos^2 phi)) / (cos b + sqrt(cos^2 b - cos^2 phi)).
     * Откос круче угла трения считается по b = phi (предельное Ka = cos phi).
     */
    static double activeCoefficient(double beta, double phi) {
        double b = Math.min(beta, phi);
        double cb = Math.cos(b);
        double cp = Math.cos(phi);
        double root = Math.sqrt(Math.max(0.0, cb * cb - cp * cp));
        return cb * (cb - root) / (cb + root);
    }

    static double passiveCoefficient(double phi) {
        double t = Math.tan(Math.PI / 4.0 + phi / 2.0);
        return t * t;
    }

    /**
     * Эквивалентная равномерная пригрузка от откоса: средняя высота клина грунта
     * над зоной slopeRunRatio * H за стенкой, psf.
     */
    private double slopeSurcharge(DesignInput input, double unitWeight) {
        double run = properties.getSurcharge().getSlopeRunRatio() * feet(input.getHeight());
        double rise = run * input.getSurcharge().getRiseOverRun();
        return unitWeight * rise / 2.0;
    }
}
