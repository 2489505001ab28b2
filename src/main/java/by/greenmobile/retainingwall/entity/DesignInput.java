package by.greenmobile.retainingwall.entity;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Входные параметры одного расчёта стенки.
 *
 * Единицы: все длины в дюймах (целые).
 * - height: высота стенки над фундаментом, 24..144
 * - toppingDepth: слой грунта над фундаментом со стороны носка, 0..24
 * - toeLength: НИЖНЯЯ граница длины носка, 0..120 (не фиксированное значение)
 *
 * Проверку диапазонов делает слой API до вызова движка; движок повторно проверяет
 * контракт и падает (IllegalArgumentException), если сюда пришёл мусор.
 */
@Value
@Builder(toBuilder = true)
public class DesignInput {

    public static final int MIN_HEIGHT = 24;
    public static final int MAX_HEIGHT = 144;
    public static final int MAX_TOPPING_DEPTH = 24;
    public static final int MAX_TOE_LENGTH = 120;

    int height;
    Material material;
    Surcharge surcharge;
    OptimizationObjective optimizationObjective;
    SoilStiffness soilStiffness;
    int toppingDepth;
    boolean adjacentSlab;
    int toeLength;

    public boolean hasValidInput() {
        return violations().isEmpty();
    }

    /** Список нарушений контракта (пустой, если вход корректен). */
    public List<String> violations() {
        List<String> out = new ArrayList<>();
        if (height < MIN_HEIGHT || height > MAX_HEIGHT) {
            out.add("height must be within " + MIN_HEIGHT + ".." + MAX_HEIGHT + " inches, got " + height);
        }
        if (toppingDepth < 0 || toppingDepth > MAX_TOPPING_DEPTH) {
            out.add("topping_depth must be within 0.." + MAX_TOPPING_DEPTH + " inches, got " + toppingDepth);
        }
        if (toeLength < 0 || toeLength > MAX_TOE_LENGTH) {
            out.add("toe_length must be within 0.." + MAX_TOE_LENGTH + " inches, got " + toeLength);
        }
        if (material == null) out.add("material is required");
        if (surcharge == null) out.add("surcharge is required");
        if (optimizationObjective == null) out.add("optimization_objective is required");
        if (soilStiffness == null) out.add("soil_stiffness is required");
        return out;
    }

    /**
     * Контрактная проверка на входе в движок.
     */
    public DesignInput requireValid() {
        List<String> v = violations();
        if (!v.isEmpty()) {
            throw new IllegalArgumentException("DesignInput violates engine contract: " + String.join("; ", v));
        }
        return this;
    }
}
