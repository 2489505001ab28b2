package by.greenmobile.retainingwall.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Итоговая спецификация стенки. Создаётся один раз на успешный расчёт и дальше не меняется.
 */
@Value
@Builder
public class WallSpecification {
    int totalHeight;
    /** Участки снизу вверх; порядок значим. */
    List<WallSection> sections;
    Footing footing;
    Material material;
    StabilityResult stabilityResult;
}
