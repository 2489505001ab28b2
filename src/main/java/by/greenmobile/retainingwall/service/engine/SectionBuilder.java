package by.greenmobile.retainingwall.service.engine;

import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.Material;
import by.greenmobile.retainingwall.entity.WallSection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Строит ОДНОГО кандидата сечения стенки по явным параметрам. Сам ничего не перебирает.
 *
 * - число участков: ceil(H / maxSectionHeight), но в пределах [1, maxSections];
 * - высоты: H / n, остаток по дюйму снизу вверх; сумма ровно H;
 * - ширины: участок i (0 = нижний) = minWidth + (n - i) * step * module,
 *   т.е. снизу толще, step = 0 даёт стенку постоянной минимальной ширины.
 */
@Component
@RequiredArgsConstructor
public class SectionBuilder {

    private final WallDesignProperties properties;

    public List<WallSection> proposeSections(int totalHeight, Material material, int maxSections) {
        return proposeSections(totalHeight, material, maxSections, 0);
    }

    public List<WallSection> proposeSections(int totalHeight, Material material, int maxSections, int widthStep) {
        if (totalHeight <= 0) throw new IllegalArgumentException("totalHeight must be positive: " + totalHeight);
        if (maxSections < 1) throw new IllegalArgumentException("maxSections must be >= 1: " + maxSections);
        if (widthStep < 0) throw new IllegalArgumentException("widthStep must be >= 0: " + widthStep);

        WallDesignProperties.MaterialPreset preset = properties.material(material);
        int n = sectionCount(totalHeight, maxSections);

        int base = totalHeight / n;
        int remainder = totalHeight % n;

        List<WallSection> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int h = base + (i < remainder ? 1 : 0);
            int w = preset.getMinWidth() + (n - i) * widthStep * preset.getWidthModule();
            out.add(new WallSection(h, w));
        }

        verify(out, totalHeight);
        return List.copyOf(out);
    }

    public int sectionCount(int totalHeight, int maxSections) {
        int byHeight = (int) Math.ceil(totalHeight / (double) properties.getSections().getMaxSectionHeight());
        return Math.max(1, Math.min(maxSections, byHeight));
    }

    /** Ширина нижнего участка для шага step, дюймы. */
    public int bottomWidth(int totalHeight, Material material, int maxSections, int widthStep) {
        WallDesignProperties.MaterialPreset preset = properties.material(material);
        return preset.getMinWidth() + sectionCount(totalHeight, maxSections) * widthStep * preset.getWidthModule();
    }

    /**
     * Инвариант: высоты > 0 и в сумме ровно totalHeight, ширины > 0 и не растут снизу вверх.
     * Нарушение - дефект кода, а не ошибка пользователя.
     */
    static void verify(List<WallSection> sections, int totalHeight) {
        int sum = 0;
        int previousWidth = Integer.MAX_VALUE;
        for (WallSection s : sections) {
            if (s.getHeightAboveFooting() <= 0 || s.getWidth() <= 0) {
                throw new IllegalStateException("Non-positive wall section: " + s);
            }
            if (s.getWidth() > previousWidth) {
                throw new IllegalStateException("Section widths must not grow upward: " + sections);
            }
            previousWidth = s.getWidth();
            sum += s.getHeightAboveFooting();
        }
        if (sum != totalHeight) {
            throw new IllegalStateException("Section heights sum to " + sum + ", expected " + totalHeight);
        }
    }
}
