package by.greenmobile.retainingwall.controller.dto;

import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.Material;
import by.greenmobile.retainingwall.entity.OptimizationObjective;
import by.greenmobile.retainingwall.entity.SoilStiffness;
import by.greenmobile.retainingwall.entity.Surcharge;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Тело POST /api/designs. Длины в дюймах.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesignRequest {

    private Integer height;
    private Material material;
    private Surcharge surcharge;

    @JsonProperty("optimization_objective")
    private OptimizationObjective optimizationObjective;

    @JsonProperty("soil_stiffness")
    private SoilStiffness soilStiffness;

    @JsonProperty("topping_depth")
    private Integer toppingDepth;

    @JsonProperty("has_adjacent_slab")
    private Boolean hasAdjacentSlab;

    @JsonProperty("toe_length")
    private Integer toeLength;

    /** Пустой список - запрос можно отдавать движку. */
    public List<String> violations() {
        List<String> out = new ArrayList<>();
        if (height == null) out.add("height is required");
        if (toppingDepth == null) out.add("topping_depth is required");
        if (toeLength == null) out.add("toe_length is required");
        if (!out.isEmpty()) return out;
        return toDesignInput().violations();
    }

    public DesignInput toDesignInput() {
        return DesignInput.builder()
                .height(height)
                .material(material)
                .surcharge(surcharge)
                .optimizationObjective(optimizationObjective)
                .soilStiffness(soilStiffness)
                .toppingDepth(toppingDepth)
                .adjacentSlab(Boolean.TRUE.equals(hasAdjacentSlab))
                .toeLength(toeLength)
                .build();
    }
}
