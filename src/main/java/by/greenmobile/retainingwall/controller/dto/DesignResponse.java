package by.greenmobile.retainingwall.controller.dto;

import by.greenmobile.retainingwall.entity.DesignResult;
import by.greenmobile.retainingwall.entity.Footing;
import by.greenmobile.retainingwall.entity.SearchState;
import by.greenmobile.retainingwall.entity.StabilityCheck;
import by.greenmobile.retainingwall.entity.StabilityResult;
import by.greenmobile.retainingwall.entity.WallSpecification;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ответ на заявку: wall_specifications при успехе либо diagnosis при недостижимости.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DesignResponse {

    @JsonProperty("request_id")
    String requestId;

    SearchState status;

    @JsonProperty("wall_specifications")
    WallSpecificationView wallSpecifications;

    Diagnosis diagnosis;

    int evaluations;

    @JsonIgnore
    public boolean isFeasible() {
        return status == SearchState.CONVERGED;
    }

    public static DesignResponse from(String requestId, DesignResult result) {
        DesignResponseBuilder b = DesignResponse.builder()
                .requestId(requestId)
                .evaluations(result.getEvaluations());
        if (result.isFeasible()) {
            return b.status(SearchState.CONVERGED)
                    .wallSpecifications(WallSpecificationView.of(result.getSpecification()))
                    .build();
        }
        return b.status(SearchState.INFEASIBLE)
                .diagnosis(Diagnosis.of(result))
                .build();
    }

    @Value
    public static class WallSpecificationView {
        @JsonProperty("total_height")
        int totalHeight;
        String material;
        List<SectionView> sections;
        FootingView footing;
        FactorsView factors;

        static WallSpecificationView of(WallSpecification spec) {
            List<SectionView> sections = spec.getSections().stream()
                    .map(s -> new SectionView(s.getHeightAboveFooting(), s.getWidth()))
                    .collect(Collectors.toList());
            Footing f = spec.getFooting();
            return new WallSpecificationView(
                    spec.getTotalHeight(),
                    spec.getMaterial().getLabel(),
                    sections,
                    new FootingView(f.getHeel(), f.getToe(), f.getThickness()),
                    FactorsView.of(spec.getStabilityResult()));
        }
    }

    @Value
    public static class SectionView {
        int height;
        int width;
    }

    @Value
    public static class FootingView {
        int heel;
        int toe;
        int thickness;
    }

    @Value
    public static class FactorsView {
        double overturning;
        double sliding;
        double bearing;

        static FactorsView of(StabilityResult r) {
            return r == null ? null : new FactorsView(r.getOverturningFactor(), r.getSlidingFactor(), r.getBearingFactor());
        }
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Diagnosis {
        String message;
        String reason;
        @JsonProperty("failed_checks")
        List<StabilityCheck> failedChecks;
        FactorsView factors;

        static Diagnosis of(DesignResult result) {
            return new Diagnosis(
                    result.getRecommendation(),
                    result.getReason() != null ? result.getReason().name() : null,
                    result.failedChecks(),
                    FactorsView.of(result.getLastStabilityResult()));
        }
    }
}
