package by.greenmobile.retainingwall.service;

import by.greenmobile.retainingwall.entity.CandidateDesign;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.WallSpecification;
import by.greenmobile.retainingwall.service.statics.WallStatics;
import org.springframework.stereotype.Component;

/**
 * Сборка итоговой спецификации из победившего кандидата. Никаких расчётов.
 */
@Component
public class SpecificationBuilder {

    public WallSpecification build(DesignInput input, CandidateDesign winner) {
        if (winner == null || !winner.isStable()) {
            throw new IllegalStateException("Cannot build a specification from an unconverged candidate: " + winner);
        }
        int height = WallStatics.wallHeight(winner.getSections());
        if (height != input.getHeight()) {
            throw new IllegalStateException("Candidate height " + height + " != requested height " + input.getHeight());
        }

        return WallSpecification.builder()
                .totalHeight(input.getHeight())
                .sections(winner.getSections())
                .footing(winner.getFooting())
                .material(input.getMaterial())
                .stabilityResult(winner.getStability())
                .build();
    }
}
