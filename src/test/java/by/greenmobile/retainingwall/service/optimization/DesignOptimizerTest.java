package by.greenmobile.retainingwall.service.optimization;

import by.greenmobile.retainingwall.WallEngineFixture;
import by.greenmobile.retainingwall.config.WallDesignProperties;
import by.greenmobile.retainingwall.entity.CandidateDesign;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.Footing;
import by.greenmobile.retainingwall.entity.InfeasibilityReason;
import by.greenmobile.retainingwall.entity.Material;
import by.greenmobile.retainingwall.entity.OptimizationObjective;
import by.greenmobile.retainingwall.entity.SearchState;
import by.greenmobile.retainingwall.entity.SoilStiffness;
import by.greenmobile.retainingwall.entity.StabilityCheck;
import by.greenmobile.retainingwall.entity.Surcharge;
import by.greenmobile.retainingwall.entity.WallSection;
import by.greenmobile.retainingwall.service.engine.SectionBuilder;
import by.greenmobile.retainingwall.service.statics.WallStatics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DesignOptimizerTest {

    private static final int[] TOE_BOUNDS = {0, 12, 60, 120};

    private WallEngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new WallEngineFixture();
    }

    private OptimizationOutcome optimize(DesignInput input) {
        return engine.optimizer.optimize(input, engine.loadModel.deriveLoadCase(input));
    }

    @Nested
    @DisplayName("MinimizeExcavation")
    class MinimizeExcavation {

        @Test
        @DisplayName("48 in wall converges on the smallest stable heel")
        void scenarioA() {
            OptimizationOutcome out = optimize(WallEngineFixture.scenarioA().build());

            assertThat(out.getState()).isEqualTo(SearchState.CONVERGED);
            CandidateDesign w = out.getWinner();
            assertThat(w.getSections()).containsExactly(new WallSection(48, 8));
            assertThat(w.getFooting()).isEqualTo(new Footing(12, 12, 8));
            assertThat(w.isStable()).isTrue();
            assertThat(out.getEvaluations()).isEqualTo(7);
        }

        @Test
        @DisplayName("one less inch of heel is unstable")
        void heelIsMinimal() {
            DesignInput input = WallEngineFixture.scenarioA().build();
            OptimizationOutcome out = optimize(input);
            Footing f = out.getWinner().getFooting();

            Footing shorter = new Footing(f.getToe(), f.getHeel() - 1, f.getThickness());
            assertThat(engine.stabilityChecker.evaluate(out.getWinner().getSections(), shorter,
                    engine.loadModel.deriveLoadCase(input)).isPassed()).isFalse();
        }

        @Test
        @DisplayName("smallest wall is stable on the minimum footing at the first evaluation")
        void scenarioC() {
            OptimizationOutcome out = optimize(WallEngineFixture.scenarioC().build());

            assertThat(out.getWinner().getFooting()).isEqualTo(new Footing(6, 6, 8));
            assertThat(out.getEvaluations()).isEqualTo(1);
        }

        @Test
        @DisplayName("requested toe is honoured as a lower bound")
        void toeBound() {
            OptimizationOutcome out = optimize(WallEngineFixture.scenarioC().height(72).toeLength(60).build());

            assertThat(out.getWinner().getSections()).containsExactly(new WallSection(36, 8), new WallSection(36, 8));
            assertThat(out.getWinner().getFooting()).isEqualTo(new Footing(60, 21, 9));
        }

        @Test
        @DisplayName("one inch taller wall with a long toe keeps at least the same heel")
        void longToeThicknessJump() {
            DesignInput lower = WallEngineFixture.scenarioC().height(75).toeLength(120).build();
            DesignInput taller = lower.toBuilder().height(76).build();

            Footing a = optimize(lower).getWinner().getFooting();
            Footing b = optimize(taller).getWinner().getFooting();

            assertThat(a).isEqualTo(new Footing(120, 16, 9));
            assertThat(b).isEqualTo(new Footing(120, 17, 10));
        }
    }

    @Nested
    @DisplayName("MinimizeFooting")
    class MinimizeFooting {

        @Test
        @DisplayName("thicker wall buys a shorter heel")
        void scenarioA() {
            OptimizationOutcome out = optimize(WallEngineFixture.scenarioA()
                    .optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING).build());

            assertThat(out.isConverged()).isTrue();
            assertThat(out.getWinner().getSections()).containsExactly(new WallSection(48, 13));
            assertThat(out.getWinner().getWidthStep()).isEqualTo(5);
            assertThat(out.getWinner().getFooting()).isEqualTo(new Footing(12, 6, 8));
            assertThat(out.getEvaluations()).isEqualTo(17);
        }

        @Test
        @DisplayName("long heel under a 1:1 slope converges well inside the iteration limit")
        void longSlopedHeel() {
            OptimizationOutcome out = optimize(WallEngineFixture.scenarioC()
                    .height(40)
                    .surcharge(Surcharge.SLOPE_1_1)
                    .soilStiffness(SoilStiffness.SOFT)
                    .adjacentSlab(true)
                    .toeLength(60)
                    .optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING)
                    .build());

            assertThat(out.isConverged()).isTrue();
            assertThat(out.getWinner().getSections()).containsExactly(new WallSection(40, 24));
            assertThat(out.getWinner().getFooting()).isEqualTo(new Footing(60, 117, 8));
            assertThat(out.getEvaluations()).isEqualTo(25);
        }

        @Test
        @DisplayName("sloped backfill with slab and topping on a two-section wall")
        void slopedWithSlab() {
            OptimizationOutcome out = optimize(WallEngineFixture.scenarioC()
                    .height(72)
                    .surcharge(Surcharge.SLOPE_1_4)
                    .adjacentSlab(true)
                    .toppingDepth(6)
                    .optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING)
                    .build());

            assertThat(out.getWinner().getSections()).containsExactly(new WallSection(36, 24), new WallSection(36, 16));
            assertThat(out.getWinner().getFooting()).isEqualTo(new Footing(6, 27, 9));
        }

        @Test
        @DisplayName("bottom section never exceeds the practical width")
        void widthCap() {
            for (int h = 24; h <= 144; h += 12) {
                OptimizationOutcome out = optimize(WallEngineFixture.scenarioC().height(h)
                        .optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING).build());
                assertThat(out.getWinner().getSections().get(0).getWidth()).isLessThanOrEqualTo(24);
            }
        }
    }

    @Nested
    @DisplayName("Infeasible parameters")
    class Infeasible {

        @Test
        @DisplayName("144 in wall on soft soil under a 1:1 slope needs a footing wider than allowed")
        void scenarioB() {
            for (OptimizationObjective objective : OptimizationObjective.values()) {
                OptimizationOutcome out = optimize(WallEngineFixture.scenarioB().optimizationObjective(objective).build());

                assertThat(out.getState()).as(objective.name()).isEqualTo(SearchState.INFEASIBLE);
                assertThat(out.getWinner()).isNull();
                assertThat(out.getReason()).isEqualTo(InfeasibilityReason.FOOTING_LIMIT_EXCEEDED);
                assertThat(out.getLastResult().getFailedChecks()).contains(StabilityCheck.SLIDING);
            }
        }

        @Test
        @DisplayName("iteration limit stops the sweep")
        void iterationLimit() {
            ReflectionTestUtils.setField(engine.optimizer, "maxIterations", 1);

            OptimizationOutcome out = optimize(WallEngineFixture.scenarioA().build());

            assertThat(out.getState()).isEqualTo(SearchState.INFEASIBLE);
            assertThat(out.getReason()).isEqualTo(InfeasibilityReason.ITERATION_LIMIT_REACHED);
            assertThat(out.getEvaluations()).isEqualTo(1);
        }

        @Test
        @DisplayName("iteration limit is shared by all width steps of MinimizeFooting")
        void iterationLimitAcrossWidthSteps() {
            ReflectionTestUtils.setField(engine.optimizer, "maxIterations", 3);

            OptimizationOutcome out = optimize(WallEngineFixture.scenarioC()
                    .height(40)
                    .surcharge(Surcharge.SLOPE_1_1)
                    .soilStiffness(SoilStiffness.SOFT)
                    .adjacentSlab(true)
                    .toeLength(60)
                    .optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING)
                    .build());

            assertThat(out.getEvaluations()).isLessThanOrEqualTo(3);
        }

        @Test
        @DisplayName("minimum footing wider than the practical maximum")
        void footingLimit() {
            WallDesignProperties props = new WallDesignProperties();
            props.getFooting().setMaxWidth(18);
            WallEngineFixture narrow = new WallEngineFixture(props);
            DesignInput input = WallEngineFixture.scenarioC().build();

            OptimizationOutcome out = narrow.optimizer.optimize(input, narrow.loadModel.deriveLoadCase(input));

            assertThat(out.getReason()).isEqualTo(InfeasibilityReason.FOOTING_LIMIT_EXCEEDED);
        }
    }

    @Nested
    @DisplayName("Search invariants")
    class Invariants {

        @Test
        @DisplayName("every proposed candidate stacks to the requested height")
        void heightsSum() {
            List<List<WallSection>> proposed = new ArrayList<>();
            WallDesignProperties props = new WallDesignProperties();
            SectionBuilder recording = new SectionBuilder(props) {
                @Override
                public List<WallSection> proposeSections(int totalHeight, Material material, int maxSections, int widthStep) {
                    List<WallSection> s = super.proposeSections(totalHeight, material, maxSections, widthStep);
                    proposed.add(s);
                    return s;
                }
            };
            WallEngineFixture recorded = new WallEngineFixture(props, recording);

            for (int h : new int[]{24, 49, 97, 144}) {
                proposed.clear();
                DesignInput input = WallEngineFixture.scenarioB().height(h).surcharge(Surcharge.FLAT)
                        .optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING).build();
                recorded.optimizer.optimize(input, recorded.loadModel.deriveLoadCase(input));

                assertThat(proposed).isNotEmpty();
                assertThat(proposed).allMatch(s -> WallStatics.wallHeight(s) == h);
            }
        }

        @Test
        @DisplayName("taller walls never get a smaller footing, one inch at a time, toe bound up to 120 in")
        void monotoneInHeight() {
            for (OptimizationObjective objective : OptimizationObjective.values()) {
                for (Material material : Material.values()) {
                    for (SoilStiffness soil : SoilStiffness.values()) {
                        for (Surcharge slope : Surcharge.values()) {
                            for (boolean slab : new boolean[]{false, true}) {
                                for (int topping : new int[]{0, 24}) {
                                    for (int toe : TOE_BOUNDS) {
                                        DesignInput base = WallEngineFixture.scenarioC().material(material)
                                                .soilStiffness(soil).surcharge(slope).adjacentSlab(slab)
                                                .toppingDepth(topping).toeLength(toe)
                                                .optimizationObjective(objective).build();
                                        assertMonotone(base);
                                    }
                                }
                            }
                        }
                    }
                }
            }
        }

        private void assertMonotone(DesignInput base) {
            Footing previous = null;
            for (int h = 24; h <= 144; h++) {
                OptimizationOutcome out = optimize(base.toBuilder().height(h).build());
                if (!out.isConverged()) {
                    continue;
                }
                Footing f = out.getWinner().getFooting();
                assertThat(f.getToe()).isGreaterThanOrEqualTo(base.getToeLength());
                if (previous != null) {
                    assertThat(f.footprint()).as("%s H=%d", base, h).isGreaterThanOrEqualTo(previous.footprint());
                    assertThat(f.getThickness()).as("%s H=%d", base, h).isGreaterThanOrEqualTo(previous.getThickness());
                }
                previous = f;
            }
        }

        @Test
        @DisplayName("MinimizeFooting never yields a larger footprint than MinimizeExcavation")
        void objectiveEffect() {
            for (Surcharge slope : Surcharge.values()) {
                for (int h = 24; h <= 96; h += 24) {
                    DesignInput exc = WallEngineFixture.scenarioC().height(h).surcharge(slope).build();
                    DesignInput foot = exc.toBuilder().optimizationObjective(OptimizationObjective.MINIMIZE_FOOTING).build();

                    OptimizationOutcome a = optimize(exc);
                    OptimizationOutcome b = optimize(foot);
                    if (a.isConverged()) {
                        assertThat(b.isConverged()).isTrue();
                        assertThat(b.getWinner().getFooting().footprint())
                                .as("%s H=%d", slope, h)
                                .isLessThanOrEqualTo(a.getWinner().getFooting().footprint());
                    }
                }
            }
        }

        @Test
        @DisplayName("one run never evaluates more candidates than the iteration limit, for either objective")
        void evaluationLimit() {
            for (OptimizationObjective objective : OptimizationObjective.values()) {
                for (SoilStiffness soil : SoilStiffness.values()) {
                    for (Surcharge slope : Surcharge.values()) {
                        for (boolean slab : new boolean[]{false, true}) {
                            for (int toe : TOE_BOUNDS) {
                                for (int h = 24; h <= 144; h++) {
                                    DesignInput input = WallEngineFixture.scenarioC().height(h).soilStiffness(soil)
                                            .surcharge(slope).adjacentSlab(slab).toeLength(toe)
                                            .optimizationObjective(objective).build();
                                    assertThat(optimize(input).getEvaluations()).as("%s", input).isBetween(1, 50);
                                }
                            }
                        }
                    }
                }
            }
        }
    }
}
