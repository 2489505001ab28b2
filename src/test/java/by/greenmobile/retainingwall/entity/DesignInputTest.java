package by.greenmobile.retainingwall.entity;

import by.greenmobile.retainingwall.WallEngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DesignInputTest {

    @Nested
    @DisplayName("Range checks")
    class Ranges {

        @Test
        @DisplayName("boundary heights are accepted")
        void boundaryHeights() {
            assertThat(WallEngineFixture.scenarioA().height(24).build().hasValidInput()).isTrue();
            assertThat(WallEngineFixture.scenarioA().height(144).build().hasValidInput()).isTrue();
        }

        @Test
        @DisplayName("heights outside 24..144 are rejected")
        void heightOutOfRange() {
            assertThat(WallEngineFixture.scenarioA().height(23).build().violations())
                    .containsExactly("height must be within 24..144 inches, got 23");
            assertThat(WallEngineFixture.scenarioA().height(145).build().hasValidInput()).isFalse();
        }

        @Test
        @DisplayName("topping depth and toe length are bounded")
        void toppingAndToe() {
            DesignInput input = WallEngineFixture.scenarioA().toppingDepth(25).toeLength(-1).build();

            assertThat(input.violations()).hasSize(2);
            assertThat(input.violations().get(0)).startsWith("topping_depth");
            assertThat(input.violations().get(1)).startsWith("toe_length");
        }

        @Test
        @DisplayName("missing enumerations are reported")
        void missingEnums() {
            DesignInput input = WallEngineFixture.scenarioA().material(null).soilStiffness(null).build();

            assertThat(input.violations()).containsExactly("material is required", "soil_stiffness is required");
        }
    }

    @Test
    @DisplayName("requireValid throws on a contract violation and returns the input otherwise")
    void requireValid() {
        DesignInput ok = WallEngineFixture.scenarioA().build();
        assertThat(ok.requireValid()).isSameAs(ok);

        assertThatThrownBy(() -> WallEngineFixture.scenarioA().height(10).build().requireValid())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("height must be within");
    }

    @Nested
    @DisplayName("Enum labels")
    class Labels {

        @Test
        void parsesLabelsAndNames() {
            assertThat(Surcharge.fromLabel("Slope1_2")).isEqualTo(Surcharge.SLOPE_1_2);
            assertThat(Surcharge.fromLabel("slope_1_4")).isEqualTo(Surcharge.SLOPE_1_4);
            assertThat(Material.fromLabel("cmu")).isEqualTo(Material.CMU);
            assertThat(OptimizationObjective.fromLabel("MinimizeFooting")).isEqualTo(OptimizationObjective.MINIMIZE_FOOTING);
            assertThat(SoilStiffness.fromLabel("Soft")).isEqualTo(SoilStiffness.SOFT);
        }

        @Test
        void rejectsUnknownLabel() {
            assertThatThrownBy(() -> Surcharge.fromLabel("Slope1_3"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void slopeAngles() {
            assertThat(Surcharge.FLAT.angleRadians()).isEqualTo(0.0);
            assertThat(Math.toDegrees(Surcharge.SLOPE_1_1.angleRadians())).isCloseTo(45.0, within(1e-9));
        }
    }
}
