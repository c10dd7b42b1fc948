package io.rubix.stages;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.exception.StageExecutionException;
import io.rubix.core.pipeline.LinearTransformerPipeline;
import io.rubix.core.stage.Stage;
import io.rubix.core.transformer.Transformers;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GalaxyRotationStageTest {

    private static RubixConfig config(Map<String, ?> rotation, List<String> types) {
        return RubixConfig.of(
                Map.of(
                        "galaxy", Map.of("rotation", rotation),
                        "data", Map.of("args", Map.of("particle_type", types))));
    }

    private static Stage bind(RubixConfig config) throws ConfigurationException {
        return Transformers.bind(GalaxyRotationStage.definition(), config);
    }

    private static Context stars(double[] coords, double[] velocity) {
        return Context.of(
                new Component("stars")
                        .put("coords", ArrayAttribute.ofRows(3, coords))
                        .put("velocity", ArrayAttribute.ofRows(3, velocity))
                        .put("mass", ArrayAttribute.of(1.0)));
    }

    @Nested
    class ConfigurationTest {

        @Test
        void shouldResolveNamedOrientations() throws Exception {
            assertThat(GalaxyRotationStage.angles(config(Map.of("type", "face-on"), List.of("stars"))))
                    .containsExactly(0, 0, 0);
            assertThat(GalaxyRotationStage.angles(config(Map.of("type", "edge-on"), List.of("stars"))))
                    .containsExactly(90, 0, 0);
        }

        @Test
        void shouldPreferTypeOverAngles() throws Exception {
            RubixConfig config =
                    config(Map.of("type", "face-on", "alpha", 45, "beta", 0, "gamma", 0), List.of());

            assertThat(GalaxyRotationStage.angles(config)).containsExactly(0, 0, 0);
        }

        @Test
        void shouldReadExplicitAngles() throws Exception {
            RubixConfig config =
                    config(Map.of("alpha", 10, "beta", 20.5, "gamma", -30), List.of("stars"));

            assertThat(GalaxyRotationStage.angles(config)).containsExactly(10, 20.5, -30);
        }

        @Test
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> bind(config(Map.of("type", "side-on"), List.of("stars"))))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Invalid value 'side-on' for galaxy/rotation/type");
        }

        @Test
        void shouldRejectIncompleteAngles() {
            assertThatThrownBy(() -> bind(config(Map.of("alpha", 10, "beta", 20), List.of("stars"))))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("gamma not provided in galaxy/rotation");
        }

        @Test
        void shouldRejectMissingRotationSection() {
            RubixConfig config =
                    RubixConfig.of(
                            Map.of(
                                    "galaxy", Map.of(),
                                    "data", Map.of("args", Map.of("particle_type", List.of("stars")))));

            assertThatThrownBy(() -> bind(config))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Key galaxy/rotation not found in config");
        }

        @Test
        void shouldRejectUnsupportedParticleType() {
            assertThatThrownBy(() -> bind(config(Map.of("type", "face-on"), List.of("stars", "dm"))))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Unsupported particle type 'dm'");
        }
    }

    @Nested
    class RotationTest {

        @Test
        void shouldLeaveFaceOnUnchanged() throws Exception {
            Stage stage = bind(config(Map.of("type", "face-on"), List.of("stars")));

            Context result = stage.apply(stars(new double[] {1, 2, 3}, new double[] {4, 5, 6}));

            assertThat(result.require("stars").require("coords").toArray())
                    .containsExactly(new double[] {1, 2, 3}, within(1e-12));
        }

        @Test
        void shouldTurnEdgeOnAboutXAxis() throws Exception {
            Stage stage = bind(config(Map.of("type", "edge-on"), List.of("stars")));

            Context result = stage.apply(stars(new double[] {1, 2, 3}, new double[] {0, 1, 0}));

            assertThat(result.require("stars").require("coords").toArray())
                    .containsExactly(new double[] {1, -3, 2}, within(1e-12));
            assertThat(result.require("stars").require("velocity").toArray())
                    .containsExactly(new double[] {0, 0, 1}, within(1e-12));
            assertThat(result.require("stars").require("mass")).isEqualTo(ArrayAttribute.of(1.0));
        }

        @Test
        void shouldComposeZAfterX() {
            double[][] matrix = GalaxyRotationStage.rotationMatrix(90, 0, 90);

            ArrayAttribute rotated =
                    GalaxyRotationStage.rotate(matrix, "stars", "coords", ArrayAttribute.ofRows(3, 0, 1, 0));

            // x-rotation takes y to z; z-rotation leaves z alone
            assertThat(rotated.toArray()).containsExactly(new double[] {0, 0, 1}, within(1e-12));
        }

        @Test
        void shouldPreserveVectorLengths() throws Exception {
            Stage stage = bind(config(Map.of("alpha", 33, "beta", -71, "gamma", 128), List.of("stars")));

            Context result = stage.apply(stars(new double[] {3, 4, 12, -1, 0, 2}, new double[] {1, 1, 1, 0, 0, 0}));

            ArrayAttribute coords = result.require("stars").require("coords");
            assertThat(norm(coords.row(0))).isCloseTo(13.0, within(1e-9));
            assertThat(norm(coords.row(1))).isCloseTo(Math.sqrt(5), within(1e-9));
        }

        @Test
        void shouldRotateOnlyConfiguredComponents() throws Exception {
            Stage stage = bind(config(Map.of("type", "edge-on"), List.of("gas")));
            ArrayAttribute starCoords = ArrayAttribute.ofRows(3, 1, 2, 3);
            Context context =
                    Context.of(
                            new Component("stars").put("coords", starCoords),
                            new Component("gas")
                                    .put("coords", ArrayAttribute.ofRows(3, 0, 1, 0))
                                    .put("velocity", ArrayAttribute.ofRows(3, 0, 0, 0)));

            Context result = stage.apply(context);

            assertThat(result.require("stars").require("coords")).isSameAs(starCoords);
            assertThat(result.require("gas").require("coords").get(0, 2)).isCloseTo(1.0, within(1e-12));
        }

        @Test
        void shouldFailInsidePipelineWhenVelocityMissing() throws Exception {
            Stage stage = bind(config(Map.of("type", "edge-on"), List.of("stars")));
            Context context =
                    Context.of(new Component("stars").put("coords", ArrayAttribute.ofRows(3, 1, 2, 3)));

            assertThatThrownBy(() -> new LinearTransformerPipeline(List.of(stage)).run(context))
                    .isInstanceOf(StageExecutionException.class)
                    .hasMessageContaining("Stage #1 'rotate_galaxy' failed")
                    .hasRootCauseMessage("Attribute 'velocity' not found in component 'stars'");
        }
    }

    private static double norm(double[] v) {
        return Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    }
}
