package io.rubix.stages;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.stage.Stage;
import io.rubix.core.transformer.Transformers;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ApertureFilterStageTest {

    private static final RubixConfig CONFIG =
            RubixConfig.of(
                    Map.of(
                            "telescope", Map.of("fov", 4.0, "sbin", 2),
                            "data", Map.of("args", Map.of("particle_type", List.of("stars")))));

    private static Stage bind(RubixConfig config) throws ConfigurationException {
        return Transformers.bind(ApertureFilterStage.definition(), config);
    }

    private static Context stars() {
        return Context.of(
                new Component("stars")
                        .put("coords", ArrayAttribute.ofRows(3, 0, 0, 0, 3, 0, 0, 2, -2, 0))
                        .put("velocity", ArrayAttribute.ofRows(3, 1, 1, 1, 2, 2, 2, 3, 3, 3))
                        .put("mass", ArrayAttribute.of(10, 20, 30))
                        .put("age", ArrayAttribute.of(1, 2, 3))
                        .put("luminosity", ArrayAttribute.of(7, 8, 9)));
    }

    @Test
    void shouldZeroMaskedAttributesOutsideAperture() throws Exception {
        Context result = bind(CONFIG).apply(stars());

        Component stars = result.require("stars");
        assertThat(stars.require("mask").toArray()).containsExactly(1, 0, 1);
        assertThat(stars.require("mass").toArray()).containsExactly(10, 0, 30);
        assertThat(stars.require("age").toArray()).containsExactly(1, 0, 3);
    }

    @Test
    void shouldLeaveKinematicsAndUnlistedAttributesAlone() throws Exception {
        Context input = stars();
        ArrayAttribute coords = input.require("stars").require("coords");
        ArrayAttribute velocity = input.require("stars").require("velocity");

        Component stars = bind(CONFIG).apply(input).require("stars");

        assertThat(stars.require("coords")).isSameAs(coords);
        assertThat(stars.require("velocity")).isSameAs(velocity);
        assertThat(stars.require("luminosity").toArray()).containsExactly(7, 8, 9);
        assertThat(stars.has("metallicity")).isFalse();
    }

    @Test
    void shouldZeroEveryColumnOfWideAttributes() {
        ArrayAttribute masked =
                ApertureFilterStage.applyMask(
                        ArrayAttribute.ofRows(2, 1, 2, 3, 4), new double[] {0, 1});

        assertThat(masked.toArray()).containsExactly(0, 0, 3, 4);
    }

    @Test
    void shouldRequireTelescopeGrid() {
        RubixConfig noTelescope =
                RubixConfig.of(Map.of("data", Map.of("args", Map.of("particle_type", List.of("stars")))));

        assertThatThrownBy(() -> bind(noTelescope))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Key telescope/fov not found in config");
    }
}
