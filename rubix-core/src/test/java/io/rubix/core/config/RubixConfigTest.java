package io.rubix.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rubix.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RubixConfigTest {

    private static final RubixConfig CONFIG =
            RubixConfig.of(
                    Map.of(
                            "galaxy", Map.of("rotation", Map.of("type", "edge-on")),
                            "telescope",
                                    Map.of("fov", 5.0, "sbin", 10, "pixel_type", "square"),
                            "data", Map.of("args", Map.of("particle_type", List.of("stars", "gas")))));

    @Nested
    class PathLookupTest {

        @Test
        void shouldResolveNestedPaths() throws Exception {
            assertThat(CONFIG.requireString("galaxy/rotation/type")).isEqualTo("edge-on");
            assertThat(CONFIG.requireDouble("telescope/fov")).isEqualTo(5.0);
            assertThat(CONFIG.requireInt("telescope/sbin")).isEqualTo(10);
            assertThat(CONFIG.requireStringList("data/args/particle_type"))
                    .containsExactly("stars", "gas");
        }

        @Test
        void shouldReportMissingKeyWithFullPath() {
            assertThat(CONFIG.find("galaxy/rotation/alpha")).isEmpty();
            assertThat(CONFIG.contains("galaxy/rotation/alpha")).isFalse();
            assertThatThrownBy(() -> CONFIG.require("galaxy/rotation/alpha"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Key galaxy/rotation/alpha not found in config");
        }

        @Test
        void shouldNotDescendIntoLeafValues() {
            assertThat(CONFIG.find("telescope/fov/value")).isEmpty();
        }

        @Test
        void shouldReturnSection() throws Exception {
            RubixConfig telescope = CONFIG.section("telescope");

            assertThat(telescope.requireDouble("fov")).isEqualTo(5.0);
            assertThatThrownBy(() -> CONFIG.section("telescope/fov"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("must be a section");
        }
    }

    @Nested
    class TypeChecksTest {

        @Test
        void shouldRejectWrongTypes() {
            assertThatThrownBy(() -> CONFIG.requireDouble("telescope/pixel_type"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("must be a number");
            assertThatThrownBy(() -> CONFIG.requireString("telescope/fov"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> CONFIG.requireList("telescope"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        void shouldAcceptOnlyWholeNumbersAsIntegers() throws Exception {
            assertThat(RubixConfig.of(Map.of("n", 4.0)).requireInt("n")).isEqualTo(4);
            assertThatThrownBy(() -> RubixConfig.of(Map.of("n", 4.5)).requireInt("n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("must be an integer");
        }

        @Test
        void shouldRestrictEnumeratedValues() throws Exception {
            Set<String> allowed = Set.of("face-on", "edge-on");

            assertThat(CONFIG.requireOneOf("galaxy/rotation/type", allowed)).isEqualTo("edge-on");
            assertThatThrownBy(() -> CONFIG.requireOneOf("telescope/pixel_type", allowed))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Invalid value 'square' for telescope/pixel_type");
        }
    }

    @Test
    void shouldDeepCopyAndFreeze() {
        List<Object> types = new ArrayList<>(List.of("stars"));
        Map<String, Object> args = new HashMap<>();
        args.put("particle_type", types);
        RubixConfig config = RubixConfig.of(Map.of("args", args));

        types.add("gas");
        args.put("extra", 1);

        assertThat(config.find("args/particle_type")).contains(List.of("stars"));
        assertThat(config.contains("args/extra")).isFalse();
        assertThatThrownBy(() -> config.asMap().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldCompareByValue() {
        assertThat(RubixConfig.of(Map.of("a", Map.of("b", 1))))
                .isEqualTo(RubixConfig.of(new HashMap<>(Map.of("a", Map.of("b", 1)))))
                .hasSameHashCodeAs(RubixConfig.of(Map.of("a", Map.of("b", 1))));
        assertThat(RubixConfig.empty().isEmpty()).isTrue();
    }
}
