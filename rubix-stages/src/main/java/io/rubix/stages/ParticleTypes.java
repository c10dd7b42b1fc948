package io.rubix.stages;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.exception.ConfigurationException;
import java.util.List;

/// Particle components the reference stages operate on.
final class ParticleTypes {

    static final String STARS = "stars";
    static final String GAS = "gas";
    static final List<String> SUPPORTED = List.of(STARS, GAS);

    static final String PATH = "data/args/particle_type";

    static final String COORDS = "coords";
    static final String VELOCITY = "velocity";

    private ParticleTypes() {}

    /// Reads the configured particle types.
    ///
    /// @param config full configuration, not null
    /// @return configured types, each one of {@link #SUPPORTED}
    /// @throws ConfigurationException if the list is missing or names an unsupported type
    static List<String> require(RubixConfig config) throws ConfigurationException {
        List<String> types = config.requireStringList(PATH);
        for (String type : types) {
            if (!SUPPORTED.contains(type)) {
                throw new ConfigurationException(
                        "Unsupported particle type '"
                                + type
                                + "' in "
                                + PATH
                                + ", expected one of "
                                + SUPPORTED);
            }
        }
        return types;
    }
}
