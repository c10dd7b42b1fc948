package io.rubix.core.transformer;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.stage.AttributeContract;
import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageFactory;
import io.rubix.core.stage.StageLogger;
import io.rubix.core.stage.Transform;
import java.util.Objects;
import java.util.logging.Logger;

/// Binds configuration into a stage factory, producing an immutable {@link Stage}.
///
/// ### Contracts
/// - **Precondition**: `factory` and `contract` are non-null
/// - **Postcondition**: the factory has been called exactly once; its transform is
///   captured in the returned stage
/// - **Invariant**: every configuration problem surfaces here as a
///   {@link ConfigurationException}, never later while a pipeline runs
///
/// Unchecked exceptions thrown by a factory while it validates its configuration
/// are reported as {@link ConfigurationException}s as well, with the original
/// exception as cause.
public final class BoundTransformer {

    private static final Logger logger = Logger.getLogger(BoundTransformer.class.getName());

    private BoundTransformer() {}

    /// Binds a configuration into a stage factory.
    ///
    /// @param name stage name, not null or blank
    /// @param factory stage factory, not null
    /// @param config configuration to bind, must not be null
    /// @param contract declared attribute contract, not null
    /// @return bound stage, never null
    /// @throws ConfigurationException if the name is blank, the configuration is null
    ///     or rejected by the factory, or the factory returns no transform
    public static Stage bind(
            String name, StageFactory factory, RubixConfig config, AttributeContract contract)
            throws ConfigurationException {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        Objects.requireNonNull(contract, "contract must not be null");
        if (name.isBlank()) {
            throw new ConfigurationException("Stage name must not be blank");
        }
        if (config == null) {
            throw new ConfigurationException("Stage '" + name + "' requires a configuration");
        }

        Transform transform;
        try {
            transform = factory.create(config, StageLogger.forStage(name));
        } catch (ConfigurationException | RuntimeException e) {
            throw new ConfigurationException(
                    "Invalid configuration for stage '" + name + "': " + e.getMessage(), e);
        }
        if (transform == null) {
            throw new ConfigurationException(
                    "Stage factory for '" + name + "' returned no transform");
        }

        logger.fine(() -> "Bound stage '" + name + "'");
        return new Stage(name, config, contract, transform);
    }
}
