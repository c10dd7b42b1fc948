package io.rubix.core.stage;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.exception.ConfigurationException;

/// Creates a {@link Transform} from static configuration.
///
/// This is the plug-in contract for every numeric kernel (rotation, binning,
/// spectral synthesis). A factory is called exactly once when its stage is bound;
/// all configuration validation happens here so that nothing configuration-related
/// can fail while the pipeline runs.
///
/// ### Contracts
/// - **Precondition**: `config` and `log` are non-null
/// - **Postcondition**: returns a non-null transform, or throws
///   {@link ConfigurationException} for a missing or invalid key
///
/// ### Usage
/// {@snippet :
/// StageFactory doubling = (config, log) -> context -> {
///     Component data = context.require("data");
///     data.put("x", ArrayAttribute.of(data.require("x").get(0) * 2));
///     return context;
/// };
/// }
///
/// @see io.rubix.core.transformer.Transformers#bound
@FunctionalInterface
public interface StageFactory {

    /// Validates the configuration and creates the transform.
    ///
    /// @param config configuration bound into the stage, not null
    /// @param log logging handle scoped to the stage, not null
    /// @return configured transform, never null
    /// @throws ConfigurationException if a required key is missing or invalid
    Transform create(RubixConfig config, StageLogger log) throws ConfigurationException;
}
