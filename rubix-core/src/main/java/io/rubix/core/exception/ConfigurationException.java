package io.rubix.core.exception;

import java.io.Serial;

/// Thrown when a stage or pipeline cannot be set up from its configuration.
///
/// Raised only while binding stages, registering a stage sequence or assembling
/// a pipeline, never while a pipeline runs. Common causes:
/// - A required configuration key is missing
/// - A configuration value is outside its enumerated set (e.g. rotation type)
/// - The stage sequence is empty or contains two stages with the same name
///
/// @see io.rubix.core.transformer.BoundTransformer
/// @see io.rubix.core.pipeline.AbstractPipeline#register
public class ConfigurationException extends PipelineException {

    @Serial private static final long serialVersionUID = -2790513866148950321L;

    /// Creates exception with message.
    ///
    /// @param message description of the configuration problem
    public ConfigurationException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the configuration problem
    /// @param cause the underlying exception
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
