package io.rubix.core.stage;

import io.rubix.core.exception.ConfigurationException;
import java.util.List;
import java.util.Optional;

/// Registry of stage definitions, looked up by name when a pipeline is assembled
/// from configuration.
///
/// @see DefaultStageRegistry for the default implementation
/// @see io.rubix.core.pipeline.PipelineAssembler for assembly from configuration
public interface StageRegistry {

    /// Registers a stage definition.
    ///
    /// @param definition definition to register, not null
    /// @throws IllegalArgumentException if a definition with the same name exists
    void register(StageDefinition definition);

    /// @param name stage name, not null
    /// @return the definition, or empty if none is registered under `name`
    Optional<StageDefinition> get(String name);

    /// Looks up a definition that must exist.
    ///
    /// @param name stage name, not null
    /// @return the definition, never null
    /// @throws ConfigurationException if no definition is registered under `name`
    StageDefinition getOrThrow(String name) throws ConfigurationException;

    boolean contains(String name);

    /// @return sorted names of all registered definitions
    List<String> names();
}
