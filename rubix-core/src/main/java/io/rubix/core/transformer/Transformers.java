package io.rubix.core.transformer;

import io.rubix.core.config.PipelineOptions;
import io.rubix.core.config.RubixConfig;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.stage.AttributeContract;
import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageDefinition;
import io.rubix.core.stage.StageFactory;
import io.rubix.core.stage.StageSequence;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Entry points for the three transformer forms over the same stage definitions.
///
/// | Form       | Method                  | Result                                      |
/// |------------|-------------------------|---------------------------------------------|
/// | bound      | {@link #bound}          | one {@link Stage} with configuration closed over |
/// | compiled   | {@link #compiled}       | a {@link CompiledTransformer} over a sequence |
/// | expression | {@link #expression}     | a structural description, nothing executed  |
///
/// ### Usage
/// {@snippet :
/// List<Stage> stages = List.of(
///         Transformers.bound("double", doubling, Map.of()),
///         Transformers.bound("increment", incrementing, Map.of()));
///
/// Context direct = new LinearTransformerPipeline(stages).run(context);
/// Context fused = Transformers.compiled(stages).apply(otherContext);
/// PipelineExpression description = Transformers.expression(stages);
/// }
public final class Transformers {

    private Transformers() {}

    /// Binds configuration into a factory; the stage declares no attribute contract.
    ///
    /// @see BoundTransformer#bind
    public static Stage bound(String name, StageFactory factory, RubixConfig config)
            throws ConfigurationException {
        return BoundTransformer.bind(name, factory, config, AttributeContract.undeclared());
    }

    /// Binds a nested configuration map into a factory.
    ///
    /// @see BoundTransformer#bind
    public static Stage bound(String name, StageFactory factory, Map<String, ?> config)
            throws ConfigurationException {
        if (config == null) {
            throw new ConfigurationException("Stage '" + name + "' requires a configuration");
        }
        return bound(name, factory, RubixConfig.of(config));
    }

    /// Binds configuration into a factory with a declared attribute contract.
    ///
    /// @see BoundTransformer#bind
    public static Stage bound(
            String name, StageFactory factory, RubixConfig config, AttributeContract contract)
            throws ConfigurationException {
        return BoundTransformer.bind(name, factory, config, contract);
    }

    /// Binds configuration into a registered stage definition.
    ///
    /// @param definition stage definition, not null
    /// @param config configuration to bind, not null
    /// @return bound stage, never null
    /// @throws ConfigurationException if the factory rejects the configuration
    public static Stage bind(StageDefinition definition, RubixConfig config)
            throws ConfigurationException {
        Objects.requireNonNull(definition, "definition must not be null");
        return BoundTransformer.bind(
                definition.name(), definition.factory(), config, definition.contract());
    }

    /// Fuses an ordered stage list with default options.
    ///
    /// @param stages bound stages in execution order
    /// @return compiled form, never null
    /// @throws ConfigurationException if the list is empty or holds duplicate names
    public static CompiledTransformer compiled(List<Stage> stages) throws ConfigurationException {
        return compiled(stages, PipelineOptions.defaults());
    }

    /// Fuses an ordered stage list.
    ///
    /// @param stages bound stages in execution order
    /// @param options listener and snapshot policy, not null
    /// @return compiled form, never null
    /// @throws ConfigurationException if the list is empty or holds duplicate names
    public static CompiledTransformer compiled(List<Stage> stages, PipelineOptions options)
            throws ConfigurationException {
        return new CompiledTransformer(StageSequence.of(stages), options);
    }

    /// Describes a single stage as the only element of a sequence.
    ///
    /// @param stage bound stage, not null
    /// @return expression node at index 0, never null
    public static StageExpression expression(Stage stage) {
        return ExpressionTransformer.describe(stage, 0);
    }

    /// Describes an ordered stage list.
    ///
    /// @param stages bound stages, not null
    /// @return expression form, never null
    public static PipelineExpression expression(List<Stage> stages) {
        return ExpressionTransformer.describe(stages);
    }
}
