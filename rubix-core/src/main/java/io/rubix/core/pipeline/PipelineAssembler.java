package io.rubix.core.pipeline;

import io.rubix.core.config.PipelineOptions;
import io.rubix.core.config.RubixConfig;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageRegistry;
import io.rubix.core.transformer.CompiledTransformer;
import io.rubix.core.transformer.PipelineExpression;
import io.rubix.core.transformer.Transformers;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds pipelines from the `pipelines` section of a configuration.
///
/// Each named pipeline lists its stages in execution order:
///
/// ```
/// pipelines:
///   calc_ifu:
///     stages: [rotate_galaxy, spaxel_assignment, filter_particles]
/// ```
///
/// Every listed stage is looked up in the {@link StageRegistry} and bound with the
/// whole configuration, so stage factories read their own sections (`galaxy/...`,
/// `telescope/...`) from the same tree.
///
/// @implNote Thread-safe if the registry is thread-safe.
public final class PipelineAssembler {

    private static final Logger logger = Logger.getLogger(PipelineAssembler.class.getName());

    public static final String PIPELINES_KEY = "pipelines";

    private final StageRegistry registry;
    private final PipelineOptions options;

    /// Creates an assembler with default pipeline options.
    ///
    /// @param registry stage definitions to bind from, not null
    public PipelineAssembler(StageRegistry registry) {
        this(registry, PipelineOptions.defaults());
    }

    /// Creates an assembler.
    ///
    /// @param registry stage definitions to bind from, not null
    /// @param options options applied to every assembled pipeline, not null
    public PipelineAssembler(StageRegistry registry, PipelineOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Binds the stages of a named pipeline.
    ///
    /// @param config full configuration including the `pipelines` section, not null
    /// @param pipelineName pipeline to bind, not null
    /// @return bound stages in execution order, unmodifiable
    /// @throws ConfigurationException if the pipeline or a stage is unknown, or a stage
    ///     rejects the configuration
    public List<Stage> bindStages(RubixConfig config, String pipelineName)
            throws ConfigurationException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(pipelineName, "pipelineName must not be null");

        List<String> names =
                config.requireStringList(PIPELINES_KEY + "/" + pipelineName + "/stages");
        List<Stage> stages = new ArrayList<>(names.size());
        for (String name : names) {
            stages.add(Transformers.bind(registry.getOrThrow(name), config));
        }
        logger.info(() -> "Bound pipeline '" + pipelineName + "': " + names);
        return Collections.unmodifiableList(stages);
    }

    /// Assembles a linear pipeline.
    ///
    /// @param config full configuration, not null
    /// @param pipelineName pipeline to assemble, not null
    /// @return registered pipeline, never null
    /// @throws ConfigurationException if binding or registration fails
    public LinearTransformerPipeline assemble(RubixConfig config, String pipelineName)
            throws ConfigurationException {
        return new LinearTransformerPipeline(bindStages(config, pipelineName), options);
    }

    /// Assembles the compiled form of a pipeline.
    ///
    /// @param config full configuration, not null
    /// @param pipelineName pipeline to compile, not null
    /// @return compiled form, never null
    /// @throws ConfigurationException if binding or registration fails
    public CompiledTransformer compile(RubixConfig config, String pipelineName)
            throws ConfigurationException {
        return Transformers.compiled(bindStages(config, pipelineName), options);
    }

    /// Describes a pipeline without assembling an executable form.
    ///
    /// @param config full configuration, not null
    /// @param pipelineName pipeline to describe, not null
    /// @return expression form, never null
    /// @throws ConfigurationException if binding fails
    public PipelineExpression describe(RubixConfig config, String pipelineName)
            throws ConfigurationException {
        return Transformers.expression(bindStages(config, pipelineName));
    }
}
