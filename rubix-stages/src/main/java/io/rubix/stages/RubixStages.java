package io.rubix.stages;

import io.rubix.core.stage.DefaultStageRegistry;
import io.rubix.core.stage.StageDefinition;
import io.rubix.core.stage.StageRegistry;
import java.util.List;

/// Reference stages of the IFU pipeline, in their usual order.
///
/// ### Usage
/// {@snippet :
/// StageRegistry registry = RubixStages.registry();
/// LinearTransformerPipeline pipeline =
///         new PipelineAssembler(registry).assemble(config, "calc_ifu");
/// }
public final class RubixStages {

    private RubixStages() {}

    /// @return definitions of `rotate_galaxy`, `spaxel_assignment` and `filter_particles`
    public static List<StageDefinition> definitions() {
        return List.of(
                GalaxyRotationStage.definition(),
                SpaxelAssignmentStage.definition(),
                ApertureFilterStage.definition());
    }

    /// Registers every reference stage.
    ///
    /// @param registry target registry, not null
    /// @throws IllegalArgumentException if a reference stage name is already registered
    public static void registerDefaults(StageRegistry registry) {
        definitions().forEach(registry::register);
    }

    /// @return new registry holding only the reference stages
    public static StageRegistry registry() {
        return new DefaultStageRegistry(definitions());
    }
}
