package io.rubix.core.transformer;

import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageSequence;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Derives expression forms from bound stages.
///
/// Reads only the stage name, configuration snapshot and contract. No transform is
/// invoked and no context is needed, so describing a pipeline is always safe and
/// yields the same result on every call.
public final class ExpressionTransformer {

    private ExpressionTransformer() {}

    /// Describes one stage at the given position.
    ///
    /// @param stage the stage, not null
    /// @param index zero-based position in its sequence
    /// @return expression node, never null
    public static StageExpression describe(Stage stage, int index) {
        Objects.requireNonNull(stage, "stage must not be null");
        return new StageExpression(
                stage.name(),
                stage.config().asMap(),
                index,
                stage.contract().reads(),
                stage.contract().writes());
    }

    /// Describes an ordered list of stages.
    ///
    /// @param stages stages in execution order, not null, no null elements
    /// @return expression of the whole list, never null
    public static PipelineExpression describe(List<Stage> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        List<StageExpression> nodes = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            nodes.add(describe(stages.get(i), i));
        }
        return new PipelineExpression(nodes);
    }

    /// Describes a validated stage sequence.
    ///
    /// @param sequence the sequence, not null
    /// @return expression of the sequence, never null
    public static PipelineExpression describe(StageSequence sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        return describe(sequence.stages());
    }
}
