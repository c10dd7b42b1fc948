package io.rubix.core.exception;

import io.rubix.core.context.Context;
import java.io.Serial;
import java.util.Optional;
import java.util.OptionalInt;

/// Thrown when a stage fails while a pipeline runs.
///
/// Wraps the stage's own exception as its cause and carries the last context known
/// to be good, so the caller can inspect the state reached before the failure.
///
/// ### Identification
/// - Linear pipelines identify the failing stage by name and zero-based index
/// - Compiled pipelines identify only the stage sequence through {@link #sequenceId()};
///   {@link #stageName()} and {@link #stageIndex()} are empty
///
/// @implNote The context is not serialized with the exception.
/// @see io.rubix.core.pipeline.LinearTransformerPipeline#run
/// @see io.rubix.core.transformer.CompiledTransformer#apply
public class StageExecutionException extends PipelineException {

    @Serial private static final long serialVersionUID = 7482019365203311492L;

    private final String stageName;
    private final int stageIndex;
    private final String sequenceId;
    private final transient Context lastGoodContext;

    protected StageExecutionException(
            String message,
            String stageName,
            int stageIndex,
            String sequenceId,
            Context lastGoodContext,
            Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
        this.stageIndex = stageIndex;
        this.sequenceId = sequenceId;
        this.lastGoodContext = lastGoodContext;
    }

    /// Creates an exception for a failure attributed to a single stage.
    ///
    /// @param stageName name of the failing stage, not null
    /// @param stageIndex zero-based position of the failing stage
    /// @param sequenceId identity of the stage sequence, may be null
    /// @param lastGoodContext context as of before the failing stage ran, may be null
    /// @param cause the stage's own exception, not null
    /// @return new exception, never null
    public static StageExecutionException forStage(
            String stageName,
            int stageIndex,
            String sequenceId,
            Context lastGoodContext,
            Throwable cause) {
        return new StageExecutionException(
                "Stage #"
                        + (stageIndex + 1)
                        + " '"
                        + stageName
                        + "' failed: "
                        + cause.getMessage(),
                stageName,
                stageIndex,
                sequenceId,
                lastGoodContext,
                cause);
    }

    /// Creates an exception for a failure inside a fused stage sequence.
    ///
    /// @param sequenceId identity of the fused sequence, not null
    /// @param lastGoodContext input context of the fused call, may be null
    /// @param cause the exception raised inside the sequence, not null
    /// @return new exception, never null
    public static StageExecutionException forSequence(
            String sequenceId, Context lastGoodContext, Throwable cause) {
        return new StageExecutionException(
                "Compiled sequence " + sequenceId + " failed: " + cause.getMessage(),
                null,
                -1,
                sequenceId,
                lastGoodContext,
                cause);
    }

    /// @return failing stage name, empty for compiled sequences
    public Optional<String> stageName() {
        return Optional.ofNullable(stageName);
    }

    /// @return zero-based failing stage index, empty for compiled sequences
    public OptionalInt stageIndex() {
        return stageIndex >= 0 ? OptionalInt.of(stageIndex) : OptionalInt.empty();
    }

    /// @return identity of the stage sequence, may be null
    public String sequenceId() {
        return sequenceId;
    }

    /// Returns the context as of before the failing stage ran.
    ///
    /// Exact when the pipeline snapshots contexts (the default). Without snapshots
    /// this is the reference handed to the failing stage and may hold its partial writes.
    ///
    /// @return last good context, may be null after deserialization
    public Context lastGoodContext() {
        return lastGoodContext;
    }
}
