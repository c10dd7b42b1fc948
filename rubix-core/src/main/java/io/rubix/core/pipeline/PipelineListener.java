package io.rubix.core.pipeline;

import io.rubix.core.context.ContextShape;
import io.rubix.core.exception.PipelineException;
import io.rubix.core.stage.Stage;
import java.time.Duration;

/// Listener for pipeline run lifecycle events.
///
/// This is the run-scoped observability handle: it is passed in through
/// {@link io.rubix.core.config.PipelineOptions} rather than looked up globally.
/// All methods default to no-ops.
///
/// ### Callback Lifecycle
/// A linear run triggers callbacks in this order:
///
/// ```
/// onRunStart(sequenceId, stageCount)
/// onStageStart(sequenceId, 0, stage)
/// onStageComplete(sequenceId, 0, stage, elapsed)  // or onStageFailed(...), then onRunFailed
/// ...
/// onRunComplete(sequenceId, elapsed)
/// ```
///
/// A compiled run fires only `onRunStart`, `onRunComplete` / `onRunFailed`, and
/// `onSpecialization` the first time an input shape is seen.
///
/// @implNote Implementations shared by a compiled pipeline running on several
/// threads must be thread-safe.
public interface PipelineListener {

    /// Called before the first stage runs.
    ///
    /// @param sequenceId identity of the stage sequence, not null
    /// @param stageCount number of stages in the sequence
    default void onRunStart(String sequenceId, int stageCount) {}

    /// Called before a stage runs (linear form only).
    ///
    /// @param sequenceId identity of the running sequence, not null
    /// @param index zero-based stage index
    /// @param stage the stage about to run, not null
    default void onStageStart(String sequenceId, int index, Stage stage) {}

    /// Called after a stage returned and passed its checks (linear form only).
    ///
    /// @param sequenceId identity of the running sequence, not null
    /// @param index zero-based stage index
    /// @param stage the stage that ran, not null
    /// @param elapsed wall-clock time spent in the stage, not null
    default void onStageComplete(String sequenceId, int index, Stage stage, Duration elapsed) {}

    /// Called when a stage threw or its result violated the stage contract (linear
    /// form only).
    ///
    /// @param sequenceId identity of the running sequence, not null
    /// @param index zero-based stage index
    /// @param stage the failing stage, not null
    /// @param error the stage's own error, or the contract violation, not null
    default void onStageFailed(String sequenceId, int index, Stage stage, Throwable error) {}

    /// Called after the last stage returned.
    ///
    /// @param sequenceId identity of the stage sequence, not null
    /// @param elapsed wall-clock time of the whole run, not null
    default void onRunComplete(String sequenceId, Duration elapsed) {}

    /// Called when a run ends with an exception.
    ///
    /// @param sequenceId identity of the stage sequence, not null
    /// @param error the exception about to be thrown to the caller, not null
    default void onRunFailed(String sequenceId, PipelineException error) {}

    /// Called when a compiled pipeline builds a specialization for a new input shape.
    ///
    /// @param sequenceId identity of the stage sequence, not null
    /// @param shape the input shape, not null
    default void onSpecialization(String sequenceId, ContextShape shape) {}

    /// No-op listener instance that ignores all events.
    PipelineListener NOOP = new PipelineListener() {};
}
