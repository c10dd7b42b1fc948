package io.rubix.core.pipeline;

import io.rubix.core.context.ContextShape;
import io.rubix.core.exception.PipelineException;
import io.rubix.core.stage.Stage;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans out all pipeline lifecycle events to an ordered set of delegates.
///
/// All delegates are invoked in declaration order; a runtime exception from one
/// delegate is logged and does not prevent the remaining delegates from receiving
/// the event, nor does it abort the pipeline run.
///
/// ### Usage
/// {@snippet :
/// PipelineListener composite = new CompositePipelineListener(
///     new LoggingPipelineListener(),
///     metricsListener
/// );
/// PipelineOptions options = PipelineOptions.builder().listener(composite).build();
/// }
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are
/// captured at construction and never mutated.
public final class CompositePipelineListener implements PipelineListener {

    private static final Logger logger =
            Logger.getLogger(CompositePipelineListener.class.getName());

    private final PipelineListener[] delegates;

    /// Creates a composite listener that dispatches to all provided delegates in order.
    ///
    /// @param delegates listeners to notify; must not be null, elements must not be null
    public CompositePipelineListener(PipelineListener... delegates) {
        this.delegates = delegates.clone();
    }

    @Override
    public void onRunStart(String sequenceId, int stageCount) {
        dispatch(d -> d.onRunStart(sequenceId, stageCount));
    }

    @Override
    public void onStageStart(String sequenceId, int index, Stage stage) {
        dispatch(d -> d.onStageStart(sequenceId, index, stage));
    }

    @Override
    public void onStageComplete(String sequenceId, int index, Stage stage, Duration elapsed) {
        dispatch(d -> d.onStageComplete(sequenceId, index, stage, elapsed));
    }

    @Override
    public void onStageFailed(String sequenceId, int index, Stage stage, Throwable error) {
        dispatch(d -> d.onStageFailed(sequenceId, index, stage, error));
    }

    @Override
    public void onRunComplete(String sequenceId, Duration elapsed) {
        dispatch(d -> d.onRunComplete(sequenceId, elapsed));
    }

    @Override
    public void onRunFailed(String sequenceId, PipelineException error) {
        dispatch(d -> d.onRunFailed(sequenceId, error));
    }

    @Override
    public void onSpecialization(String sequenceId, ContextShape shape) {
        dispatch(d -> d.onSpecialization(sequenceId, shape));
    }

    private void dispatch(Consumer<PipelineListener> event) {
        for (PipelineListener delegate : delegates) {
            try {
                event.accept(delegate);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Pipeline listener " + delegate.getClass().getName() + " failed",
                        e);
            }
        }
    }
}
