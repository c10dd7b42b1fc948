package io.rubix.core.pipeline;

import io.rubix.core.context.ContextShape;
import io.rubix.core.exception.PipelineException;
import io.rubix.core.stage.Stage;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logs pipeline run progress through `java.util.logging`.
///
/// ### Log Format
/// ```
/// [seq-1a2b3c4d] run started: 3 stages                  INFO
/// [seq-1a2b3c4d] #1 rotate_galaxy started                FINE
/// [seq-1a2b3c4d] #1 rotate_galaxy completed in 12 ms     INFO
/// [seq-1a2b3c4d] #2 spaxel_assignment FAILED: <message>  WARNING
/// [seq-1a2b3c4d] run completed in 40 ms                  INFO
/// ```
///
/// The listener keeps no state, so one instance can be shared by concurrent runs.
///
/// @apiNote **Side effects**: writes to the log category
/// `io.rubix.core.pipeline.LoggingPipelineListener`.
public class LoggingPipelineListener implements PipelineListener {

    private static final Logger logger =
            Logger.getLogger(LoggingPipelineListener.class.getName());

    @Override
    public void onRunStart(String sequenceId, int stageCount) {
        logger.info(() -> "[" + sequenceId + "] run started: " + stageCount + " stages");
    }

    @Override
    public void onStageStart(String sequenceId, int index, Stage stage) {
        logger.fine(() -> prefix(sequenceId, index, stage) + " started");
    }

    @Override
    public void onStageComplete(String sequenceId, int index, Stage stage, Duration elapsed) {
        logger.info(
                () ->
                        prefix(sequenceId, index, stage)
                                + " completed in "
                                + elapsed.toMillis()
                                + " ms");
    }

    @Override
    public void onStageFailed(String sequenceId, int index, Stage stage, Throwable error) {
        logger.log(
                Level.WARNING,
                prefix(sequenceId, index, stage) + " FAILED: " + error.getMessage(),
                error);
    }

    @Override
    public void onRunComplete(String sequenceId, Duration elapsed) {
        logger.info(() -> "[" + sequenceId + "] run completed in " + elapsed.toMillis() + " ms");
    }

    @Override
    public void onRunFailed(String sequenceId, PipelineException error) {
        logger.warning(() -> "[" + sequenceId + "] run failed: " + error.getMessage());
    }

    @Override
    public void onSpecialization(String sequenceId, ContextShape shape) {
        logger.fine(
                () ->
                        "["
                                + sequenceId
                                + "] specialized for components "
                                + shape.components().keySet());
    }

    private static String prefix(String sequenceId, int index, Stage stage) {
        return "[" + sequenceId + "] #" + (index + 1) + " " + stage.name();
    }
}
