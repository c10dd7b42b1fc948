package io.rubix.core.exception;

import io.rubix.core.context.Context;
import java.io.Serial;
import java.util.Optional;

/// Thrown when the attribute contract between two stages is broken.
///
/// Detected only by {@link io.rubix.core.pipeline.LinearTransformerPipeline}, which
/// checks between stages that:
/// - every attribute a stage declares as read is present before it runs
/// - a stage returns a non-null context with the same component set
/// - a stage adds no attribute outside its declared writes
///
/// Compiled pipelines skip these checks; the same fault there surfaces as a plain
/// {@link StageExecutionException}.
public class ContractViolationException extends StageExecutionException {

    @Serial private static final long serialVersionUID = -4113306618273305528L;

    private final String component;
    private final String attribute;

    private ContractViolationException(
            String message,
            String stageName,
            int stageIndex,
            String sequenceId,
            Context lastGoodContext,
            String component,
            String attribute) {
        super(message, stageName, stageIndex, sequenceId, lastGoodContext, null);
        this.component = component;
        this.attribute = attribute;
    }

    /// A stage requires an attribute that no earlier stage produced.
    ///
    /// @param stageName name of the stage declaring the read, not null
    /// @param stageIndex zero-based position of that stage
    /// @param sequenceId identity of the stage sequence, may be null
    /// @param context context handed to the stage, not null
    /// @param component component holding the missing attribute, not null
    /// @param attribute missing attribute name, not null
    /// @return new exception, never null
    public static ContractViolationException missingAttribute(
            String stageName,
            int stageIndex,
            String sequenceId,
            Context context,
            String component,
            String attribute) {
        return new ContractViolationException(
                "Stage #"
                        + (stageIndex + 1)
                        + " '"
                        + stageName
                        + "' requires "
                        + component
                        + "."
                        + attribute
                        + " which is not present",
                stageName,
                stageIndex,
                sequenceId,
                context,
                component,
                attribute);
    }

    /// A stage wrote an attribute outside its declared writes.
    ///
    /// @param stageName name of the offending stage, not null
    /// @param stageIndex zero-based position of that stage
    /// @param sequenceId identity of the stage sequence, may be null
    /// @param lastGoodContext context as of before the stage ran, may be null
    /// @param component component holding the undeclared attribute, not null
    /// @param attribute undeclared attribute name, not null
    /// @return new exception, never null
    public static ContractViolationException undeclaredWrite(
            String stageName,
            int stageIndex,
            String sequenceId,
            Context lastGoodContext,
            String component,
            String attribute) {
        return new ContractViolationException(
                "Stage #"
                        + (stageIndex + 1)
                        + " '"
                        + stageName
                        + "' wrote undeclared attribute "
                        + component
                        + "."
                        + attribute,
                stageName,
                stageIndex,
                sequenceId,
                lastGoodContext,
                component,
                attribute);
    }

    /// A stage returned null or changed the set of components.
    ///
    /// @param stageName name of the offending stage, not null
    /// @param stageIndex zero-based position of that stage
    /// @param sequenceId identity of the stage sequence, may be null
    /// @param lastGoodContext context as of before the stage ran, may be null
    /// @param detail what was wrong with the returned context, not null
    /// @return new exception, never null
    public static ContractViolationException malformedResult(
            String stageName,
            int stageIndex,
            String sequenceId,
            Context lastGoodContext,
            String detail) {
        return new ContractViolationException(
                "Stage #" + (stageIndex + 1) + " '" + stageName + "' " + detail,
                stageName,
                stageIndex,
                sequenceId,
                lastGoodContext,
                null,
                null);
    }

    /// @return component involved in the violation, empty for malformed results
    public Optional<String> component() {
        return Optional.ofNullable(component);
    }

    /// @return attribute involved in the violation, empty for malformed results
    public Optional<String> attribute() {
        return Optional.ofNullable(attribute);
    }
}
