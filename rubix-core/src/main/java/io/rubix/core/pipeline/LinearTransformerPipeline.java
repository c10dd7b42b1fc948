package io.rubix.core.pipeline;

import io.rubix.core.config.FailureSnapshot;
import io.rubix.core.config.PipelineOptions;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.exception.ContractViolationException;
import io.rubix.core.exception.StageExecutionException;
import io.rubix.core.stage.AttributeContract;
import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageSequence;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Strictly sequential, non-branching pipeline.
///
/// Stage `i + 1` receives exactly the context returned by stage `i`, in registration
/// order, on the calling thread.
///
/// ### Contracts
/// - **Postcondition**: `run(c)` equals the left fold of the stage transforms over `c`
/// - **Invariant**: given equal inputs, repeated runs produce equal contexts; the engine
///   adds no randomness and iterates components and attributes in sorted order
///
/// ### Checks between stages
/// With {@link PipelineOptions#isValidateContracts()} enabled (the default):
/// - declared reads must be present before a stage runs
/// - the returned context must have the same components as its input
/// - a stage with a declared contract must add only attributes it declares as written
///
/// A stage returning `null` is always reported as a {@link ContractViolationException}.
/// Any error a stage throws, `Error`s such as a failed `assert` included, is wrapped
/// in a {@link StageExecutionException}; only {@link VirtualMachineError}s propagate
/// unwrapped.
///
/// ### Performance
/// - Time: O(n) stage invocations plus O(n * a) for contract checks, a = attributes
///   per context. Under {@link FailureSnapshot#COPY} each stage also pays one shallow
///   copy of the component maps; array data is shared, never copied.
///
/// @implNote Thread-safe after construction. Each call to {@link #run} owns its
/// context; concurrent runs must use separate contexts.
///
/// @see io.rubix.core.transformer.CompiledTransformer for the fused form
public class LinearTransformerPipeline extends AbstractPipeline {

    private static final Logger logger =
            Logger.getLogger(LinearTransformerPipeline.class.getName());

    private final PipelineOptions options;

    /// Creates a pipeline with default options.
    ///
    /// @param stages bound stages in execution order
    /// @throws ConfigurationException if `stages` is empty or holds duplicate names
    public LinearTransformerPipeline(List<Stage> stages) throws ConfigurationException {
        this(stages, PipelineOptions.defaults());
    }

    /// Creates a pipeline.
    ///
    /// @param stages bound stages in execution order
    /// @param options listener, snapshot policy and contract checking, not null
    /// @throws ConfigurationException if `stages` is empty or holds duplicate names
    public LinearTransformerPipeline(List<Stage> stages, PipelineOptions options)
            throws ConfigurationException {
        this.options = Objects.requireNonNull(options, "options must not be null");
        register(stages);
    }

    @Override
    public Context run(Context context) throws StageExecutionException {
        Objects.requireNonNull(context, "context must not be null");
        StageSequence stages = sequence();
        String sequenceId = sequenceId();
        PipelineListener listener = options.getListener();
        boolean validate = options.isValidateContracts();

        listener.onRunStart(sequenceId, stages.size());
        logger.fine(() -> "Running " + sequenceId + " " + stages.names());
        long runStart = System.nanoTime();

        Context current = context;
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            try {
                current = runStage(i, stage, current, sequenceId, listener, validate);
            } catch (StageExecutionException e) {
                listener.onRunFailed(sequenceId, e);
                throw e;
            }
        }

        listener.onRunComplete(sequenceId, Duration.ofNanos(System.nanoTime() - runStart));
        return current;
    }

    private Context runStage(
            int index,
            Stage stage,
            Context input,
            String sequenceId,
            PipelineListener listener,
            boolean validate)
            throws StageExecutionException {
        if (validate) {
            checkReads(index, stage, input, sequenceId);
        }
        Context lastGood =
                options.getFailureSnapshot() == FailureSnapshot.COPY ? input.copy() : input;
        Map<String, Set<String>> attributesBefore =
                validate && stage.contract().declared() ? attributeNames(input) : null;
        Set<String> componentsBefore = validate ? Set.copyOf(input.componentNames()) : null;

        listener.onStageStart(sequenceId, index, stage);
        long start = System.nanoTime();
        Context output;
        try {
            output = stage.apply(input);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            listener.onStageFailed(sequenceId, index, stage, e);
            throw StageExecutionException.forStage(stage.name(), index, sequenceId, lastGood, e);
        }

        try {
            checkResult(
                    index, stage, output, componentsBefore, attributesBefore, sequenceId, lastGood);
        } catch (ContractViolationException e) {
            listener.onStageFailed(sequenceId, index, stage, e);
            throw e;
        }

        listener.onStageComplete(
                sequenceId, index, stage, Duration.ofNanos(System.nanoTime() - start));
        return output;
    }

    private static void checkResult(
            int index,
            Stage stage,
            Context output,
            Set<String> componentsBefore,
            Map<String, Set<String>> attributesBefore,
            String sequenceId,
            Context lastGood)
            throws ContractViolationException {
        if (output == null) {
            throw ContractViolationException.malformedResult(
                    stage.name(), index, sequenceId, lastGood, "returned no context");
        }
        if (componentsBefore != null && !output.componentNames().equals(componentsBefore)) {
            throw ContractViolationException.malformedResult(
                    stage.name(),
                    index,
                    sequenceId,
                    lastGood,
                    "changed components from "
                            + componentsBefore
                            + " to "
                            + output.componentNames());
        }
        if (attributesBefore != null) {
            checkWrites(index, stage, output, attributesBefore, sequenceId, lastGood);
        }
    }

    private static void checkReads(int index, Stage stage, Context input, String sequenceId)
            throws ContractViolationException {
        for (Map.Entry<String, Set<String>> read : stage.contract().reads().entrySet()) {
            String component = read.getKey();
            for (String attribute : read.getValue()) {
                boolean present =
                        input.component(component).map(c -> c.has(attribute)).orElse(false);
                if (!present) {
                    throw ContractViolationException.missingAttribute(
                            stage.name(), index, sequenceId, input, component, attribute);
                }
            }
        }
    }

    private static void checkWrites(
            int index,
            Stage stage,
            Context output,
            Map<String, Set<String>> before,
            String sequenceId,
            Context lastGood)
            throws ContractViolationException {
        AttributeContract contract = stage.contract();
        for (Component component : output.components()) {
            Set<String> previous = before.getOrDefault(component.name(), Set.of());
            for (String attribute : component.attributeNames()) {
                if (!previous.contains(attribute)
                        && !contract.allowsWrite(component.name(), attribute)) {
                    throw ContractViolationException.undeclaredWrite(
                            stage.name(),
                            index,
                            sequenceId,
                            lastGood,
                            component.name(),
                            attribute);
                }
            }
        }
    }

    private static Map<String, Set<String>> attributeNames(Context context) {
        Map<String, Set<String>> names = new HashMap<>();
        for (Component component : context.components()) {
            names.put(component.name(), new HashSet<>(component.attributeNames()));
        }
        return names;
    }

    public PipelineOptions options() {
        return options;
    }
}
