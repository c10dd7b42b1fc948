package io.rubix.core.pipeline;

import io.rubix.core.context.Context;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.exception.StageExecutionException;
import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageSequence;
import io.rubix.core.transformer.ExpressionTransformer;
import io.rubix.core.transformer.PipelineExpression;
import java.util.List;

/// Contract every pipeline implementation satisfies: register an ordered stage
/// sequence once, run it over a context, describe it without running it.
///
/// ### Contracts
/// - **Precondition**: {@link #register} succeeds before {@link #run} or {@link #describe}
/// - **Invariant**: each stage executes at most once per run; nothing is retried or
///   skipped, and execution halts at the first failure
/// - **Invariant**: the registered sequence never changes after registration
///
/// @implNote Registration is single-shot and publishes the sequence through a
/// volatile field, so a registered pipeline may be shared between threads.
///
/// @see LinearTransformerPipeline for the sequential implementation
public abstract class AbstractPipeline {

    private volatile StageSequence sequence;
    private volatile PipelineExpression expression;

    protected AbstractPipeline() {}

    /// Registers the ordered stage sequence.
    ///
    /// @param stages bound stages in execution order
    /// @throws ConfigurationException if `stages` is empty, holds a null element or a
    ///     duplicate stage name, or the pipeline is already registered
    public final synchronized void register(List<Stage> stages) throws ConfigurationException {
        if (sequence != null) {
            throw new ConfigurationException(
                    "Pipeline already registered with stages " + sequence.names());
        }
        StageSequence validated = StageSequence.of(stages);
        this.expression = ExpressionTransformer.describe(validated);
        this.sequence = validated;
    }

    /// Executes the registered stages over a context.
    ///
    /// @param context input context, not null
    /// @return the context produced by the last stage, never null
    /// @throws StageExecutionException if a stage fails, naming the stage and carrying
    ///     the context as of before it ran
    public abstract Context run(Context context) throws StageExecutionException;

    /// Returns the expression form of the registered sequence. Executes nothing.
    ///
    /// @return expression form, never null
    /// @throws IllegalStateException if no sequence is registered
    public PipelineExpression describe() {
        sequence();
        return expression;
    }

    public boolean isRegistered() {
        return sequence != null;
    }

    /// Returns the registered sequence.
    ///
    /// @return registered sequence, never null
    /// @throws IllegalStateException if no sequence is registered
    protected StageSequence sequence() {
        StageSequence registered = sequence;
        if (registered == null) {
            throw new IllegalStateException("No stages registered");
        }
        return registered;
    }

    /// @return identity of the registered sequence, never null
    protected String sequenceId() {
        return describe().sequenceId();
    }
}
