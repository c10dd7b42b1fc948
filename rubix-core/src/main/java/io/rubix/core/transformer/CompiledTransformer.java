package io.rubix.core.transformer;

import io.rubix.core.config.FailureSnapshot;
import io.rubix.core.config.PipelineOptions;
import io.rubix.core.context.Context;
import io.rubix.core.context.ContextShape;
import io.rubix.core.exception.StageExecutionException;
import io.rubix.core.pipeline.PipelineListener;
import io.rubix.core.stage.Stage;
import io.rubix.core.stage.StageSequence;
import io.rubix.core.stage.Transform;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Logger;

/// A stage sequence fused into one callable, specialized per input shape.
///
/// Compilation is an explicit two-phase contract:
/// 1. **Build**: {@link #specialize(ContextShape)} fuses the stage transforms into a
///    single {@link Transform} for one input shape and caches the result
/// 2. **Invoke**: {@link #apply(Context)} looks up (or builds) the specialization for
///    the input's shape and runs it
///
/// A fused call skips everything the linear pipeline does between stages: no
/// per-stage listener events, no per-stage snapshots, no contract checks. The
/// observable result is identical to
/// {@link io.rubix.core.pipeline.LinearTransformerPipeline#run} over the same stages.
///
/// ### Specialization key
/// The key is the input's {@link ContextShape}: component names, attribute names
/// with their `(rows, width)`, and scalar names. Any change in that structure
/// triggers a fresh specialization; values never do. Row counts are part of the
/// key, so inputs with varying particle counts each take a cache slot. The cache
/// holds at most {@link PipelineOptions#getMaxSpecializations()} shapes and evicts
/// the oldest one first. {@link #invalidate()} drops all cached specializations.
///
/// ### Failure reporting
/// Failures surface as {@link StageExecutionException#forSequence} carrying the
/// {@link #sequenceId()} rather than the failing inner stage. The last good context
/// is the input as of entry: one snapshot per call under
/// {@link FailureSnapshot#COPY}, the input reference under
/// {@link FailureSnapshot#REFERENCE}.
///
/// @implNote Thread-safe. The specialization cache is a {@link ConcurrentHashMap}
/// keyed by immutable shapes, and fused transforms hold no engine state, so one
/// instance may run many independent contexts concurrently.
///
/// @see Transformers#compiled
public final class CompiledTransformer {

    private static final Logger logger = Logger.getLogger(CompiledTransformer.class.getName());

    private final StageSequence sequence;
    private final PipelineOptions options;
    private final PipelineExpression expression;
    private final String sequenceId;
    private final Map<ContextShape, Specialization> specializations = new ConcurrentHashMap<>();
    private final Queue<ContextShape> insertionOrder = new ConcurrentLinkedQueue<>();

    CompiledTransformer(StageSequence sequence, PipelineOptions options) {
        this.sequence = Objects.requireNonNull(sequence, "sequence must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.expression = ExpressionTransformer.describe(sequence);
        this.sequenceId = expression.sequenceId();
    }

    /// Runs the fused sequence over a context.
    ///
    /// @param context input context, not null
    /// @return the context produced by the last stage, never null
    /// @throws StageExecutionException if any stage fails, `Error`s other than
    ///     {@link VirtualMachineError} included, or the sequence returns null
    public Context apply(Context context) throws StageExecutionException {
        Objects.requireNonNull(context, "context must not be null");
        PipelineListener listener = options.getListener();
        Specialization specialization = specialize(context.shape());
        Context lastGood =
                options.getFailureSnapshot() == FailureSnapshot.COPY ? context.copy() : context;

        listener.onRunStart(sequenceId, sequence.size());
        long start = System.nanoTime();
        Context result;
        try {
            result = specialization.invoke(context);
            if (result == null) {
                throw new IllegalStateException("Compiled sequence returned no context");
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            StageExecutionException failure =
                    StageExecutionException.forSequence(sequenceId, lastGood, e);
            listener.onRunFailed(sequenceId, failure);
            throw failure;
        }
        listener.onRunComplete(sequenceId, Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    /// Returns the specialization for a shape, building and caching it on first use.
    ///
    /// When the cache is full the oldest specialization is evicted first.
    ///
    /// @param shape input shape, not null
    /// @return cached or freshly built specialization, never null
    public Specialization specialize(ContextShape shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        Specialization cached = specializations.get(shape);
        if (cached != null) {
            return cached;
        }
        while (specializations.size() >= options.getMaxSpecializations()) {
            ContextShape oldest = insertionOrder.poll();
            if (oldest == null) {
                break;
            }
            specializations.remove(oldest);
            logger.fine(() -> "Evicted a specialization of sequence " + sequenceId);
        }
        return specializations.computeIfAbsent(
                shape,
                key -> {
                    Specialization built = build(key);
                    insertionOrder.add(key);
                    return built;
                });
    }

    private Specialization build(ContextShape shape) {
        Transform fused = sequence.get(0).transform();
        for (int i = 1; i < sequence.size(); i++) {
            fused = fused.andThen(sequence.get(i).transform());
        }

        List<String> unresolved = unresolvedReads(shape);
        if (!unresolved.isEmpty()) {
            logger.warning(
                    "Sequence "
                            + sequenceId
                            + " specialized for a shape missing declared reads "
                            + unresolved);
        }
        logger.fine(
                () ->
                        "Specialized sequence "
                                + sequenceId
                                + " for components "
                                + shape.components().keySet());
        options.getListener().onSpecialization(sequenceId, shape);
        return new Specialization(shape, fused, unresolved);
    }

    // Reads neither present in the input nor declared as written by an earlier stage
    private List<String> unresolvedReads(ContextShape shape) {
        Map<String, Set<String>> written = new HashMap<>();
        List<String> unresolved = new ArrayList<>();
        for (Stage stage : sequence.stages()) {
            for (Map.Entry<String, Set<String>> read : stage.contract().reads().entrySet()) {
                String component = read.getKey();
                for (String attribute : read.getValue()) {
                    boolean produced =
                            written.getOrDefault(component, Set.of()).contains(attribute);
                    if (!produced && !shape.has(component, attribute)) {
                        unresolved.add(stage.name() + ":" + component + "." + attribute);
                    }
                }
            }
            for (Map.Entry<String, Set<String>> write : stage.contract().writes().entrySet()) {
                written.computeIfAbsent(write.getKey(), k -> new HashSet<>())
                        .addAll(write.getValue());
            }
        }
        return Collections.unmodifiableList(unresolved);
    }

    /// @return number of cached specializations
    public int specializationCount() {
        return specializations.size();
    }

    /// @param shape input shape, not null
    /// @return whether a specialization for `shape` is cached
    public boolean isSpecialized(ContextShape shape) {
        return specializations.containsKey(shape);
    }

    /// Drops every cached specialization. The next call rebuilds on demand.
    public void invalidate() {
        specializations.clear();
        insertionOrder.clear();
        logger.fine(() -> "Invalidated specializations of sequence " + sequenceId);
    }

    /// @return stable identifier of the fused sequence, never null
    public String sequenceId() {
        return sequenceId;
    }

    /// @return expression form of the fused sequence; unaffected by the cache
    public PipelineExpression expression() {
        return expression;
    }

    public StageSequence sequence() {
        return sequence;
    }

    /// One fused closure built for one input shape.
    public static final class Specialization {

        private final ContextShape shape;
        private final Transform fused;
        private final List<String> unresolvedReads;

        private Specialization(ContextShape shape, Transform fused, List<String> unresolvedReads) {
            this.shape = shape;
            this.fused = fused;
            this.unresolvedReads = unresolvedReads;
        }

        public ContextShape shape() {
            return shape;
        }

        /// Declared reads this shape cannot satisfy, as `stage:component.attribute`.
        ///
        /// Informational only: the fused call still runs and the affected stage fails
        /// on its own terms.
        ///
        /// @return unmodifiable list, empty when every read resolves
        public List<String> unresolvedReads() {
            return unresolvedReads;
        }

        Context invoke(Context context) throws Exception {
            return fused.apply(context);
        }
    }
}
