package io.rubix.core.transformer;

import io.rubix.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Structural description of an ordered stage sequence.
///
/// Used for logging, for validating a pipeline before committing to a run and
/// for comparing two pipeline configurations: sequences with equal expressions
/// are equivalent.
///
/// ### Contracts
/// - **Invariant**: stage expressions are ordered by their index, starting at 0
/// - **Invariant**: {@link #sequenceId()} depends only on the expression content
///
/// @param stages stage expressions in execution order, not null
public record PipelineExpression(List<StageExpression> stages) {

    public PipelineExpression {
        Objects.requireNonNull(stages, "stages must not be null");
        stages = List.copyOf(stages);
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).index() != i) {
                throw new IllegalArgumentException(
                        "Stage expression at position " + i + " has index " + stages.get(i).index());
            }
        }
    }

    public int size() {
        return stages.size();
    }

    /// @return stage names in execution order
    public List<String> stageNames() {
        List<String> names = new ArrayList<>(stages.size());
        for (StageExpression stage : stages) {
            names.add(stage.name());
        }
        return Collections.unmodifiableList(names);
    }

    /// @return sorted names of every component read or written by some stage
    public Set<String> referencedComponents() {
        Set<String> components = new TreeSet<>();
        for (StageExpression stage : stages) {
            components.addAll(stage.reads().keySet());
            components.addAll(stage.writes().keySet());
        }
        return Collections.unmodifiableSet(components);
    }

    /// Checks that every required component is referenced by at least one stage.
    ///
    /// @param required component names that must be referenced, not null
    /// @throws ConfigurationException naming the unreferenced components
    public void requireComponents(Set<String> required) throws ConfigurationException {
        Set<String> missing = new TreeSet<>(required);
        missing.removeAll(referencedComponents());
        if (!missing.isEmpty()) {
            throw new ConfigurationException(
                    "Components " + missing + " are not referenced by any stage of " + stageNames());
        }
    }

    /// Returns a stable identifier for this sequence, derived from its content.
    ///
    /// @return identifier of the form `seq-xxxxxxxx`, never null
    public String sequenceId() {
        int hash = 1;
        for (StageExpression stage : stages) {
            hash =
                    31 * hash
                            + Objects.hash(
                                    stage.name(),
                                    stage.config(),
                                    stage.index(),
                                    stage.reads(),
                                    stage.writes());
        }
        return String.format("seq-%08x", hash);
    }

    @Override
    public String toString() {
        return "Pipeline" + stages;
    }
}
