package io.rubix.core.stage;

import io.rubix.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// A validated, ordered and immutable list of bound stages.
///
/// Order is significant and fixed: later stages may depend on attributes written
/// by earlier ones. No reordering or dependency inference is performed.
///
/// ### Contracts
/// - **Invariant**: non-empty
/// - **Invariant**: no null elements
/// - **Invariant**: stage names are unique
public final class StageSequence {

    private final List<Stage> stages;

    private StageSequence(List<Stage> stages) {
        this.stages = stages;
    }

    /// Validates and freezes a stage list.
    ///
    /// @param stages ordered stages
    /// @return immutable sequence, never null
    /// @throws ConfigurationException if `stages` is null or empty, holds a null element,
    ///     or two stages share a name
    public static StageSequence of(List<Stage> stages) throws ConfigurationException {
        if (stages == null || stages.isEmpty()) {
            throw new ConfigurationException("Stage sequence must contain at least one stage");
        }
        Set<String> seen = new HashSet<>();
        List<Stage> copy = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            if (stage == null) {
                throw new ConfigurationException("Stage at index " + i + " is null");
            }
            if (!seen.add(stage.name())) {
                throw new ConfigurationException(
                        "Duplicate stage name '" + stage.name() + "' at index " + i);
            }
            copy.add(stage);
        }
        return new StageSequence(Collections.unmodifiableList(copy));
    }

    /// @return stages in execution order, unmodifiable
    public List<Stage> stages() {
        return stages;
    }

    public Stage get(int index) {
        return stages.get(index);
    }

    public int size() {
        return stages.size();
    }

    /// @return stage names in execution order
    public List<String> names() {
        List<String> names = new ArrayList<>(stages.size());
        for (Stage stage : stages) {
            names.add(stage.name());
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return "StageSequence" + names();
    }
}
