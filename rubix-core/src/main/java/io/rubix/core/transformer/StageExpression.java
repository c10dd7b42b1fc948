package io.rubix.core.transformer;

import io.rubix.core.config.RubixConfig;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Structural description of one bound stage, without its callable.
///
/// Two stage expressions are equal when name, configuration snapshot, position and
/// declared contract are equal, regardless of the identity of the stages they
/// describe. The maps passed in are deep-copied, so later changes to them never
/// affect equality or the sequence identifier.
///
/// @param name stage name, not null
/// @param config unmodifiable snapshot of the bound configuration, not null
/// @param index zero-based position in the sequence
/// @param reads declared reads per component, not null
/// @param writes declared writes per component, not null
/// @see ExpressionTransformer for how expressions are derived
public record StageExpression(
        String name,
        Map<String, Object> config,
        int index,
        Map<String, Set<String>> reads,
        Map<String, Set<String>> writes) {

    public StageExpression {
        Objects.requireNonNull(name, "name must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        config = RubixConfig.of(Objects.requireNonNull(config, "config must not be null")).asMap();
        reads = freeze(Objects.requireNonNull(reads, "reads must not be null"));
        writes = freeze(Objects.requireNonNull(writes, "writes must not be null"));
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        TreeMap<String, Set<String>> frozen = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : source.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(frozen);
    }

    @Override
    public String toString() {
        return "#" + (index + 1) + " " + name + config;
    }
}
