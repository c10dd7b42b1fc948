package io.rubix.core.stage;

import io.rubix.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link StageRegistry}.
///
/// Re-registering an existing name is rejected; a stage name maps to one definition
/// for the lifetime of the registry.
///
/// @implNote Thread-safe. Backed by a {@link ConcurrentHashMap}.
public final class DefaultStageRegistry implements StageRegistry {

    private final Map<String, StageDefinition> definitions = new ConcurrentHashMap<>();

    /// Creates an empty registry.
    public DefaultStageRegistry() {}

    /// Creates a registry with initial definitions.
    ///
    /// @param initial definitions to register, not null
    public DefaultStageRegistry(List<StageDefinition> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        initial.forEach(this::register);
    }

    @Override
    public void register(StageDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        StageDefinition existing = definitions.putIfAbsent(definition.name(), definition);
        if (existing != null) {
            throw new IllegalArgumentException(
                    "Stage already registered: " + definition.name());
        }
    }

    @Override
    public Optional<StageDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(definitions.get(name));
    }

    @Override
    public StageDefinition getOrThrow(String name) throws ConfigurationException {
        return get(name)
                .orElseThrow(
                        () ->
                                new ConfigurationException(
                                        "No stage registered under name '"
                                                + name
                                                + "', known stages: "
                                                + names()));
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return definitions.containsKey(name);
    }

    @Override
    public List<String> names() {
        List<String> names = new ArrayList<>(definitions.keySet());
        Collections.sort(names);
        return Collections.unmodifiableList(names);
    }
}
