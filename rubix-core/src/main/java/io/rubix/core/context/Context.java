package io.rubix.core.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/// The mutable record threaded through every pipeline stage.
///
/// A context groups named {@link Component}s, one per particle category (`stars`,
/// `gas`) plus any galaxy-wide group (`galaxy`). Stages read any attribute and
/// populate or overwrite the attributes they own; they never add, remove or
/// reorder components.
///
/// ### Contracts
/// - **Invariant**: the component set is fixed at construction
/// - **Invariant**: iteration over components is sorted by name, so runs never depend
///   on hash ordering
/// - **Postcondition**: {@link #copy()} returns a context equal to this one that shares
///   no mutable state with it
///
/// ### Usage
/// {@snippet :
/// Context context = Context.builder()
///         .component(new Component("stars").put("mass", ArrayAttribute.of(1.0, 2.0)))
///         .component(new Component("galaxy").putScalar("halfmassrad_stars", 3.5))
///         .build();
/// }
///
/// @implNote **Not thread-safe**. Each pipeline run owns its context exclusively.
/// @see ContextShape for the structural view used by the compiled form
public final class Context {

    private final TreeMap<String, Component> components;

    private Context(TreeMap<String, Component> components) {
        this.components = components;
    }

    /// Creates a context from the given components.
    ///
    /// @param components components with unique names, not null
    /// @return new context, never null
    /// @throws IllegalArgumentException if two components share a name
    public static Context of(Component... components) {
        Builder builder = builder();
        for (Component component : components) {
            builder.component(component);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String component) {
        return components.containsKey(component);
    }

    public Optional<Component> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    /// Returns a component that must be present.
    ///
    /// @param name component name, not null
    /// @return the component, never null
    /// @throws IllegalStateException if the context has no such component
    public Component require(String name) {
        Component component = components.get(name);
        if (component == null) {
            throw new IllegalStateException(
                    "Component '" + name + "' not found in context " + components.keySet());
        }
        return component;
    }

    /// @return sorted, unmodifiable view of the component names
    public Set<String> componentNames() {
        return Collections.unmodifiableSet(components.keySet());
    }

    /// @return components in name order, unmodifiable
    public Collection<Component> components() {
        return Collections.unmodifiableCollection(components.values());
    }

    /// Returns a deep copy of this context.
    ///
    /// @return independent copy, never null
    public Context copy() {
        TreeMap<String, Component> copied = new TreeMap<>();
        for (Map.Entry<String, Component> entry : components.entrySet()) {
            copied.put(entry.getKey(), entry.getValue().copy());
        }
        return new Context(copied);
    }

    /// Returns the structural shape of this context.
    ///
    /// ### Performance
    /// - Time: O(c * a) for c components with a attributes each; independent of array sizes
    ///
    /// @return immutable shape, never null
    public ContextShape shape() {
        return ContextShape.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Context)) return false;
        return components.equals(((Context) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Component component : components.values()) {
            parts.add(component.toString());
        }
        return "Context" + parts;
    }

    /// Builder for {@link Context}. Component names must be unique.
    public static final class Builder {
        private final TreeMap<String, Component> components = new TreeMap<>();

        private Builder() {}

        public Builder component(Component component) {
            Objects.requireNonNull(component, "component must not be null");
            if (components.containsKey(component.name())) {
                throw new IllegalArgumentException(
                        "Duplicate component name: " + component.name());
            }
            components.put(component.name(), component);
            return this;
        }

        public Context build() {
            return new Context(new TreeMap<>(components));
        }
    }
}
