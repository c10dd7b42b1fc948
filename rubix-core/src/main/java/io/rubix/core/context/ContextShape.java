package io.rubix.core.context;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Structural description of a {@link Context}: which components exist, which
/// attributes each holds and with which `(rows, width)` shape, and which scalar
/// names are set. Values are not part of the shape.
///
/// Two contexts with equal shapes can share one compiled specialization.
///
/// @param components per-component shapes keyed by component name, sorted, not null
/// @see io.rubix.core.transformer.CompiledTransformer
public record ContextShape(Map<String, ComponentShape> components) {

    public ContextShape {
        Objects.requireNonNull(components, "components must not be null");
        components = Collections.unmodifiableMap(new TreeMap<>(components));
    }

    static ContextShape of(Context context) {
        TreeMap<String, ComponentShape> shapes = new TreeMap<>();
        for (Component component : context.components()) {
            shapes.put(component.name(), ComponentShape.of(component));
        }
        return new ContextShape(shapes);
    }

    /// @param component component name
    /// @param attribute attribute name
    /// @return whether the shape holds the given attribute
    public boolean has(String component, String attribute) {
        ComponentShape shape = components.get(component);
        return shape != null && shape.attributes().containsKey(attribute);
    }

    /// Shape of one component.
    ///
    /// @param attributes attribute name to `[rows, width]`, sorted, not null
    /// @param scalars sorted scalar names, not null
    public record ComponentShape(Map<String, List<Integer>> attributes, Set<String> scalars) {

        public ComponentShape {
            Objects.requireNonNull(attributes, "attributes must not be null");
            Objects.requireNonNull(scalars, "scalars must not be null");
            attributes = Collections.unmodifiableMap(new TreeMap<>(attributes));
            scalars = Collections.unmodifiableSet(new TreeSet<>(scalars));
        }

        static ComponentShape of(Component component) {
            TreeMap<String, List<Integer>> attributes = new TreeMap<>();
            for (Map.Entry<String, ArrayAttribute> entry : component.attributes().entrySet()) {
                ArrayAttribute value = entry.getValue();
                attributes.put(entry.getKey(), List.of(value.rows(), value.width()));
            }
            return new ComponentShape(attributes, component.scalarNames());
        }
    }
}
