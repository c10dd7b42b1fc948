package io.rubix.core.context;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/// One named group of particle data inside a {@link Context}, e.g. `stars` or `gas`.
///
/// Holds array-valued attributes (`coords`, `velocity`, `mass`, ...) and scalar
/// metadata (`halfmassrad_stars`, `redshift`, ...). Attributes can be added or
/// overwritten but never removed; a component's identity inside a context is its
/// name.
///
/// ### Contracts
/// - **Invariant**: attribute and scalar iteration order is sorted by name, so two
///   components with equal content always iterate identically
/// - **Invariant**: equality is value equality over name, attributes and scalars
///   (`Double.equals` semantics, bitwise)
///
/// @implNote **Not thread-safe**. A component belongs to exactly one context and
/// one pipeline run at a time.
public final class Component {

    private final String name;
    private final TreeMap<String, ArrayAttribute> attributes;
    private final TreeMap<String, Double> scalars;

    /// Creates an empty component.
    ///
    /// @param name component name, not null or blank
    public Component(String name) {
        this(name, new TreeMap<>(), new TreeMap<>());
    }

    private Component(
            String name, TreeMap<String, ArrayAttribute> attributes, TreeMap<String, Double> scalars) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.attributes = attributes;
        this.scalars = scalars;
    }

    public String name() {
        return name;
    }

    /// Stores or overwrites an array attribute.
    ///
    /// @param attribute attribute name, not null
    /// @param value attribute data, not null
    /// @return this component for chaining, never null
    public Component put(String attribute, ArrayAttribute value) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        Objects.requireNonNull(value, "value must not be null");
        attributes.put(attribute, value);
        return this;
    }

    /// Stores or overwrites a scalar metadata value.
    ///
    /// @param key scalar name, not null
    /// @param value scalar value
    /// @return this component for chaining, never null
    public Component putScalar(String key, double value) {
        Objects.requireNonNull(key, "key must not be null");
        scalars.put(key, value);
        return this;
    }

    public boolean has(String attribute) {
        return attributes.containsKey(attribute);
    }

    public boolean hasScalar(String key) {
        return scalars.containsKey(key);
    }

    public Optional<ArrayAttribute> attribute(String attribute) {
        return Optional.ofNullable(attributes.get(attribute));
    }

    /// Returns an attribute that must be present.
    ///
    /// @param attribute attribute name, not null
    /// @return the attribute, never null
    /// @throws IllegalStateException if the attribute is absent
    public ArrayAttribute require(String attribute) {
        ArrayAttribute value = attributes.get(attribute);
        if (value == null) {
            throw new IllegalStateException(
                    "Attribute '" + attribute + "' not found in component '" + name + "'");
        }
        return value;
    }

    public OptionalDouble scalar(String key) {
        Double value = scalars.get(key);
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /// Returns a scalar that must be present.
    ///
    /// @param key scalar name, not null
    /// @return the value
    /// @throws IllegalStateException if the scalar is absent
    public double requireScalar(String key) {
        Double value = scalars.get(key);
        if (value == null) {
            throw new IllegalStateException(
                    "Scalar '" + key + "' not found in component '" + name + "'");
        }
        return value;
    }

    /// @return sorted, unmodifiable view of the attribute names
    public Set<String> attributeNames() {
        return Collections.unmodifiableSet(attributes.keySet());
    }

    /// @return sorted, unmodifiable view of the scalar names
    public Set<String> scalarNames() {
        return Collections.unmodifiableSet(scalars.keySet());
    }

    /// @return sorted, unmodifiable view of all attributes
    public Map<String, ArrayAttribute> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /// @return sorted, unmodifiable view of all scalars
    public Map<String, Double> scalars() {
        return Collections.unmodifiableMap(scalars);
    }

    /// Returns the number of particles, taken from the first attribute.
    ///
    /// @return particle count, or 0 for a component without attributes
    public int particleCount() {
        return attributes.isEmpty() ? 0 : attributes.firstEntry().getValue().rows();
    }

    /// Returns an independent copy of this component.
    ///
    /// @return deep copy, never null
    public Component copy() {
        // ArrayAttribute is immutable, sharing instances is safe
        return new Component(name, new TreeMap<>(attributes), new TreeMap<>(scalars));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Component)) return false;
        Component that = (Component) o;
        return name.equals(that.name)
                && attributes.equals(that.attributes)
                && scalars.equals(that.scalars);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, scalars);
    }

    @Override
    public String toString() {
        return "Component{name='"
                + name
                + "', attributes="
                + attributes.keySet()
                + ", scalars="
                + scalars
                + "}";
    }
}
