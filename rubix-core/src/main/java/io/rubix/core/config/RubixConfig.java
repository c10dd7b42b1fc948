package io.rubix.core.config;

import io.rubix.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable nested configuration handed opaquely to stage factories.
///
/// Values are looked up by `/`-separated paths, so `"galaxy/rotation/type"` reads
/// `config["galaxy"]["rotation"]["type"]`. The engine never interprets the content;
/// each stage factory validates the keys it needs when it is bound.
///
/// ### Contracts
/// - **Postcondition**: nested maps and lists are deep-copied and unmodifiable
/// - **Invariant**: equality is value equality over the nested structure
///
/// ### Usage
/// {@snippet :
/// RubixConfig config = RubixConfig.of(Map.of(
///         "galaxy", Map.of("rotation", Map.of("type", "edge-on"))));
/// String type = config.requireOneOf("galaxy/rotation/type", Set.of("face-on", "edge-on"));
/// }
///
/// @implNote Thread-safe. Instances are deeply immutable.
public final class RubixConfig {

    private static final RubixConfig EMPTY = new RubixConfig(Map.of());

    private final Map<String, Object> values;

    private RubixConfig(Map<String, Object> values) {
        this.values = values;
    }

    /// Creates a configuration from a nested map.
    ///
    /// @param values nested configuration, not null
    /// @return immutable configuration, never null
    public static RubixConfig of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new RubixConfig(freezeMap(values));
    }

    public static RubixConfig empty() {
        return EMPTY;
    }

    /// Looks up a value by path.
    ///
    /// @param path `/`-separated key path, not null
    /// @return the value, or empty if any segment is missing
    public Optional<Object> find(String path) {
        Objects.requireNonNull(path, "path must not be null");
        Object current = values;
        for (String key : path.split("/")) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(key)) {
                return Optional.empty();
            }
            current = map.get(key);
        }
        return Optional.ofNullable(current);
    }

    public boolean contains(String path) {
        return find(path).isPresent();
    }

    /// Looks up a value that must be present.
    ///
    /// @param path `/`-separated key path, not null
    /// @return the value, never null
    /// @throws ConfigurationException if any segment of the path is missing
    public Object require(String path) throws ConfigurationException {
        return find(path)
                .orElseThrow(() -> new ConfigurationException("Key " + path + " not found in config"));
    }

    public String requireString(String path) throws ConfigurationException {
        Object value = require(path);
        if (!(value instanceof String)) {
            throw typeMismatch(path, "a string", value);
        }
        return (String) value;
    }

    public double requireDouble(String path) throws ConfigurationException {
        Object value = require(path);
        if (!(value instanceof Number)) {
            throw typeMismatch(path, "a number", value);
        }
        return ((Number) value).doubleValue();
    }

    public int requireInt(String path) throws ConfigurationException {
        Object value = require(path);
        if (!(value instanceof Number)) {
            throw typeMismatch(path, "an integer", value);
        }
        double number = ((Number) value).doubleValue();
        if (number != Math.rint(number) || Math.abs(number) > Integer.MAX_VALUE) {
            throw typeMismatch(path, "an integer", value);
        }
        return (int) number;
    }

    public List<?> requireList(String path) throws ConfigurationException {
        Object value = require(path);
        if (!(value instanceof List)) {
            throw typeMismatch(path, "a list", value);
        }
        return (List<?>) value;
    }

    /// Looks up a list whose elements must all be strings.
    ///
    /// @param path `/`-separated key path, not null
    /// @return unmodifiable list, never null
    /// @throws ConfigurationException if missing, not a list, or holding non-string elements
    public List<String> requireStringList(String path) throws ConfigurationException {
        List<String> result = new ArrayList<>();
        for (Object element : requireList(path)) {
            if (!(element instanceof String)) {
                throw typeMismatch(path, "a list of strings", element);
            }
            result.add((String) element);
        }
        return Collections.unmodifiableList(result);
    }

    /// Looks up a string restricted to an enumerated set.
    ///
    /// @param path `/`-separated key path, not null
    /// @param allowed accepted values, not null
    /// @return the value, never null
    /// @throws ConfigurationException if missing or not one of `allowed`
    public String requireOneOf(String path, Set<String> allowed) throws ConfigurationException {
        String value = requireString(path);
        if (!allowed.contains(value)) {
            throw new ConfigurationException(
                    "Invalid value '" + value + "' for " + path + ", expected one of " + allowed);
        }
        return value;
    }

    /// Returns the nested configuration below a path.
    ///
    /// @param path `/`-separated key path, not null
    /// @return configuration rooted at `path`, never null
    /// @throws ConfigurationException if missing or not a map
    public RubixConfig section(String path) throws ConfigurationException {
        Object value = require(path);
        if (!(value instanceof Map)) {
            throw typeMismatch(path, "a section", value);
        }
        return new RubixConfig(freezeMap((Map<?, ?>) value));
    }

    /// @return unmodifiable nested view of the whole configuration
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static ConfigurationException typeMismatch(String path, String expected, Object actual) {
        return new ConfigurationException(
                "Key " + path + " must be " + expected + ", got " + describe(actual));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> frozen = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            frozen.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> frozen = new ArrayList<>();
            for (Object element : (List<?>) value) {
                frozen.add(freeze(element));
            }
            return Collections.unmodifiableList(frozen);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RubixConfig)) return false;
        return values.equals(((RubixConfig) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RubixConfig" + values;
    }
}
