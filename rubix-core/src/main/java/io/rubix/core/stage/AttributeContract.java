package io.rubix.core.stage;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Attributes a stage reads and writes, declared per component.
///
/// The linear pipeline uses the contract to check, before each stage runs, that
/// every declared read is present, and after it runs, that it added no attribute
/// outside its declared writes. Expression forms expose the contract so that a
/// pipeline can be validated without running it.
///
/// A contract built with {@link #undeclared()} opts out of write checking; its
/// reads are empty, so nothing is checked for the stage.
///
/// ### Usage
/// {@snippet :
/// AttributeContract contract = AttributeContract.builder()
///         .reads("stars", "coords")
///         .writes("stars", "pixel_assignment", "spatial_bin_edges")
///         .build();
/// }
///
/// @param reads component name to attribute names required before the stage runs, not null
/// @param writes component name to attribute names the stage owns, not null
/// @param declared whether the stage declared its contract at all
public record AttributeContract(
        Map<String, Set<String>> reads, Map<String, Set<String>> writes, boolean declared) {

    private static final AttributeContract UNDECLARED =
            new AttributeContract(Map.of(), Map.of(), false);

    public AttributeContract {
        reads = freeze(Objects.requireNonNull(reads, "reads must not be null"));
        writes = freeze(Objects.requireNonNull(writes, "writes must not be null"));
    }

    /// Contract of a stage that declares nothing; no checks apply to it.
    ///
    /// @return shared undeclared contract, never null
    public static AttributeContract undeclared() {
        return UNDECLARED;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @param component component name
    /// @return attributes read from the component, empty if none
    public Set<String> readsOf(String component) {
        return reads.getOrDefault(component, Set.of());
    }

    /// @param component component name
    /// @return attributes written to the component, empty if none
    public Set<String> writesOf(String component) {
        return writes.getOrDefault(component, Set.of());
    }

    /// Returns whether the stage may add the given attribute.
    ///
    /// @param component component name, not null
    /// @param attribute attribute name, not null
    /// @return `true` for undeclared contracts or declared writes
    public boolean allowsWrite(String component, String attribute) {
        return !declared || writesOf(component).contains(attribute);
    }

    /// @return sorted names of all components read or written
    public Set<String> referencedComponents() {
        Set<String> names = new TreeSet<>(reads.keySet());
        names.addAll(writes.keySet());
        return Collections.unmodifiableSet(names);
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        TreeMap<String, Set<String>> frozen = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : source.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(frozen);
    }

    /// Fluent builder for declared contracts.
    public static final class Builder {
        private final Map<String, Set<String>> reads = new TreeMap<>();
        private final Map<String, Set<String>> writes = new TreeMap<>();

        private Builder() {}

        public Builder reads(String component, String... attributes) {
            reads.computeIfAbsent(component, k -> new TreeSet<>()).addAll(Arrays.asList(attributes));
            return this;
        }

        public Builder writes(String component, String... attributes) {
            writes.computeIfAbsent(component, k -> new TreeSet<>()).addAll(Arrays.asList(attributes));
            return this;
        }

        public AttributeContract build() {
            return new AttributeContract(reads, writes, true);
        }
    }
}
