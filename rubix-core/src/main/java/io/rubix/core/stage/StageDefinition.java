package io.rubix.core.stage;

import java.util.Objects;

/// A named, unbound stage: the factory plus the contract its transforms honour.
///
/// Definitions are registered once in a {@link StageRegistry} and bound to a
/// configuration per pipeline via {@link io.rubix.core.transformer.Transformers#bind}.
///
/// @param name unique stage name, not null or blank
/// @param factory creates the transform from configuration, not null
/// @param contract attributes read and written, not null
public record StageDefinition(String name, StageFactory factory, AttributeContract contract) {

    public StageDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(factory, "factory must not be null");
        Objects.requireNonNull(contract, "contract must not be null");
    }

    /// Creates a definition without a declared contract.
    ///
    /// @param name unique stage name, not null
    /// @param factory creates the transform from configuration, not null
    /// @return new definition, never null
    public static StageDefinition of(String name, StageFactory factory) {
        return new StageDefinition(name, factory, AttributeContract.undeclared());
    }
}
