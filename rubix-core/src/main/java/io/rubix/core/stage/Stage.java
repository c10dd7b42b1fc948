package io.rubix.core.stage;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.Context;
import java.util.Objects;

/// A bound stage: name, validated configuration, attribute contract and transform.
///
/// Produced by {@link io.rubix.core.transformer.Transformers#bound}. The configuration
/// has already been validated by the stage factory, so applying a stage can only
/// fail for reasons inside the numeric kernel.
///
/// ### Contracts
/// - **Invariant**: immutable after construction
/// - **Invariant**: two stages bound from the same factory and configuration have equal
///   expression forms but are distinct instances; stages use identity equality
///
/// @see io.rubix.core.transformer.StageExpression for the value-comparable description
public final class Stage {

    private final String name;
    private final RubixConfig config;
    private final AttributeContract contract;
    private final Transform transform;

    /// Creates a bound stage.
    ///
    /// @param name stage name, not null or blank
    /// @param config validated configuration snapshot, not null
    /// @param contract declared attribute contract, not null
    /// @param transform configured transform, not null
    public Stage(String name, RubixConfig config, AttributeContract contract, Transform transform) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.contract = Objects.requireNonNull(contract, "contract must not be null");
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
    }

    public String name() {
        return name;
    }

    public RubixConfig config() {
        return config;
    }

    public AttributeContract contract() {
        return contract;
    }

    public Transform transform() {
        return transform;
    }

    /// Applies the bound transform.
    ///
    /// @param context the current context, not null
    /// @return the updated context
    /// @throws Exception if the transform fails
    public Context apply(Context context) throws Exception {
        return transform.apply(context);
    }

    @Override
    public String toString() {
        return "Stage{name='" + name + "'}";
    }
}
