package io.rubix.core.stage;

import io.rubix.core.context.Context;
import java.util.Objects;

/// A configured context transformation, the runtime half of a stage.
///
/// Receives the context produced by the previous stage and returns the context for
/// the next one. Implementations usually populate attributes on the given context
/// and return it, but may return a different instance with the same components.
///
/// ### Contracts
/// - **Precondition**: `context` is non-null and owned by the current run
/// - **Postcondition**: returns a non-null context with the same component names
/// - **Invariant**: pure with respect to its captured configuration; equal inputs
///   produce equal outputs
///
/// @see StageFactory for how transforms are created from configuration
@FunctionalInterface
public interface Transform {

    /// Applies this transformation.
    ///
    /// @param context the current context, not null
    /// @return the updated context, not null
    /// @throws Exception if the underlying computation fails
    Context apply(Context context) throws Exception;

    /// Composes this transform with the next one into a single transform.
    ///
    /// @param next transform applied to this transform's result, not null
    /// @return fused transform, never null
    default Transform andThen(Transform next) {
        Objects.requireNonNull(next, "next must not be null");
        return context -> next.apply(apply(context));
    }

    /// Identity transform, returns its input unchanged.
    static Transform identity() {
        return context -> context;
    }
}
