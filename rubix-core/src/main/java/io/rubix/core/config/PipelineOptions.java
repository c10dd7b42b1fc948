package io.rubix.core.config;

import io.rubix.core.pipeline.PipelineListener;

/// Engine options shared by the linear and compiled pipeline forms.
///
/// ### Default Values
/// - `listener`: {@link PipelineListener#NOOP}
/// - `failureSnapshot`: {@link FailureSnapshot#COPY}
/// - `validateContracts`: `true` (linear form only)
/// - `maxSpecializations`: {@value #DEFAULT_MAX_SPECIALIZATIONS} (compiled form only)
///
/// @implNote Immutable. Use {@link #builder()} to derive variants.
/// @see io.rubix.core.pipeline.LinearTransformerPipeline
/// @see io.rubix.core.transformer.CompiledTransformer
public final class PipelineOptions {

    public static final int DEFAULT_MAX_SPECIALIZATIONS = 64;

    private static final PipelineOptions DEFAULTS = builder().build();

    private final PipelineListener listener;
    private final FailureSnapshot failureSnapshot;
    private final boolean validateContracts;
    private final int maxSpecializations;

    private PipelineOptions(Builder builder) {
        this.listener = builder.listener;
        this.failureSnapshot = builder.failureSnapshot;
        this.validateContracts = builder.validateContracts;
        this.maxSpecializations = builder.maxSpecializations;
    }

    public static PipelineOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the listener receiving run lifecycle events.
    ///
    /// @return listener, never null
    public PipelineListener getListener() {
        return listener;
    }

    /// Returns how the last good context is captured for failure reports.
    ///
    /// @return snapshot policy, never null
    public FailureSnapshot getFailureSnapshot() {
        return failureSnapshot;
    }

    /// Returns whether the linear pipeline checks attribute contracts between stages.
    ///
    /// @return `true` if contracts are checked
    public boolean isValidateContracts() {
        return validateContracts;
    }

    /// Returns how many input shapes a compiled pipeline keeps specialized at once.
    ///
    /// @return cache bound, always >= 1
    public int getMaxSpecializations() {
        return maxSpecializations;
    }

    /// Returns a builder pre-filled with this instance's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return builder()
                .listener(listener)
                .failureSnapshot(failureSnapshot)
                .validateContracts(validateContracts)
                .maxSpecializations(maxSpecializations);
    }

    /// Fluent builder for {@link PipelineOptions}.
    public static final class Builder {
        private PipelineListener listener = PipelineListener.NOOP;
        private FailureSnapshot failureSnapshot = FailureSnapshot.COPY;
        private boolean validateContracts = true;
        private int maxSpecializations = DEFAULT_MAX_SPECIALIZATIONS;

        private Builder() {}

        /// @param listener run listener, null resets to {@link PipelineListener#NOOP}
        /// @return this builder for chaining, never null
        public Builder listener(PipelineListener listener) {
            this.listener = listener != null ? listener : PipelineListener.NOOP;
            return this;
        }

        /// @param failureSnapshot snapshot policy, null resets to {@link FailureSnapshot#COPY}
        /// @return this builder for chaining, never null
        public Builder failureSnapshot(FailureSnapshot failureSnapshot) {
            this.failureSnapshot = failureSnapshot != null ? failureSnapshot : FailureSnapshot.COPY;
            return this;
        }

        /// @param validateContracts whether to check attribute contracts between stages
        /// @return this builder for chaining, never null
        public Builder validateContracts(boolean validateContracts) {
            this.validateContracts = validateContracts;
            return this;
        }

        /// @param maxSpecializations cached shapes per compiled pipeline, must be >= 1
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if `maxSpecializations` is below 1
        public Builder maxSpecializations(int maxSpecializations) {
            if (maxSpecializations < 1) {
                throw new IllegalArgumentException(
                        "maxSpecializations must be >= 1, got " + maxSpecializations);
            }
            this.maxSpecializations = maxSpecializations;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
