package io.rubix.core.config;

/// How a pipeline captures the last good context for failure reports.
public enum FailureSnapshot {
    /// Deep-copy the context before each stage (linear) or once per call (compiled).
    /// The reported context is exact even when the failing stage mutated its input.
    COPY,

    /// Keep only the reference handed to the failing stage. No copying cost, but
    /// the reported context may hold the failing stage's partial writes.
    REFERENCE
}
