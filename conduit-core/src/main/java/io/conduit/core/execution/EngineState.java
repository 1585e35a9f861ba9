package io.conduit.core.execution;

/// Lifecycle state of a {@link PipelineEngine} run.
public enum EngineState {
    RUNNING,
    COMPLETED,
    FAILED
}
