package io.conduit.core.graph.validation;

/// Severity of a validation finding. Only ERROR blocks a run.
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
