package io.conduit.core.graph.validation;

import io.conduit.core.graph.Graph;
import java.util.List;

/// One check run against a graph before execution.
@FunctionalInterface
public interface ValidationRule {

    /// @param graph graph to check, not null
    /// @return findings, empty when the graph passes, never null
    List<Diagnostic> check(Graph graph);
}
