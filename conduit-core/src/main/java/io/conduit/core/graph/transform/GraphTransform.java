package io.conduit.core.graph.transform;

import io.conduit.core.graph.Graph;

/// A graph-to-graph rewrite applied before a run starts.
///
/// Transforms never mutate their input; they return the same instance when
/// there is nothing to change.
@FunctionalInterface
public interface GraphTransform {

    /// @param graph input graph, not null
    /// @return transformed graph, never null
    Graph apply(Graph graph);
}
