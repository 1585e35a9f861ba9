package io.conduit.core.execution.handler;

import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Parses the comma-separated child id list of composite nodes.
final class ChildNodes {

    private ChildNodes() {}

    /// Returns the trimmed, non-empty ids listed in the node prompt (else label).
    static List<String> ids(Node node) {
        List<String> ids = new ArrayList<>();
        for (String part : node.promptOrLabel().split(",")) {
            String id = part.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    /// Resolves ids against the graph, skipping unknown ones.
    static List<Node> resolve(List<String> ids, Graph graph) {
        List<Node> children = new ArrayList<>();
        for (String id : ids) {
            Optional<Node> child = graph.node(id);
            child.ifPresent(children::add);
        }
        return children;
    }
}
