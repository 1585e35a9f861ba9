package io.conduit.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable pipeline graph: nodes, ordered edges and graph-level attributes.
///
/// Graph attributes carry run-wide defaults. The engine recognizes:
/// - `goal` - substituted for `$goal` in node prompts
/// - `default_max_retry` - integer retry count for nodes that declare none
/// - `retry_target`, `fallback_retry_target` - redirect targets for unsatisfied goal gates
///
/// ### Contracts
/// - **Invariant**: node iteration order is declaration order
/// - **Invariant**: edge order is declaration order; edge selection depends on it
///
/// A well-formed graph has one discoverable start node and at least one exit node.
/// The graph itself does not enforce this; see
/// {@link io.conduit.core.graph.validation.StructuralGraphValidator}.
///
/// @implNote Thread-safe. All collections are unmodifiable copies.
public final class Graph {

    private static final List<String> START_IDS = List.of("start", "Start");
    private static final List<String> EXIT_IDS = List.of("exit", "end", "Exit", "End");

    private final String name;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, String> attributes;

    private Graph(
            String name, Map<String, Node> nodes, List<Edge> edges, Map<String, String> attributes) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getName() {
        return name;
    }

    public Map<String, Node> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /// Returns the pipeline-level goal, or an empty string.
    public String goal() {
        return attributes.getOrDefault("goal", "");
    }

    /// Looks up a node by id.
    ///
    /// @param nodeId node identifier, not null
    /// @return the node, or empty if absent
    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// Finds the start node: the first `Mdiamond` node, else a node named `start`/`Start`.
    ///
    /// @return the start node, or empty if none is discoverable
    public Optional<Node> startNode() {
        return findByShapeOrId(NodeShape.START, START_IDS);
    }

    /// Finds the exit node: the first `Msquare` node, else `exit`/`end`/`Exit`/`End`.
    ///
    /// @return the exit node, or empty if none is discoverable
    public Optional<Node> exitNode() {
        return findByShapeOrId(NodeShape.EXIT, EXIT_IDS);
    }

    /// Returns whether reaching the given node completes the run.
    ///
    /// Any `Msquare` node is terminal, so graphs may declare several exits.
    /// A node without the exit shape is terminal only if it is the discovered exit node.
    ///
    /// @param node node to test, not null
    /// @return true if the node is an exit
    public boolean isExitNode(Node node) {
        if (NodeShape.EXIT.equals(node.getShape())) {
            return true;
        }
        return exitNode().map(exit -> exit.getId().equals(node.getId())).orElse(false);
    }

    /// Returns all edges leaving the given node, in declaration order.
    public List<Edge> outgoingEdges(String nodeId) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.fromNode().equals(nodeId)) {
                result.add(edge);
            }
        }
        return result;
    }

    /// Returns all edges arriving at the given node, in declaration order.
    public List<Edge> incomingEdges(String nodeId) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.toNode().equals(nodeId)) {
                result.add(edge);
            }
        }
        return result;
    }

    /// Returns the ids of every node reachable from the given node, including itself.
    ///
    /// Uses an explicit stack, so deep or cyclic graphs are safe.
    ///
    /// @param nodeId starting node id, not null
    /// @return reachable node ids, never null
    public Set<String> reachableFrom(String nodeId) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(nodeId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (Edge edge : outgoingEdges(current)) {
                stack.push(edge.toNode());
            }
        }
        return visited;
    }

    /// Returns a copy of this graph with the given nodes replacing existing ones by id.
    ///
    /// @param replacements nodes to substitute, not null
    /// @return new graph, never null
    public Graph withNodes(Collection<Node> replacements) {
        Map<String, Node> updated = new LinkedHashMap<>(nodes);
        for (Node node : replacements) {
            updated.put(node.getId(), node);
        }
        return new Graph(name, updated, edges, attributes);
    }

    private Optional<Node> findByShapeOrId(String shape, List<String> fallbackIds) {
        for (Node node : nodes.values()) {
            if (shape.equals(node.getShape())) {
                return Optional.of(node);
            }
        }
        for (String id : fallbackIds) {
            Node node = nodes.get(id);
            if (node != null) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "Graph{name='" + name + "', nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }

    /// Fluent builder for graphs.
    public static final class Builder {
        private final String name;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /// Adds a node.
        ///
        /// @throws IllegalArgumentException if a node with the same id was already added
        public Builder node(Node node) {
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
            return this;
        }

        public Builder edge(Edge edge) {
            edges.add(edge);
            return this;
        }

        public Builder edge(String fromNode, String toNode) {
            return edge(Edge.of(fromNode, toNode));
        }

        public Builder attribute(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        public Graph build() {
            return new Graph(name, nodes, edges, attributes);
        }
    }
}
