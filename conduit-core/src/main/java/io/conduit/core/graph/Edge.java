package io.conduit.core.graph;

/// A directed, optionally conditioned and weighted transition between two nodes.
///
/// Both endpoints must name nodes of the owning graph; that is checked by
/// {@link io.conduit.core.graph.validation.StructuralGraphValidator}, not here.
///
/// @param fromNode source node id, not blank
/// @param toNode target node id, not blank
/// @param label display label, matched against an outcome's preferred label, never null
/// @param condition boolean condition expression, empty when unconditional, never null
/// @param weight selection weight, higher wins among unconditional edges
/// @param fidelity context fidelity hint for the target node, never null
/// @param threadId conversation thread hint for the target node, never null
/// @param loopRestart whether following this edge restarts loop bookkeeping
public record Edge(
        String fromNode,
        String toNode,
        String label,
        String condition,
        int weight,
        String fidelity,
        String threadId,
        boolean loopRestart) {

    public Edge {
        if (fromNode == null || fromNode.isBlank() || toNode == null || toNode.isBlank()) {
            throw new IllegalArgumentException("Edge must have non-empty fromNode and toNode");
        }
        label = label != null ? label : "";
        condition = condition != null ? condition : "";
        fidelity = fidelity != null ? fidelity : "";
        threadId = threadId != null ? threadId : "";
    }

    /// Creates an unlabelled, unconditional edge with weight 0.
    public static Edge of(String fromNode, String toNode) {
        return builder(fromNode, toNode).build();
    }

    public static Builder builder(String fromNode, String toNode) {
        return new Builder(fromNode, toNode);
    }

    /// Returns true when the edge carries a non-blank condition expression.
    public boolean hasCondition() {
        return !condition.isBlank();
    }

    public static final class Builder {
        private final String fromNode;
        private final String toNode;
        private String label = "";
        private String condition = "";
        private int weight;
        private String fidelity = "";
        private String threadId = "";
        private boolean loopRestart;

        private Builder(String fromNode, String toNode) {
            this.fromNode = fromNode;
            this.toNode = toNode;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder fidelity(String fidelity) {
            this.fidelity = fidelity;
            return this;
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder loopRestart(boolean loopRestart) {
            this.loopRestart = loopRestart;
            return this;
        }

        public Edge build() {
            return new Edge(
                    fromNode, toNode, label, condition, weight, fidelity, threadId, loopRestart);
        }
    }
}
