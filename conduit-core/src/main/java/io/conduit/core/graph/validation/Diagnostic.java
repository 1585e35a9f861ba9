package io.conduit.core.graph.validation;

import io.conduit.core.graph.Edge;
import java.util.Objects;

/// A single validation finding about a graph.
///
/// @param rule identifier of the rule that produced it, not null
/// @param severity how serious the issue is, not null
/// @param message description of the problem, not null
/// @param nodeId node involved, empty when not node-specific
/// @param edge edge involved, null when not edge-specific
/// @param fix suggested remedy, empty when none
public record Diagnostic(
        String rule, Severity severity, String message, String nodeId, Edge edge, String fix) {

    public Diagnostic {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        nodeId = nodeId != null ? nodeId : "";
        fix = fix != null ? fix : "";
    }

    public static Diagnostic forGraph(String rule, Severity severity, String message, String fix) {
        return new Diagnostic(rule, severity, message, "", null, fix);
    }

    public static Diagnostic forNode(
            String rule, Severity severity, String message, String nodeId, String fix) {
        return new Diagnostic(rule, severity, message, nodeId, null, fix);
    }

    public static Diagnostic forEdge(
            String rule, Severity severity, String message, Edge edge, String fix) {
        return new Diagnostic(rule, severity, message, "", edge, fix);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String location = "";
        if (!nodeId.isEmpty()) {
            location = " [node=" + nodeId + "]";
        } else if (edge != null) {
            location = " [edge=" + edge.fromNode() + "->" + edge.toNode() + "]";
        }
        return severity + location + ": " + message;
    }
}
