package io.conduit.core.graph.validation;

import io.conduit.core.condition.ConditionEvaluator;
import io.conduit.core.condition.ConditionSyntaxException;
import io.conduit.core.execution.handler.HandlerTypes;
import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.graph.NodeShape;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Built-in graph validator.
///
/// ### Errors
/// | Rule | Check |
/// |---|---|
/// | `start_node` | exactly one start node is discoverable |
/// | `terminal_node` | an exit node is discoverable |
/// | `reachability` | every node is reachable from the start |
/// | `edge_target_exists` | both edge endpoints exist |
/// | `start_no_incoming` | nothing points back at the start node |
/// | `exit_no_outgoing` | exit nodes have no outgoing edges |
/// | `condition_syntax` | every edge condition parses |
///
/// ### Warnings
/// | Rule | Check |
/// |---|---|
/// | `type_known` | explicit node types name a built-in handler |
/// | `fidelity_valid` | fidelity values are recognized |
/// | `retry_target_exists` | retry targets name existing nodes |
/// | `goal_gate_has_retry` | goal gates have somewhere to retry to |
/// | `prompt_on_llm_nodes` | generation nodes have a prompt or label |
///
/// Extra rules passed to the constructor run after the built-in ones.
public final class StructuralGraphValidator implements GraphValidator {

    static final Set<String> KNOWN_TYPES =
            Set.of(
                    HandlerTypes.START,
                    HandlerTypes.EXIT,
                    HandlerTypes.CODERGEN,
                    HandlerTypes.WAIT_HUMAN,
                    HandlerTypes.CONDITIONAL,
                    HandlerTypes.PARALLEL,
                    HandlerTypes.FAN_IN,
                    HandlerTypes.TOOL,
                    HandlerTypes.STACK_MANAGER_LOOP);

    static final Set<String> VALID_FIDELITY =
            Set.of("full", "truncate", "compact", "summary:low", "summary:medium", "summary:high");

    private final List<ValidationRule> rules;

    public StructuralGraphValidator() {
        this(List.of());
    }

    /// @param extraRules additional rules run after the built-in ones, not null
    public StructuralGraphValidator(List<ValidationRule> extraRules) {
        List<ValidationRule> all = new ArrayList<>();
        all.add(StructuralGraphValidator::checkStartNode);
        all.add(StructuralGraphValidator::checkTerminalNode);
        all.add(StructuralGraphValidator::checkReachability);
        all.add(StructuralGraphValidator::checkEdgeTargets);
        all.add(StructuralGraphValidator::checkStartNoIncoming);
        all.add(StructuralGraphValidator::checkExitNoOutgoing);
        all.add(StructuralGraphValidator::checkConditionSyntax);
        all.add(StructuralGraphValidator::checkTypeKnown);
        all.add(StructuralGraphValidator::checkFidelity);
        all.add(StructuralGraphValidator::checkRetryTargets);
        all.add(StructuralGraphValidator::checkGoalGateHasRetry);
        all.add(StructuralGraphValidator::checkPromptOnLlmNodes);
        all.addAll(extraRules);
        this.rules = List.copyOf(all);
    }

    @Override
    public List<Diagnostic> validate(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.check(graph));
        }
        return diagnostics;
    }

    static List<Diagnostic> checkStartNode(Graph graph) {
        List<Node> shaped =
                graph.getNodes().values().stream()
                        .filter(n -> NodeShape.START.equals(n.getShape()))
                        .toList();
        if (shaped.size() > 1) {
            List<Diagnostic> diagnostics = new ArrayList<>();
            for (Node node : shaped) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "start_node",
                                Severity.ERROR,
                                "Multiple start nodes found; '" + node.getId() + "' is one of them",
                                node.getId(),
                                "Keep exactly one node with shape=Mdiamond"));
            }
            return diagnostics;
        }
        if (graph.startNode().isEmpty()) {
            return List.of(
                    Diagnostic.forGraph(
                            "start_node",
                            Severity.ERROR,
                            "No start node found",
                            "Add a node with shape=Mdiamond"));
        }
        return List.of();
    }

    static List<Diagnostic> checkTerminalNode(Graph graph) {
        if (graph.exitNode().isEmpty()) {
            return List.of(
                    Diagnostic.forGraph(
                            "terminal_node",
                            Severity.ERROR,
                            "No exit node found",
                            "Add a node with shape=Msquare"));
        }
        return List.of();
    }

    static List<Diagnostic> checkReachability(Graph graph) {
        Optional<Node> start = graph.startNode();
        if (start.isEmpty()) {
            return List.of();
        }
        Set<String> reachable = graph.reachableFrom(start.get().getId());
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String nodeId : graph.getNodes().keySet()) {
            if (!reachable.contains(nodeId)) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "reachability",
                                Severity.ERROR,
                                "Node '" + nodeId + "' is not reachable from '" + start.get().getId() + "'",
                                nodeId,
                                "Add an edge path from the start node"));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkEdgeTargets(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Edge edge : graph.getEdges()) {
            if (graph.node(edge.fromNode()).isEmpty()) {
                diagnostics.add(
                        Diagnostic.forEdge(
                                "edge_target_exists",
                                Severity.ERROR,
                                "Edge references missing source node '" + edge.fromNode() + "'",
                                edge,
                                "Define node '" + edge.fromNode() + "' or fix the edge"));
            }
            if (graph.node(edge.toNode()).isEmpty()) {
                diagnostics.add(
                        Diagnostic.forEdge(
                                "edge_target_exists",
                                Severity.ERROR,
                                "Edge references missing target node '" + edge.toNode() + "'",
                                edge,
                                "Define node '" + edge.toNode() + "' or fix the edge"));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkStartNoIncoming(Graph graph) {
        return graph.startNode()
                .filter(start -> !graph.incomingEdges(start.getId()).isEmpty())
                .map(
                        start ->
                                List.of(
                                        Diagnostic.forNode(
                                                "start_no_incoming",
                                                Severity.ERROR,
                                                "Start node '"
                                                        + start.getId()
                                                        + "' has "
                                                        + graph.incomingEdges(start.getId()).size()
                                                        + " incoming edge(s)",
                                                start.getId(),
                                                "Remove edges into the start node")))
                .orElse(List.of());
    }

    static List<Diagnostic> checkExitNoOutgoing(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            if (graph.isExitNode(node) && !graph.outgoingEdges(node.getId()).isEmpty()) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "exit_no_outgoing",
                                Severity.ERROR,
                                "Exit node '" + node.getId() + "' has outgoing edges",
                                node.getId(),
                                "Remove edges leaving the exit node"));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkConditionSyntax(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Edge edge : graph.getEdges()) {
            try {
                ConditionEvaluator.parse(edge.condition());
            } catch (ConditionSyntaxException e) {
                diagnostics.add(
                        Diagnostic.forEdge(
                                "condition_syntax",
                                Severity.ERROR,
                                e.getMessage(),
                                edge,
                                "Use key=value or key!=value clauses joined by &&"));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkTypeKnown(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            if (!node.getType().isEmpty() && !KNOWN_TYPES.contains(node.getType())) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "type_known",
                                Severity.WARNING,
                                "Node '" + node.getId() + "' has unrecognized type '" + node.getType() + "'",
                                node.getId(),
                                "Use one of " + new TreeSet<>(KNOWN_TYPES) + " or register a handler"));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkFidelity(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            if (!node.getFidelity().isEmpty() && !VALID_FIDELITY.contains(node.getFidelity())) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "fidelity_valid",
                                Severity.WARNING,
                                "Node '" + node.getId() + "' has invalid fidelity '" + node.getFidelity() + "'",
                                node.getId(),
                                "Use one of " + new TreeSet<>(VALID_FIDELITY)));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkRetryTargets(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            for (String target : List.of(node.getRetryTarget(), node.getFallbackRetryTarget())) {
                if (!target.isEmpty() && graph.node(target).isEmpty()) {
                    diagnostics.add(
                            Diagnostic.forNode(
                                    "retry_target_exists",
                                    Severity.WARNING,
                                    "Node '" + node.getId() + "' retries to missing node '" + target + "'",
                                    node.getId(),
                                    "Ensure node '" + target + "' exists"));
                }
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkGoalGateHasRetry(Graph graph) {
        boolean graphLevel =
                !graph.getAttributes().getOrDefault("retry_target", "").isEmpty()
                        || !graph.getAttributes().getOrDefault("fallback_retry_target", "").isEmpty();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            if (node.isGoalGate()
                    && node.getRetryTarget().isEmpty()
                    && node.getFallbackRetryTarget().isEmpty()
                    && !graphLevel) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "goal_gate_has_retry",
                                Severity.WARNING,
                                "Goal gate '" + node.getId() + "' has no retry target",
                                node.getId(),
                                "Set retry_target on the node or the graph"));
            }
        }
        return diagnostics;
    }

    static List<Diagnostic> checkPromptOnLlmNodes(Graph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            boolean generation =
                    HandlerTypes.CODERGEN.equals(node.getType())
                            || (node.getType().isEmpty() && NodeShape.BOX.equals(node.getShape()));
            if (generation && node.promptOrLabel().isEmpty()) {
                diagnostics.add(
                        Diagnostic.forNode(
                                "prompt_on_llm_nodes",
                                Severity.WARNING,
                                "Generation node '" + node.getId() + "' has neither prompt nor label",
                                node.getId(),
                                "Add a prompt or label"));
            }
        }
        return diagnostics;
    }
}
