package io.conduit.core.graph.transform;

import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import java.util.ArrayList;
import java.util.List;

/// Replaces every `$goal` placeholder in node prompts with the graph's goal.
///
/// A graph without a goal is returned unchanged.
public final class GoalExpansionTransform implements GraphTransform {

    public static final String PLACEHOLDER = "$goal";

    @Override
    public Graph apply(Graph graph) {
        String goal = graph.goal();
        if (goal.isEmpty()) {
            return graph;
        }
        List<Node> expanded = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            if (node.getPrompt().contains(PLACEHOLDER)) {
                expanded.add(node.toBuilder().prompt(node.getPrompt().replace(PLACEHOLDER, goal)).build());
            }
        }
        return expanded.isEmpty() ? graph : graph.withNodes(expanded);
    }
}
