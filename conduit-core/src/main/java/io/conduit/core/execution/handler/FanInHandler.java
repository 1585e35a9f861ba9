package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Handler for `parallel.fan_in` nodes: waits for every predecessor to finish.
///
/// Predecessors are the sources of the node's incoming edges. A predecessor is
/// finished once `{predecessorId}.complete` is truthy in the context. While any
/// is missing the handler returns RETRY naming exactly the missing ones, and the
/// engine polls again without spending retry budget.
public final class FanInHandler implements NodeHandler {

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
        List<Edge> incoming = graph.incomingEdges(node.getId());
        if (incoming.isEmpty()) {
            return Outcome.builder()
                    .status(OutcomeStatus.SUCCESS)
                    .notes("No predecessors to wait for")
                    .build();
        }

        Set<String> predecessors = new LinkedHashSet<>();
        incoming.forEach(edge -> predecessors.add(edge.fromNode()));

        List<String> missing = new ArrayList<>();
        for (String predecessor : predecessors) {
            if (!context.isTruthy(predecessor + ".complete")) {
                missing.add(predecessor);
            }
        }

        if (!missing.isEmpty()) {
            return Outcome.retry("Waiting for predecessors: " + String.join(", ", missing));
        }
        return Outcome.builder()
                .status(OutcomeStatus.SUCCESS)
                .notes("All " + predecessors.size() + " predecessors completed")
                .build();
    }
}
