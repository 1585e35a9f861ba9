package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;

/// Terminal node handler. Goal gates are checked by the engine before it runs.
public final class ExitHandler implements NodeHandler {

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
        return Outcome.success();
    }
}
