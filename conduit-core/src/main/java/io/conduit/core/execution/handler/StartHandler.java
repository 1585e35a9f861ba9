package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/// Entry node handler. Records the run start time under `started_at`.
public final class StartHandler implements NodeHandler {

    public static final String STARTED_AT = "started_at";

    private final Clock clock;

    public StartHandler() {
        this(Clock.systemUTC());
    }

    StartHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
        return Outcome.success(Map.of(STARTED_AT, Instant.now(clock).toString()));
    }
}
