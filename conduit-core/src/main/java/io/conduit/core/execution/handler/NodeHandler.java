package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;

/// Strategy interface for executing one kind of pipeline node.
///
/// Handlers are resolved per node by a {@link HandlerRegistry}. They read the
/// shared {@link RunContext} and report their effect through the returned
/// {@link Outcome}: writes should go into {@link Outcome#getContextUpdates()},
/// which the engine merges once the node is accepted.
///
/// ### Contracts
/// - **Expected failures** (backend error, missing tool) are reported as
///   {@link Outcome#fail(String)}, not thrown
/// - **Unexpected exceptions** propagate; the engine counts them as a failed attempt
/// - **Statelessness**: built-in handlers keep no per-run state and may be shared
///
/// ### Example implementation
/// {@snippet :
/// NodeHandler echo = (node, context, graph, logDir) ->
///         Outcome.success(Map.of(node.getId() + ".echo", node.promptOrLabel()));
/// registry.register("echo", echo);
/// }
@FunctionalInterface
public interface NodeHandler {

    /// Executes the node.
    ///
    /// @param node the node to execute, not null
    /// @param context the run context, shared with the rest of the run, not null
    /// @param graph the graph being executed, not null
    /// @param logDir directory reserved for this node's artifacts, not null, may not exist
    /// @return the outcome, never null
    /// @throws Exception on unexpected failure
    Outcome execute(Node node, RunContext context, Graph graph, Path logDir) throws Exception;
}
