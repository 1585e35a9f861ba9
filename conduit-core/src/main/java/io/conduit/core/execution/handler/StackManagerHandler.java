package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Handler for `stack.manager_loop` nodes: runs a body of child nodes in
/// sequence, repeatedly, until the context flag `stack_done` becomes truthy.
///
/// The flag is checked before each pass and after each child. Child updates are
/// applied to the context immediately so later children and the flag check see
/// them. A failing child aborts the loop with FAIL. Passes are capped at
/// {@link #MAX_ITERATIONS}; the number of passes run is recorded under
/// `{nodeId}.iterations`. Each child gets the log directory
/// `logDir/<childId>_iter<n>`.
public final class StackManagerHandler implements NodeHandler {

    private static final Logger logger = Logger.getLogger(StackManagerHandler.class.getName());

    public static final int MAX_ITERATIONS = 100;
    public static final String DONE_FLAG = "stack_done";

    private final HandlerRegistry registry;

    public StackManagerHandler(HandlerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir)
            throws Exception {
        List<String> childIds = ChildNodes.ids(node);
        if (childIds.isEmpty()) {
            return Outcome.builder()
                    .status(OutcomeStatus.SUCCESS)
                    .notes("No child nodes specified")
                    .build();
        }
        List<Node> children = ChildNodes.resolve(childIds, graph);
        if (children.isEmpty()) {
            return Outcome.fail("No valid child nodes found: " + childIds);
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        int passes = 0;
        loop:
        while (passes < MAX_ITERATIONS && !context.isTruthy(DONE_FLAG)) {
            passes++;
            for (Node child : children) {
                NodeHandler handler = registry.resolve(child);
                Path childDir = logDir.resolve(child.getId() + "_iter" + passes);
                Outcome outcome = handler.execute(child, context, graph, childDir);

                context.applyUpdates(outcome.getContextUpdates());
                merged.putAll(outcome.getContextUpdates());

                if (outcome.failed()) {
                    merged.put(iterationsKey(node), passes);
                    return Outcome.builder()
                            .status(OutcomeStatus.FAIL)
                            .contextUpdates(merged)
                            .failureReason(
                                    "Child "
                                            + child.getId()
                                            + " failed on iteration "
                                            + passes
                                            + ": "
                                            + outcome.getFailureReason())
                            .build();
                }
                if (context.isTruthy(DONE_FLAG)) {
                    break loop;
                }
            }
        }

        if (passes >= MAX_ITERATIONS && !context.isTruthy(DONE_FLAG)) {
            logger.warning("Loop node " + node.getId() + " hit the " + MAX_ITERATIONS + " pass cap");
        } else {
            logger.info("Loop node " + node.getId() + " finished after " + passes + " pass(es)");
        }

        merged.put(iterationsKey(node), passes);
        return Outcome.builder()
                .status(OutcomeStatus.SUCCESS)
                .contextUpdates(merged)
                .notes("Loop completed after " + passes + " iteration(s)")
                .build();
    }

    static String iterationsKey(Node node) {
        return node.getId() + ".iterations";
    }
}
