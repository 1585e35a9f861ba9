package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Handler for `parallel` nodes: runs the listed child nodes concurrently.
///
/// The node prompt (else label) lists child node ids separated by commas.
/// Unknown ids are skipped; if none remain the node fails. Each child runs
/// through the registry's handler for it, on a pool sized to the child count,
/// with its own log directory `logDir/<childId>`.
///
/// ### Contracts
/// - **Shared context**: children see the same {@link RunContext}, not a copy
/// - **Merge order**: child context updates are merged in completion order;
///   for a key written by several children the last to complete wins
/// - **Aggregate status**: SUCCESS when every child succeeded, PARTIAL_SUCCESS
///   when some did, FAIL when none did
/// - **Completion marker**: `{nodeId}.complete = true` is always set, so a
///   downstream fan-in sees the fan-out as finished even when children failed
/// - **Branch timeout**: children still running once the timeout has elapsed
///   are cancelled and count as failed
///
/// @implNote The pool is created per invocation and shut down before returning.
public final class ParallelHandler implements NodeHandler {

    private static final Logger logger = Logger.getLogger(ParallelHandler.class.getName());

    public static final Duration DEFAULT_BRANCH_TIMEOUT = Duration.ofMinutes(5);

    private final HandlerRegistry registry;
    private final Duration branchTimeout;

    public ParallelHandler(HandlerRegistry registry) {
        this(registry, DEFAULT_BRANCH_TIMEOUT);
    }

    public ParallelHandler(HandlerRegistry registry, Duration branchTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.branchTimeout = Objects.requireNonNull(branchTimeout, "branchTimeout must not be null");
    }

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir)
            throws InterruptedException {
        List<String> childIds = ChildNodes.ids(node);
        if (childIds.isEmpty()) {
            return Outcome.builder()
                    .status(OutcomeStatus.SUCCESS)
                    .contextUpdates(Map.of(completeKey(node), true))
                    .notes("No child nodes specified")
                    .build();
        }
        List<Node> children = ChildNodes.resolve(childIds, graph);
        if (children.isEmpty()) {
            return Outcome.fail("No valid child nodes found: " + childIds);
        }

        logger.info("Fanning out node " + node.getId() + " to " + children.size() + " children");

        Map<String, Object> merged = new LinkedHashMap<>();
        int succeeded = 0;
        ExecutorService pool = Executors.newFixedThreadPool(children.size());
        try {
            CompletionService<Outcome> completion = new ExecutorCompletionService<>(pool);
            Map<Future<Outcome>, String> pending = new HashMap<>();
            for (Node child : children) {
                NodeHandler handler = registry.resolve(child);
                Path childDir = logDir.resolve(child.getId());
                pending.put(
                        completion.submit(() -> handler.execute(child, context, graph, childDir)),
                        child.getId());
            }

            long deadline = System.nanoTime() + branchTimeout.toNanos();
            for (int i = 0; i < children.size(); i++) {
                long remaining = deadline - System.nanoTime();
                Future<Outcome> done = completion.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                if (done == null) {
                    logger.warning(
                            "Branch timeout after "
                                    + branchTimeout
                                    + " at node "
                                    + node.getId()
                                    + ", unfinished: "
                                    + pending.values());
                    pending.keySet().forEach(f -> f.cancel(true));
                    break;
                }
                String childId = pending.remove(done);
                Outcome outcome = outcomeOf(done, childId);
                if (outcome.succeeded()) {
                    succeeded++;
                }
                merged.putAll(outcome.getContextUpdates());
            }
        } finally {
            pool.shutdownNow();
        }

        int total = children.size();
        OutcomeStatus status;
        if (succeeded == total) {
            status = OutcomeStatus.SUCCESS;
        } else if (succeeded > 0) {
            status = OutcomeStatus.PARTIAL_SUCCESS;
        } else {
            status = OutcomeStatus.FAIL;
        }
        merged.put(completeKey(node), true);

        String notes = succeeded + "/" + total + " children succeeded";
        logger.info("Parallel node " + node.getId() + ": " + notes);
        return Outcome.builder()
                .status(status)
                .contextUpdates(merged)
                .notes(notes)
                .failureReason(status == OutcomeStatus.FAIL ? "All children failed" : "")
                .build();
    }

    private static Outcome outcomeOf(Future<Outcome> future, String childId)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.warning("Child " + childId + " threw: " + e.getCause());
            return Outcome.fail("Child " + childId + " threw: " + e.getCause());
        }
    }

    static String completeKey(Node node) {
        return node.getId() + ".complete";
    }
}
