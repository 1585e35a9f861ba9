package io.conduit.core.execution;

import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.checkpoint.CheckpointStore;
import io.conduit.core.checkpoint.InMemoryCheckpointStore;
import io.conduit.core.checkpoint.RunRecorder;
import io.conduit.core.condition.ConditionSyntaxException;
import io.conduit.core.event.EventBus;
import io.conduit.core.event.PipelineEvent;
import io.conduit.core.execution.handler.HandlerNotFoundException;
import io.conduit.core.execution.handler.HandlerRegistry;
import io.conduit.core.execution.handler.NodeHandler;
import io.conduit.core.execution.retry.RetryPolicy;
import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.graph.transform.GoalExpansionTransform;
import io.conduit.core.state.RunContext;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs a {@link Graph} from its start node to an exit node.
///
/// Each step executes one node through the {@link HandlerRegistry}, applies the
/// outcome to the {@link RunContext}, picks the next edge with
/// {@link EdgeSelector} and saves a {@link Checkpoint} pointing at the next
/// node.
///
/// ### Failure routing
/// - FAIL, or a handler exception, consumes one attempt of the node's
///   {@link RetryPolicy}; remaining budget means a backoff wait and a re-run
/// - RETRY re-runs the node without consuming budget, bounded by
///   {@link EngineConfig#maxRetryPolls()}
/// - once the budget is spent, only edges whose condition matches the failure
///   are followed, then the node's `retryTarget`, then its
///   `fallbackRetryTarget`; otherwise the run fails
///
/// ### Goal gates
/// On reaching an exit node every visited goal gate must have last succeeded.
/// An unsatisfied gate sends the run to its retry target (node attributes
/// first, then the graph's `retry_target` and `fallback_retry_target`), or
/// fails the run when none resolves.
///
/// ### Contracts
/// - **Postcondition**: {@link #run} returns a {@link RunResult} for every
///   runtime failure, it throws only for configuration errors
/// - **Invariant**: one step at a time on the calling thread; only parallel
///   handlers spawn workers
///
/// @implNote **Not thread-safe** apart from {@link #cancel()}, which may be
/// called from any thread.
///
/// @see RunResult
/// @see PipelineEvent for the events emitted during a run
public final class PipelineEngine {

    private static final Logger logger = Logger.getLogger(PipelineEngine.class.getName());

    public static final String GOAL_KEY = "graph.goal";
    public static final String CURRENT_NODE_KEY = "current_node";
    public static final String OUTCOME_KEY = "outcome";
    public static final String PREFERRED_LABEL_KEY = "preferred_label";

    private final Graph graph;
    private final HandlerRegistry registry;
    private final EngineConfig config;
    private final EventBus events;
    private final CheckpointStore checkpointStore;
    private final RunRecorder recorder;
    private final Sleeper sleeper;
    private final Checkpoint resumeFrom;

    private volatile boolean cancelled;
    private volatile EngineState state;

    private PipelineEngine(Builder builder) {
        this.graph = builder.graph;
        this.registry = builder.registry;
        this.config = builder.config;
        this.events = builder.events;
        this.checkpointStore = builder.checkpointStore;
        this.recorder = builder.recorder;
        this.sleeper = builder.sleeper;
        this.resumeFrom = builder.resumeFrom;
    }

    /// Creates a builder for an engine over the given graph.
    ///
    /// @param graph graph to run, not null
    /// @param registry handler lookup, not null
    /// @return new builder, never null
    public static Builder builder(Graph graph, HandlerRegistry registry) {
        return new Builder(graph, registry);
    }

    /// Requests cooperative cancellation. Checked before every step, attempt,
    /// retry wait and poll. A request made before {@link #run} starts is
    /// honoured; a cancelled engine does not run again.
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /// Returns the current lifecycle state, or empty before the first run.
    public Optional<EngineState> state() {
        return Optional.ofNullable(state);
    }

    public EventBus events() {
        return events;
    }

    /// Runs the graph with an empty initial context.
    ///
    /// @see #run(Map)
    public RunResult run() {
        return run(Map.of());
    }

    /// Runs the graph to completion.
    ///
    /// When the engine was built with a checkpoint, the context, logs,
    /// completed nodes and retry counters come from the checkpoint and
    /// `initialValues` is applied on top of the restored context.
    ///
    /// @param initialValues starting context entries, not null
    /// @return completed or failed result, never null
    /// @throws IllegalStateException if the graph has no start node or a
    ///         transition names a node that does not exist
    /// @throws HandlerNotFoundException if a node resolves to no handler
    /// @throws ConditionSyntaxException if an edge condition is malformed
    public RunResult run(Map<String, ?> initialValues) {
        Objects.requireNonNull(initialValues, "initialValues must not be null");
        Graph expanded = new GoalExpansionTransform().apply(graph);
        Node start =
                expanded.startNode()
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Graph '" + expanded.getName() + "' has no start node"));

        Run run;
        if (resumeFrom != null) {
            run =
                    new Run(
                            expanded,
                            RunContext.restore(resumeFrom.contextValues(), resumeFrom.logs()),
                            resumeFrom.currentNode());
            run.completed.addAll(resumeFrom.completedNodes());
            run.retries.putAll(resumeFrom.nodeRetries());
            run.context.applyUpdates(initialValues);
            logger.info(
                    "Resuming '" + expanded.getName() + "' at node '" + resumeFrom.currentNode() + "'");
        } else {
            run = new Run(expanded, new RunContext(initialValues), start.getId());
        }
        run.context.set(GOAL_KEY, expanded.goal());

        state = EngineState.RUNNING;
        Instant startedAt = Instant.now();
        try {
            recorder.recordManifest(expanded, startedAt);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to record manifest for '" + expanded.getName() + "'", e);
        }
        events.emit(new PipelineEvent.PipelineStarted(expanded.getName()));
        logger.info("Starting pipeline '" + expanded.getName() + "' at node '" + run.currentId + "'");

        if (config.runTimeout() != null) {
            run.deadline = System.nanoTime() + config.runTimeout().toNanos();
        }
        try {
            return loop(run);
        } catch (CancellationException e) {
            return fail(run, e.getMessage());
        }
    }

    private RunResult loop(Run run) {
        int steps = 0;
        while (true) {
            if (cancelled) {
                return fail(run, "Run cancelled");
            }
            if (run.pastDeadline()) {
                return fail(run, timeoutReason());
            }
            if (steps >= config.maxSteps()) {
                return fail(run, "Exceeded maximum of " + config.maxSteps() + " steps");
            }
            steps++;

            String nodeId = run.currentId;
            Node node =
                    run.graph
                            .node(nodeId)
                            .orElseThrow(
                                    () ->
                                            new IllegalStateException(
                                                    "Transition to unknown node '" + nodeId + "'"));

            if (run.graph.isExitNode(node)) {
                Optional<Node> unsatisfied = firstUnsatisfiedGate(run);
                if (unsatisfied.isPresent()) {
                    Node gate = unsatisfied.get();
                    Optional<String> target = gateRetryTarget(gate, run.graph);
                    if (target.isEmpty()) {
                        return fail(run, "Goal gate '" + gate.getId() + "' was not satisfied");
                    }
                    logger.warning(
                            "Goal gate '" + gate.getId() + "' unsatisfied, retrying from '"
                                    + target.get() + "'");
                    run.currentId = target.get();
                    continue;
                }
                return complete(run, node);
            }

            events.emit(new PipelineEvent.StageStarted(nodeId));
            run.context.set(CURRENT_NODE_KEY, nodeId);
            logger.info("Executing stage '" + nodeId + "'");
            run.retries.remove(nodeId);

            Outcome outcome = executeStage(node, run);
            run.lastOutcome = outcome;
            run.context.applyUpdates(outcome.getContextUpdates());
            run.context.set(OUTCOME_KEY, outcome.getStatus().value());
            run.context.set(PREFERRED_LABEL_KEY, outcome.getPreferredLabel());
            run.context.appendLog(nodeId + ": " + outcome.getStatus().value());
            if (node.isGoalGate()) {
                run.gateOutcomes.put(nodeId, outcome);
            }

            Optional<Edge> edge;
            String next;
            List<Edge> outgoing = run.graph.outgoingEdges(nodeId);
            if (outcome.failed()) {
                edge = EdgeSelector.selectConditional(outgoing, outcome, run.context);
                if (edge.isPresent()) {
                    next = edge.get().toNode();
                } else {
                    Optional<String> target = failureRetryTarget(node, run.graph);
                    if (target.isEmpty()) {
                        return fail(
                                run,
                                "Stage '" + nodeId + "' failed: " + describeFailure(outcome));
                    }
                    logger.warning(
                            "Stage '" + nodeId + "' failed, jumping to retry target '"
                                    + target.get() + "'");
                    next = target.get();
                }
            } else {
                edge = EdgeSelector.select(outgoing, outcome, run.context);
                if (edge.isEmpty()) {
                    return fail(run, "No outgoing edge from '" + nodeId + "'");
                }
                next = edge.get().toNode();
            }

            run.completed.add(nodeId);
            recordStatus(nodeId, outcome);
            events.emit(new PipelineEvent.StageCompleted(nodeId, outcome));

            if (edge.isPresent() && edge.get().loopRestart()) {
                logger.info("Loop restart from '" + nodeId + "' to '" + next + "'");
                run.gateOutcomes.clear();
                run.retries.clear();
            }

            run.currentId = next;
            saveCheckpoint(run);
        }
    }

    /// Runs one node under its retry policy and returns the accepted outcome.
    private Outcome executeStage(Node node, Run run) {
        String nodeId = node.getId();
        NodeHandler handler = registry.resolve(node);
        RetryPolicy policy = RetryPolicy.forNode(node, run.graph);
        Path stageDir = config.logsRoot().resolve(nodeId);
        int attempts = 0;
        int polls = 0;

        while (true) {
            checkStillRunning(run);
            Outcome outcome = invoke(handler, node, run, stageDir);

            if (outcome.getStatus() == OutcomeStatus.RETRY) {
                polls++;
                if (polls > config.maxRetryPolls()) {
                    String reason =
                            "Node '" + nodeId + "' still waiting after "
                                    + config.maxRetryPolls() + " polls";
                    events.emit(new PipelineEvent.StageFailed(nodeId, reason, false));
                    return node.isAllowPartial()
                            ? Outcome.builder()
                                    .status(OutcomeStatus.PARTIAL_SUCCESS)
                                    .notes(reason)
                                    .contextUpdates(outcome.getContextUpdates())
                                    .build()
                            : Outcome.fail(reason);
                }
                logger.fine("Stage '" + nodeId + "' asked to retry (poll " + polls + ")");
                pause(config.retryPollInterval(), run);
                continue;
            }

            if (outcome.failed()) {
                attempts++;
                run.retries.put(nodeId, attempts);
                boolean willRetry = policy.allowsAnotherAttempt(attempts);
                String reason = describeFailure(outcome);
                events.emit(new PipelineEvent.StageFailed(nodeId, reason, willRetry));
                if (!willRetry) {
                    if (node.isAllowPartial()) {
                        return Outcome.builder()
                                .status(OutcomeStatus.PARTIAL_SUCCESS)
                                .notes("Retries exhausted: " + reason)
                                .contextUpdates(outcome.getContextUpdates())
                                .build();
                    }
                    return outcome;
                }
                Duration delay = policy.delayForAttempt(attempts);
                logger.warning(
                        "Stage '" + nodeId + "' failed (attempt " + attempts + "/"
                                + policy.maxAttempts() + "), retrying in " + delay.toMillis()
                                + " ms: " + reason);
                events.emit(new PipelineEvent.StageRetrying(nodeId, attempts + 1, delay));
                pause(delay, run);
                continue;
            }

            return outcome;
        }
    }

    private Outcome invoke(NodeHandler handler, Node node, Run run, Path stageDir) {
        try {
            Outcome outcome = handler.execute(node, run.context, run.graph, stageDir);
            return outcome != null ? outcome : Outcome.fail("Handler returned no outcome");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while executing '" + node.getId() + "'");
        } catch (ConditionSyntaxException | HandlerNotFoundException e) {
            throw e;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Handler for '" + node.getId() + "' threw", e);
            return Outcome.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private RunResult complete(Run run, Node exitNode) {
        NodeHandler handler = registry.resolve(exitNode);
        Outcome exitOutcome = invoke(handler, exitNode, run, config.logsRoot().resolve(exitNode.getId()));
        run.context.applyUpdates(exitOutcome.getContextUpdates());
        run.completed.add(exitNode.getId());
        recordStatus(exitNode.getId(), exitOutcome);

        Outcome finalOutcome = run.lastOutcome != null ? run.lastOutcome : exitOutcome;
        state = EngineState.COMPLETED;
        events.emit(new PipelineEvent.PipelineCompleted(run.graph.getName(), finalOutcome));
        logger.info(
                "Pipeline '" + run.graph.getName() + "' completed after "
                        + run.completed.size() + " stages");
        return new RunResult.Completed(finalOutcome, run.context, run.completed);
    }

    private RunResult fail(Run run, String reason) {
        state = EngineState.FAILED;
        logger.warning("Pipeline '" + run.graph.getName() + "' failed: " + reason);
        events.emit(new PipelineEvent.PipelineFailed(run.graph.getName(), reason));
        return new RunResult.Failed(run.currentId, reason, run.lastOutcome, run.context, run.completed);
    }

    private Optional<Node> firstUnsatisfiedGate(Run run) {
        for (Map.Entry<String, Outcome> entry : run.gateOutcomes.entrySet()) {
            if (!entry.getValue().succeeded()) {
                return run.graph.node(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> failureRetryTarget(Node node, Graph graph) {
        return firstExisting(graph, node.getRetryTarget(), node.getFallbackRetryTarget());
    }

    private static Optional<String> gateRetryTarget(Node gate, Graph graph) {
        Map<String, String> attributes = graph.getAttributes();
        return firstExisting(
                graph,
                gate.getRetryTarget(),
                gate.getFallbackRetryTarget(),
                attributes.getOrDefault("retry_target", ""),
                attributes.getOrDefault("fallback_retry_target", ""));
    }

    private static Optional<String> firstExisting(Graph graph, String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty() && graph.node(candidate).isPresent()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String describeFailure(Outcome outcome) {
        if (!outcome.getFailureReason().isEmpty()) {
            return outcome.getFailureReason();
        }
        return outcome.getNotes().isEmpty() ? "unknown failure" : outcome.getNotes();
    }

    private void recordStatus(String nodeId, Outcome outcome) {
        try {
            recorder.recordStageStatus(nodeId, outcome);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to record status for '" + nodeId + "'", e);
        }
    }

    private void saveCheckpoint(Run run) {
        if (!config.checkpointEnabled()) {
            return;
        }
        Checkpoint checkpoint =
                Checkpoint.now(
                        run.currentId,
                        run.completed,
                        run.retries,
                        run.context.snapshot(),
                        run.context.logs());
        try {
            String location = checkpointStore.save(checkpoint);
            events.emit(new PipelineEvent.CheckpointSaved(run.currentId, location));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to save checkpoint before '" + run.currentId + "'", e);
        }
    }

    /// Waits between attempts or polls, never past the run deadline.
    private void pause(Duration duration, Run run) {
        checkStillRunning(run);
        Duration wait = duration;
        boolean reachesDeadline = false;
        if (run.deadline != Long.MAX_VALUE) {
            Duration remaining = Duration.ofNanos(Math.max(0, run.deadline - System.nanoTime()));
            if (remaining.compareTo(wait) <= 0) {
                wait = remaining;
                reachesDeadline = true;
            }
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting");
        }
        if (reachesDeadline) {
            throw new CancellationException(timeoutReason());
        }
        checkStillRunning(run);
    }

    private void checkStillRunning(Run run) {
        if (cancelled) {
            throw new CancellationException("Run cancelled");
        }
        if (run.pastDeadline()) {
            throw new CancellationException(timeoutReason());
        }
    }

    private String timeoutReason() {
        return "Run timed out after " + config.runTimeout();
    }

    /// Mutable bookkeeping for a single run.
    private static final class Run {
        final Graph graph;
        final RunContext context;
        final List<String> completed = new ArrayList<>();
        final Map<String, Integer> retries = new HashMap<>();
        final Map<String, Outcome> gateOutcomes = new LinkedHashMap<>();
        String currentId;
        Outcome lastOutcome;
        long deadline = Long.MAX_VALUE;

        Run(Graph graph, RunContext context, String currentId) {
            this.graph = graph;
            this.context = context;
            this.currentId = currentId;
        }

        boolean pastDeadline() {
            return deadline != Long.MAX_VALUE && System.nanoTime() - deadline > 0;
        }
    }

    /// Builder for {@link PipelineEngine}.
    ///
    /// Unset collaborators default to an {@link InMemoryCheckpointStore},
    /// {@link RunRecorder#NOOP}, a fresh {@link EventBus},
    /// {@link Sleeper#SYSTEM} and {@link EngineConfig#builder() default limits}.
    public static final class Builder {
        private final Graph graph;
        private final HandlerRegistry registry;
        private EngineConfig config = EngineConfig.builder().build();
        private EventBus events = new EventBus();
        private CheckpointStore checkpointStore = new InMemoryCheckpointStore();
        private RunRecorder recorder = RunRecorder.NOOP;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Checkpoint resumeFrom;

        private Builder(Graph graph, HandlerRegistry registry) {
            this.graph = Objects.requireNonNull(graph, "graph must not be null");
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder events(EventBus events) {
            this.events = Objects.requireNonNull(events, "events must not be null");
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore =
                    Objects.requireNonNull(checkpointStore, "checkpointStore must not be null");
            return this;
        }

        public Builder recorder(RunRecorder recorder) {
            this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /// Resumes from the given checkpoint instead of the start node.
        ///
        /// @param checkpoint checkpoint to resume from, null to start fresh
        public Builder resumeFrom(Checkpoint checkpoint) {
            this.resumeFrom = checkpoint;
            return this;
        }

        public PipelineEngine build() {
            return new PipelineEngine(this);
        }
    }
}
