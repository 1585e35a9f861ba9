package io.conduit.core;

import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.checkpoint.CheckpointStore;
import io.conduit.core.checkpoint.RunRecorder;
import io.conduit.core.event.EventBus;
import io.conduit.core.event.LoggingEventListener;
import io.conduit.core.execution.PipelineEngine;
import io.conduit.core.execution.Sleeper;
import io.conduit.core.execution.handler.HandlerRegistry;
import io.conduit.core.execution.handler.ToolRegistry;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.validation.Diagnostic;
import io.conduit.core.graph.validation.GraphValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/// Container holding the components required to run pipelines.
///
/// Every run gets its own directory `{logsRoot}/{runId}`; the checkpoint store
/// and run recorder are created per run from that directory.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link ConduitFactory#createEnvironment()} or
/// {@link ConduitFactory.Builder} rather than direct construction.
///
/// @see ConduitFactory
public final class ConduitEnvironment {

    private static final Logger logger = Logger.getLogger(ConduitEnvironment.class.getName());

    private final ConduitConfig config;
    private final HandlerRegistry handlerRegistry;
    private final ToolRegistry toolRegistry;
    private final GraphValidator validator;
    private final Function<Path, CheckpointStore> checkpointStoreFactory;
    private final Function<Path, RunRecorder> runRecorderFactory;
    private final Sleeper sleeper;

    /// Creates a new environment with the specified components.
    ///
    /// @param config run limits and logs root, not null
    /// @param handlerRegistry handler lookup shared by all runs, not null
    /// @param toolRegistry tools available to `tool` nodes, not null
    /// @param validator pre-run graph validator, not null
    /// @param checkpointStoreFactory creates the checkpoint store for a run directory, not null
    /// @param runRecorderFactory creates the run recorder for a run directory, not null
    /// @param sleeper wait strategy for retries and polls, not null
    public ConduitEnvironment(
            ConduitConfig config,
            HandlerRegistry handlerRegistry,
            ToolRegistry toolRegistry,
            GraphValidator validator,
            Function<Path, CheckpointStore> checkpointStoreFactory,
            Function<Path, RunRecorder> runRecorderFactory,
            Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry must not be null");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.checkpointStoreFactory =
                Objects.requireNonNull(checkpointStoreFactory, "checkpointStoreFactory must not be null");
        this.runRecorderFactory =
                Objects.requireNonNull(runRecorderFactory, "runRecorderFactory must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public ConduitConfig getConfig() {
        return config;
    }

    public HandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    public GraphValidator getValidator() {
        return validator;
    }

    /// Returns the directory a run writes to.
    ///
    /// @param runId run identifier, not blank
    /// @return `{logsRoot}/{runId}`, never null
    public Path runDirectory(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        return config.getLogsRoot().resolve(runId);
    }

    /// Validates the graph and creates an engine for a fresh run.
    ///
    /// Validation warnings are logged; errors block the run.
    ///
    /// @param graph graph to run, not null
    /// @param runId run identifier naming the run directory, not blank
    /// @return engine ready to {@link PipelineEngine#run()}, never null
    /// @throws io.conduit.core.graph.validation.GraphValidationException if validation reports errors
    public PipelineEngine createEngine(Graph graph, String runId) {
        return engineBuilder(graph, runId).build();
    }

    /// Validates the graph and creates an engine resuming from the run's
    /// latest checkpoint.
    ///
    /// @param graph graph the checkpoint was taken from, not null
    /// @param runId run identifier naming the run directory, not blank
    /// @return engine that resumes at the checkpoint's current node, never null
    /// @throws IOException if the checkpoint cannot be read
    /// @throws IllegalStateException if the run has no checkpoint
    public PipelineEngine resumeEngine(Graph graph, String runId) throws IOException {
        Path runDir = runDirectory(runId);
        Checkpoint checkpoint =
                checkpointStoreFactory
                        .apply(runDir)
                        .load()
                        .orElseThrow(
                                () -> new IllegalStateException("No checkpoint found for run '" + runId + "'"));
        return engineBuilder(graph, runId).resumeFrom(checkpoint).build();
    }

    private PipelineEngine.Builder engineBuilder(Graph graph, String runId) {
        Objects.requireNonNull(graph, "graph must not be null");
        for (Diagnostic diagnostic : validator.validateOrThrow(graph)) {
            logger.warning(diagnostic.toString());
        }
        Path runDir = runDirectory(runId);
        EventBus events = new EventBus();
        events.subscribeAll(new LoggingEventListener());
        return PipelineEngine.builder(graph, handlerRegistry)
                .config(config.toEngineConfig(runDir))
                .events(events)
                .checkpointStore(checkpointStoreFactory.apply(runDir))
                .recorder(runRecorderFactory.apply(runDir))
                .sleeper(sleeper);
    }
}
