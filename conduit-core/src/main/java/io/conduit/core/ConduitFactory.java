package io.conduit.core;

import io.conduit.core.checkpoint.CheckpointStore;
import io.conduit.core.checkpoint.InMemoryCheckpointStore;
import io.conduit.core.checkpoint.RunRecorder;
import io.conduit.core.execution.Sleeper;
import io.conduit.core.execution.handler.DefaultHandlerRegistry;
import io.conduit.core.execution.handler.DefaultToolRegistry;
import io.conduit.core.execution.handler.GenerationBackend;
import io.conduit.core.execution.handler.HandlerRegistry;
import io.conduit.core.execution.handler.NodeHandler;
import io.conduit.core.execution.handler.ToolRegistry;
import io.conduit.core.graph.validation.GraphValidator;
import io.conduit.core.graph.validation.StructuralGraphValidator;
import io.conduit.core.interviewer.AutoApproveInterviewer;
import io.conduit.core.interviewer.Interviewer;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Factory for creating and wiring {@link ConduitEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Builder with explicit collaborators**:
/// {@snippet :
/// var env = ConduitFactory.builder()
///     .config(ConduitConfig.builder().logsRoot(Path.of("runs")).build())
///     .generationBackend(new LangChain4jGenerationBackend(chatModel))
///     .checkpointStoreFactory(JsonCheckpointStore::new)
///     .runRecorderFactory(JsonRunRecorder::new)
///     .build();
/// }
///
/// **Quick start** (stub generation, auto-approving interviewer, in-memory checkpoints):
/// {@snippet :
/// var env = ConduitFactory.createEnvironment();
/// }
///
/// @implNote This is a utility class with only static methods.
///
/// @see ConduitEnvironment
/// @see ConduitConfig
public final class ConduitFactory {

    private ConduitFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration.
    ///
    /// @return a fully-configured environment, never null
    public static ConduitEnvironment createEnvironment() {
        return createEnvironment(new ConduitConfig());
    }

    /// Creates an environment with custom configuration and default collaborators.
    ///
    /// @param config run limits and logs root, not null
    /// @return a fully-configured environment, never null
    public static ConduitEnvironment createEnvironment(ConduitConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder for custom environment construction.
    ///
    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ConduitEnvironment}.
    ///
    /// ### Defaults
    /// - generation backend: {@link io.conduit.core.execution.handler.StubGenerationBackend}
    /// - interviewer: {@link AutoApproveInterviewer}
    /// - checkpoint store: a new {@link InMemoryCheckpointStore} per run
    /// - run recorder: {@link RunRecorder#NOOP}
    /// - sleeper: {@link Sleeper#SYSTEM}
    /// - validator: {@link StructuralGraphValidator}
    public static final class Builder {
        private ConduitConfig config = new ConduitConfig();
        private GenerationBackend generationBackend;
        private Interviewer interviewer = new AutoApproveInterviewer();
        private ToolRegistry toolRegistry = new DefaultToolRegistry();
        private Function<Path, CheckpointStore> checkpointStoreFactory =
                runDir -> new InMemoryCheckpointStore();
        private Function<Path, RunRecorder> runRecorderFactory = runDir -> RunRecorder.NOOP;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private GraphValidator validator = new StructuralGraphValidator();
        private final Map<String, NodeHandler> customHandlers = new LinkedHashMap<>();

        private Builder() {}

        public Builder config(ConduitConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the backend used by generation nodes.
        ///
        /// @param generationBackend backend, null for the stub backend
        /// @return this builder for chaining, never null
        public Builder generationBackend(GenerationBackend generationBackend) {
            this.generationBackend = generationBackend;
            return this;
        }

        /// Sets the interviewer used by human gates.
        ///
        /// @param interviewer interviewer, null to leave `wait.human` unregistered
        /// @return this builder for chaining, never null
        public Builder interviewer(Interviewer interviewer) {
            this.interviewer = interviewer;
            return this;
        }

        public Builder toolRegistry(ToolRegistry toolRegistry) {
            this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
            return this;
        }

        public Builder checkpointStoreFactory(Function<Path, CheckpointStore> checkpointStoreFactory) {
            this.checkpointStoreFactory =
                    Objects.requireNonNull(checkpointStoreFactory, "checkpointStoreFactory must not be null");
            return this;
        }

        public Builder runRecorderFactory(Function<Path, RunRecorder> runRecorderFactory) {
            this.runRecorderFactory =
                    Objects.requireNonNull(runRecorderFactory, "runRecorderFactory must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Builder validator(GraphValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator must not be null");
            return this;
        }

        /// Registers a handler for a custom node type, overriding any built-in
        /// handler of the same type.
        ///
        /// @param type node type, not blank
        /// @param handler handler, not null
        /// @return this builder for chaining, never null
        public Builder handler(String type, NodeHandler handler) {
            customHandlers.put(type, Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        /// Builds the environment.
        ///
        /// @return a fully-configured environment, never null
        public ConduitEnvironment build() {
            HandlerRegistry registry =
                    DefaultHandlerRegistry.withBuiltins(
                            generationBackend, interviewer, toolRegistry, config.getBranchTimeout());
            customHandlers.forEach(registry::register);
            return new ConduitEnvironment(
                    config,
                    registry,
                    toolRegistry,
                    validator,
                    checkpointStoreFactory,
                    runRecorderFactory,
                    sleeper);
        }
    }
}
