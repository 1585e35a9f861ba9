package io.conduit.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.checkpoint.InMemoryCheckpointStore;
import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.PipelineEngine;
import io.conduit.core.execution.RunResult;
import io.conduit.core.execution.Sleeper;
import io.conduit.core.execution.handler.HandlerTypes;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.graph.NodeShape;
import io.conduit.core.graph.validation.GraphValidationException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConduitFactoryTest {

    private static Graph linear(String workType) {
        return Graph.builder("release")
                .node(Node.builder().id("start").shape(NodeShape.START).build())
                .node(Node.builder().id("work").type(workType).prompt("Do the work").build())
                .node(Node.builder().id("exit").shape(NodeShape.EXIT).build())
                .edge("start", "work")
                .edge("work", "exit")
                .build();
    }

    @Nested
    class Defaults {

        @Test
        void shouldRegisterEveryBuiltInHandler() {
            ConduitEnvironment environment = ConduitFactory.createEnvironment();

            for (String type :
                    List.of(
                            HandlerTypes.START,
                            HandlerTypes.EXIT,
                            HandlerTypes.CODERGEN,
                            HandlerTypes.WAIT_HUMAN,
                            HandlerTypes.CONDITIONAL,
                            HandlerTypes.PARALLEL,
                            HandlerTypes.FAN_IN,
                            HandlerTypes.TOOL,
                            HandlerTypes.STACK_MANAGER_LOOP)) {
                assertThat(environment.getHandlerRegistry().hasHandler(type)).as(type).isTrue();
            }
        }

        @Test
        void shouldRunGraphWithStubBackend() {
            ConduitEnvironment environment =
                    ConduitFactory.builder().sleeper(Sleeper.NONE).build();

            RunResult result = environment.createEngine(linear(HandlerTypes.CODERGEN), "run-1").run();

            assertThat(result.isCompleted()).isTrue();
            assertThat(result.context().get("work.response")).isEqualTo("stub response: Do the work");
        }
    }

    @Test
    void shouldPreferCustomHandlerOverBuiltIn() {
        ConduitEnvironment environment =
                ConduitFactory.builder()
                        .handler(HandlerTypes.CODERGEN, (node, context, graph, logDir) -> Outcome.success(Map.of("custom", true)))
                        .build();

        RunResult result = environment.createEngine(linear(HandlerTypes.CODERGEN), "run-1").run();

        assertThat(result.context().get("custom")).isEqualTo(true);
        assertThat(result.context().contains("work.response")).isFalse();
    }

    @Test
    void shouldRejectInvalidGraphBeforeRunning() {
        ConduitEnvironment environment = ConduitFactory.createEnvironment();
        Graph broken = Graph.builder("broken").node(Node.builder().id("work").prompt("x").build()).build();

        assertThatThrownBy(() -> environment.createEngine(broken, "run-1"))
                .isInstanceOf(GraphValidationException.class);
    }

    @Test
    void shouldResolveRunDirectoryUnderLogsRoot() {
        ConduitConfig config = ConduitConfig.builder().logsRoot(Path.of("/tmp/conduit")).build();

        ConduitEnvironment environment = ConduitFactory.createEnvironment(config);

        assertThat(environment.runDirectory("abc")).isEqualTo(Path.of("/tmp/conduit/abc"));
        assertThatThrownBy(() -> environment.runDirectory(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    class Resume {

        @Test
        void shouldResumeFromStoredCheckpointOfSameRun() throws Exception {
            // Given
            Map<Path, InMemoryCheckpointStore> stores = new HashMap<>();
            ConduitEnvironment environment =
                    ConduitFactory.builder()
                            .sleeper(Sleeper.NONE)
                            .checkpointStoreFactory(dir -> stores.computeIfAbsent(dir, d -> new InMemoryCheckpointStore()))
                            .build();
            Path runDir = environment.runDirectory("run-7");
            stores.computeIfAbsent(runDir, d -> new InMemoryCheckpointStore())
                    .save(
                            new Checkpoint(
                                    Instant.now(),
                                    "work",
                                    List.of("start"),
                                    Map.of(),
                                    Map.of("resumed", "yes"),
                                    List.of("start: success")));

            // When
            PipelineEngine engine = environment.resumeEngine(linear(HandlerTypes.CODERGEN), "run-7");
            RunResult result = engine.run();

            // Then
            assertThat(result.completedNodes()).containsExactly("start", "work", "exit");
            assertThat(result.context().get("resumed")).isEqualTo("yes");
        }

        @Test
        void shouldFailWhenRunHasNoCheckpoint() {
            ConduitEnvironment environment = ConduitFactory.createEnvironment();

            assertThatThrownBy(() -> environment.resumeEngine(linear(HandlerTypes.CODERGEN), "missing"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("missing");
        }
    }
}
