package io.conduit.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.checkpoint.InMemoryCheckpointStore;
import io.conduit.core.event.EventBus;
import io.conduit.core.event.PipelineEvent;
import io.conduit.core.execution.handler.DefaultHandlerRegistry;
import io.conduit.core.execution.handler.NodeHandler;
import io.conduit.core.execution.handler.StartHandler;
import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.graph.NodeShape;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PipelineEngineTest {

    private DefaultHandlerRegistry registry;
    private InMemoryCheckpointStore store;
    private EventBus events;
    private List<PipelineEvent> seen;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        registry = DefaultHandlerRegistry.withBuiltins(null, null, null);
        store = InMemoryCheckpointStore.withHistory();
        events = new EventBus();
        seen = new ArrayList<>();
        events.subscribeAll(seen::add);
        sleeps = new ArrayList<>();
    }

    private PipelineEngine.Builder engine(Graph graph) {
        return PipelineEngine.builder(graph, registry)
                .events(events)
                .checkpointStore(store)
                .sleeper(sleeps::add);
    }

    private static Graph.Builder skeleton() {
        return Graph.builder("pipeline")
                .node(Node.builder().id("start").shape(NodeShape.START).build())
                .node(Node.builder().id("exit").shape(NodeShape.EXIT).build());
    }

    private static Node typed(String id, String type) {
        return Node.builder().id(id).type(type).build();
    }

    private ScriptedHandler script(String type, Outcome... outcomes) {
        ScriptedHandler handler = new ScriptedHandler(outcomes);
        registry.register(type, handler);
        return handler;
    }

    private List<String> eventNames() {
        return seen.stream().map(e -> e.getClass().getSimpleName()).toList();
    }

    @Nested
    class HappyPath {

        @Test
        void shouldRunLinearPipelineToCompletion() {
            // Given
            Graph graph =
                    skeleton()
                            .attribute("goal", "ship it")
                            .node(Node.builder().id("plan").prompt("Plan: $goal").build())
                            .edge("start", "plan")
                            .edge("plan", "exit")
                            .build();

            // When
            RunResult result = engine(graph).build().run();

            // Then
            assertThat(result).isInstanceOf(RunResult.Completed.class);
            RunResult.Completed completed = (RunResult.Completed) result;
            assertThat(completed.outcome().getStatus()).isEqualTo(OutcomeStatus.SUCCESS);
            assertThat(completed.completedNodes()).containsExactly("start", "plan", "exit");
            RunContext context = completed.context();
            assertThat(context.get("plan.response")).isEqualTo("stub response: Plan: ship it");
            assertThat(context.get(PipelineEngine.GOAL_KEY)).isEqualTo("ship it");
            assertThat(context.get(PipelineEngine.OUTCOME_KEY)).isEqualTo("success");
            assertThat(context.get(PipelineEngine.CURRENT_NODE_KEY)).isEqualTo("plan");
            assertThat(context.logs()).containsExactly("start: success", "plan: success");
        }

        @Test
        void shouldEmitEventsInOrder() {
            Graph graph = skeleton().node(typed("work", "ok")).edge("start", "work").edge("work", "exit").build();
            script("ok", Outcome.success());

            engine(graph).build().run();

            assertThat(eventNames())
                    .containsExactly(
                            "PipelineStarted",
                            "StageStarted",
                            "StageCompleted",
                            "CheckpointSaved",
                            "StageStarted",
                            "StageCompleted",
                            "CheckpointSaved",
                            "PipelineCompleted");
        }

        @Test
        void shouldCheckpointNextNodeAfterEveryStage() {
            Graph graph = skeleton().node(typed("work", "ok")).edge("start", "work").edge("work", "exit").build();
            script("ok", Outcome.success(Map.of("answer", 42)));

            engine(graph).build().run();

            List<Checkpoint> history = store.history();
            assertThat(history).extracting(Checkpoint::currentNode).containsExactly("work", "exit");
            Checkpoint last = history.get(1);
            assertThat(last.completedNodes()).containsExactly("start", "work");
            assertThat(last.contextValues()).containsEntry("answer", 42);
            assertThat(last.logs()).containsExactly("start: success", "work: success");
        }

        @Test
        void shouldSkipCheckpointsWhenDisabled() {
            Graph graph = skeleton().edge("start", "exit").build();

            RunResult result =
                    engine(graph)
                            .config(EngineConfig.builder().checkpointEnabled(false).build())
                            .build()
                            .run();

            assertThat(result.isCompleted()).isTrue();
            assertThat(store.history()).isEmpty();
        }

        @Test
        void shouldFollowPreferredLabel() {
            Graph graph =
                    skeleton()
                            .node(typed("choose", "chooser"))
                            .node(typed("left", "ok"))
                            .node(typed("right", "ok"))
                            .edge("start", "choose")
                            .edge(Edge.builder("choose", "left").label("Left").weight(5).build())
                            .edge(Edge.builder("choose", "right").label("[R] Right").build())
                            .edge("left", "exit")
                            .edge("right", "exit")
                            .build();
            script("chooser", Outcome.builder().preferredLabel("right").build());
            script("ok", Outcome.success());

            RunResult result = engine(graph).build().run();

            assertThat(result.completedNodes()).containsExactly("start", "choose", "right", "exit");
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRouteFailureThroughFailEdge() {
            // Given
            Graph graph =
                    skeleton()
                            .node(typed("work", "broken"))
                            .node(typed("recover", "ok"))
                            .edge("start", "work")
                            .edge("work", "exit")
                            .edge(Edge.builder("work", "recover").condition("outcome=fail").build())
                            .edge("recover", "exit")
                            .build();
            script("broken", Outcome.fail("boom"));
            script("ok", Outcome.success());

            // When
            RunResult result = engine(graph).build().run();

            // Then
            assertThat(result.completedNodes()).containsExactly("start", "work", "recover", "exit");
            assertThat(seen).contains(new PipelineEvent.StageFailed("work", "boom", false));
            assertThat(result.context().getString("outcome")).isEqualTo("success");
        }

        @Test
        void shouldRetryWithinBudgetThenSucceed() {
            Graph graph =
                    skeleton()
                            .node(Node.builder().id("work").type("flaky").maxRetries(2).build())
                            .edge("start", "work")
                            .edge("work", "exit")
                            .build();
            ScriptedHandler flaky =
                    script("flaky", Outcome.fail("one"), Outcome.fail("two"), Outcome.success());

            RunResult result = engine(graph).build().run();

            assertThat(result.isCompleted()).isTrue();
            assertThat(flaky.calls).isEqualTo(3);
            assertThat(sleeps).hasSize(2);
            assertThat(seen)
                    .filteredOn(PipelineEvent.StageRetrying.class::isInstance)
                    .extracting(e -> ((PipelineEvent.StageRetrying) e).attempt())
                    .containsExactly(2, 3);
            assertThat(store.history().get(1).nodeRetries()).containsEntry("work", 2);
        }

        @Test
        void shouldFailRunWhenBudgetIsExhausted() {
            Graph graph =
                    skeleton()
                            .node(Node.builder().id("work").type("broken").maxRetries(1).build())
                            .edge("start", "work")
                            .edge("work", "exit")
                            .build();
            ScriptedHandler broken = script("broken", Outcome.fail("boom"));

            PipelineEngine engine = engine(graph).build();
            RunResult result = engine.run();

            assertThat(result).isInstanceOf(RunResult.Failed.class);
            RunResult.Failed failed = (RunResult.Failed) result;
            assertThat(failed.nodeId()).isEqualTo("work");
            assertThat(failed.reason()).isEqualTo("Stage 'work' failed: boom");
            assertThat(failed.lastOutcomeIfAny()).map(Outcome::getStatus).contains(OutcomeStatus.FAIL);
            assertThat(broken.calls).isEqualTo(2);
            assertThat(engine.state()).contains(EngineState.FAILED);
            assertThat(seen).last().isEqualTo(new PipelineEvent.PipelineFailed("pipeline", failed.reason()));
        }

        @Test
        void shouldUseGraphDefaultRetryBudget() {
            Graph graph =
                    skeleton()
                            .attribute("default_max_retry", "2")
                            .node(typed("work", "broken"))
                            .edge("start", "work")
                            .edge("work", "exit")
                            .build();
            ScriptedHandler broken = script("broken", Outcome.fail("boom"));

            engine(graph).build().run();

            assertThat(broken.calls).isEqualTo(3);
        }

        @Test
        void shouldJumpToRetryTargetWhenBudgetIsExhausted() {
            // Given
            Graph graph =
                    skeleton()
                            .node(Node.builder().id("work").type("needs_fix").retryTarget("fix").build())
                            .node(typed("fix", "fixer"))
                            .edge("start", "work")
                            .edge("work", "exit")
                            .edge("fix", "work")
                            .build();
            registry.register(
                    "needs_fix",
                    (node, context, g, logDir) ->
                            context.isTruthy("fixed") ? Outcome.success() : Outcome.fail("not fixed"));
            script("fixer", Outcome.success(Map.of("fixed", true)));

            // When
            RunResult result = engine(graph).build().run();

            // Then
            assertThat(result.completedNodes()).containsExactly("start", "work", "fix", "work", "exit");
        }

        @Test
        void shouldDowngradeExhaustedFailureToPartialSuccess() {
            Graph graph =
                    skeleton()
                            .node(Node.builder().id("work").type("broken").allowPartial(true).build())
                            .edge("start", "work")
                            .edge("work", "exit")
                            .build();
            script("broken", Outcome.fail("boom"));

            RunResult result = engine(graph).build().run();

            assertThat(result.isCompleted()).isTrue();
            assertThat(((RunResult.Completed) result).outcome().getStatus())
                    .isEqualTo(OutcomeStatus.PARTIAL_SUCCESS);
            assertThat(result.context().get("outcome")).isEqualTo("partial_success");
        }

        @Test
        void shouldTreatHandlerExceptionAsFailure() {
            Graph graph = skeleton().node(typed("work", "throws")).edge("start", "work").edge("work", "exit").build();
            registry.register(
                    "throws",
                    (node, context, g, logDir) -> {
                        throw new IllegalStateException("kaput");
                    });

            RunResult result = engine(graph).build().run();

            assertThat(((RunResult.Failed) result).reason())
                    .isEqualTo("Stage 'work' failed: IllegalStateException: kaput");
        }

        @Test
        void shouldFailAtDeadEnd() {
            Graph graph = skeleton().node(typed("work", "ok")).edge("start", "work").build();
            script("ok", Outcome.success());

            RunResult result = engine(graph).build().run();

            assertThat(((RunResult.Failed) result).reason()).isEqualTo("No outgoing edge from 'work'");
        }

        @Test
        void shouldRejectGraphWithoutStart() {
            Graph graph = Graph.builder("empty").node(typed("work", "ok")).build();

            assertThatThrownBy(() -> engine(graph).build().run())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Graph 'empty' has no start node");
        }
    }

    @Nested
    class Polling {

        @Test
        void shouldBoundRetryPolls() {
            // Given
            Graph graph = skeleton().node(typed("work", "waiting")).edge("start", "work").edge("work", "exit").build();
            ScriptedHandler waiting = script("waiting", Outcome.retry("not ready"));

            // When
            RunResult result =
                    engine(graph)
                            .config(
                                    EngineConfig.builder()
                                            .maxRetryPolls(3)
                                            .retryPollInterval(Duration.ofMillis(5))
                                            .build())
                            .build()
                            .run();

            // Then
            assertThat(waiting.calls).isEqualTo(4);
            assertThat(sleeps).containsExactly(Duration.ofMillis(5), Duration.ofMillis(5), Duration.ofMillis(5));
            assertThat(((RunResult.Failed) result).reason())
                    .isEqualTo("Stage 'work' failed: Node 'work' still waiting after 3 polls");
        }

        @Test
        void shouldNotConsumeRetryBudgetWhilePolling() {
            Graph graph = skeleton().node(typed("work", "waiting")).edge("start", "work").edge("work", "exit").build();
            script("waiting", Outcome.retry("not ready"), Outcome.retry("not ready"), Outcome.success());

            RunResult result = engine(graph).build().run();

            assertThat(result.isCompleted()).isTrue();
            assertThat(store.history().get(1).nodeRetries()).doesNotContainKey("work");
        }
    }

    @Nested
    class GoalGates {

        private Graph.Builder gated() {
            return skeleton()
                    .node(Node.builder().id("gate").type("gate").goalGate(true).build())
                    .edge("start", "gate")
                    .edge("gate", "exit")
                    .edge(Edge.builder("gate", "exit").condition("outcome=fail").build());
        }

        @Test
        void shouldSendRunBackToRetryTargetWhenGateUnsatisfied() {
            // Given
            Graph graph = gated().attribute("retry_target", "gate").build();
            script("gate", Outcome.fail("not yet"), Outcome.success());

            // When
            RunResult result = engine(graph).build().run();

            // Then
            assertThat(result.completedNodes()).containsExactly("start", "gate", "gate", "exit");
            assertThat(((RunResult.Completed) result).outcome().getStatus()).isEqualTo(OutcomeStatus.SUCCESS);
        }

        @Test
        void shouldFailWhenGateHasNowhereToRetry() {
            Graph graph = gated().build();
            script("gate", Outcome.fail("not yet"));

            RunResult result = engine(graph).build().run();

            assertThat(((RunResult.Failed) result).reason()).isEqualTo("Goal gate 'gate' was not satisfied");
            assertThat(((RunResult.Failed) result).nodeId()).isEqualTo("exit");
        }
    }

    @Nested
    class Limits {

        @Test
        void shouldStopAfterMaxSteps() {
            Graph graph = skeleton().node(typed("spin", "ok")).edge("start", "spin").edge("spin", "spin").build();
            script("ok", Outcome.success());

            RunResult result =
                    engine(graph).config(EngineConfig.builder().maxSteps(5).build()).build().run();

            assertThat(((RunResult.Failed) result).reason()).isEqualTo("Exceeded maximum of 5 steps");
        }

        @Test
        void shouldStopWhenCancelledMidRun() {
            // Given
            Graph graph = skeleton().node(typed("work", "cancels")).edge("start", "work").edge("work", "exit").build();
            AtomicReference<PipelineEngine> ref = new AtomicReference<>();
            registry.register(
                    "cancels",
                    (node, context, g, logDir) -> {
                        ref.get().cancel();
                        return Outcome.success();
                    });
            PipelineEngine engine = engine(graph).build();
            ref.set(engine);

            // When
            RunResult result = engine.run();

            // Then
            assertThat(((RunResult.Failed) result).reason()).isEqualTo("Run cancelled");
            assertThat(result.completedNodes()).containsExactly("start", "work");
            assertThat(engine.isCancelled()).isTrue();
        }

        @Test
        void shouldStopWhenRunTimesOut() {
            Graph graph = skeleton().node(typed("work", "slow")).edge("start", "work").edge("work", "exit").build();
            registry.register(
                    "slow",
                    (node, context, g, logDir) -> {
                        Thread.sleep(300);
                        return Outcome.success();
                    });

            RunResult result =
                    engine(graph)
                            .config(EngineConfig.builder().runTimeout(Duration.ofMillis(100)).build())
                            .build()
                            .run();

            assertThat(((RunResult.Failed) result).reason()).startsWith("Run timed out after");
        }

        @Test
        void shouldHonourCancelIssuedBeforeRun() {
            Graph graph = skeleton().edge("start", "exit").build();
            PipelineEngine engine = engine(graph).build();

            engine.cancel();
            RunResult result = engine.run();

            assertThat(((RunResult.Failed) result).reason()).isEqualTo("Run cancelled");
            assertThat(result.completedNodes()).isEmpty();
        }

        @Test
        void shouldStopPollingWhenRunTimesOut() {
            // Given
            Graph graph = skeleton().node(typed("work", "waiting")).edge("start", "work").edge("work", "exit").build();
            ScriptedHandler waiting = script("waiting", Outcome.retry("not ready"));

            // When
            RunResult result =
                    engine(graph)
                            .sleeper(Sleeper.SYSTEM)
                            .config(
                                    EngineConfig.builder()
                                            .runTimeout(Duration.ofMillis(100))
                                            .maxRetryPolls(100)
                                            .retryPollInterval(Duration.ofMillis(20))
                                            .build())
                            .build()
                            .run();

            // Then
            assertThat(((RunResult.Failed) result).reason()).isEqualTo("Run timed out after PT0.1S");
            assertThat(waiting.calls).isLessThan(100);
        }

        @Test
        void shouldNotBackOffPastRunTimeout() {
            // Given
            Graph graph =
                    skeleton()
                            .node(Node.builder().id("work").type("broken").maxRetries(4).build())
                            .edge("start", "work")
                            .edge("work", "exit")
                            .build();
            ScriptedHandler broken = script("broken", Outcome.fail("boom"));
            long startedAt = System.nanoTime();

            // When
            RunResult result =
                    engine(graph)
                            .sleeper(Sleeper.SYSTEM)
                            .config(EngineConfig.builder().runTimeout(Duration.ofMillis(100)).build())
                            .build()
                            .run();

            // Then
            assertThat(((RunResult.Failed) result).reason()).isEqualTo("Run timed out after PT0.1S");
            assertThat(broken.calls).isLessThan(5);
            assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(1));
        }
    }

    @Nested
    class Resume {

        @Test
        void shouldContinueFromCheckpointedNode() {
            // Given
            Graph graph =
                    skeleton()
                            .node(typed("first", "ok"))
                            .node(typed("second", "ok"))
                            .edge("start", "first")
                            .edge("first", "second")
                            .edge("second", "exit")
                            .build();
            ScriptedHandler ok = script("ok", Outcome.success());
            Checkpoint checkpoint =
                    new Checkpoint(
                            Instant.parse("2024-01-01T00:00:00Z"),
                            "second",
                            List.of("start", "first"),
                            Map.of("first", 1),
                            Map.of("seed", "abc"),
                            List.of("start: success", "first: success"));

            // When
            RunResult result = engine(graph).resumeFrom(checkpoint).build().run(Map.of("extra", 7));

            // Then
            assertThat(ok.calls).isEqualTo(1);
            assertThat(result.completedNodes()).containsExactly("start", "first", "second", "exit");
            assertThat(result.context().get("seed")).isEqualTo("abc");
            assertThat(result.context().get("extra")).isEqualTo(7);
            assertThat(result.context().contains(StartHandler.STARTED_AT)).isFalse();
            assertThat(result.context().logs()).hasSize(3);
            assertThat(store.history().get(0).nodeRetries()).containsEntry("first", 1);
        }
    }

    @Test
    void shouldClearRetryCountersOnLoopRestart() {
        Graph graph =
                skeleton()
                        .node(Node.builder().id("work").type("flaky").maxRetries(1).build())
                        .node(typed("check", "ok"))
                        .edge("start", "work")
                        .edge(Edge.builder("work", "check").loopRestart(true).build())
                        .edge("check", "exit")
                        .build();
        script("flaky", Outcome.fail("once"), Outcome.success());
        script("ok", Outcome.success());

        engine(graph).build().run();

        assertThat(store.history()).extracting(Checkpoint::currentNode).containsExactly("work", "check", "exit");
        assertThat(store.history().get(1).nodeRetries()).isEmpty();
    }

    @Test
    void shouldForgetRetryCountOnCleanRevisit() {
        // Given
        Graph graph =
                skeleton()
                        .node(Node.builder().id("work").type("flaky").maxRetries(1).build())
                        .node(typed("check", "checker"))
                        .edge("start", "work")
                        .edge("work", "check")
                        .edge(Edge.builder("check", "work").label("again").build())
                        .edge(Edge.builder("check", "exit").label("done").build())
                        .build();
        script("flaky", Outcome.fail("once"), Outcome.success());
        script(
                "checker",
                Outcome.builder().preferredLabel("again").build(),
                Outcome.builder().preferredLabel("done").build());

        // When
        RunResult result = engine(graph).build().run();

        // Then
        assertThat(result.completedNodes()).containsExactly("start", "work", "check", "work", "check", "exit");
        List<Checkpoint> history = store.history();
        assertThat(history.get(1).nodeRetries()).containsEntry("work", 1);
        assertThat(history.get(2).nodeRetries()).containsEntry("work", 1);
        assertThat(history.get(3).nodeRetries()).doesNotContainKey("work");
    }

    /// Replays outcomes in order, repeating the last one once the script runs out.
    private static final class ScriptedHandler implements NodeHandler {
        private final Deque<Outcome> outcomes;
        int calls;

        ScriptedHandler(Outcome... outcomes) {
            this.outcomes = new ArrayDeque<>(Arrays.asList(outcomes));
        }

        @Override
        public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
            calls++;
            return outcomes.size() > 1 ? outcomes.poll() : outcomes.peek();
        }
    }
}
