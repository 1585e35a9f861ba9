package io.conduit.core.execution.handler;

import static org.assertj.core.api.Assertions.assertThat;

import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParallelHandlerTest {

    private static final Path LOG_DIR = Path.of("logs");

    private DefaultHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultHandlerRegistry();
        registry.register("ok", (node, context, graph, logDir) ->
                Outcome.success(Map.of(node.getId() + ".done", true)));
        registry.register("bad", (node, context, graph, logDir) -> Outcome.fail("nope"));
        registry.register("boom", (node, context, graph, logDir) -> {
            throw new IllegalStateException("exploded");
        });
    }

    @Test
    void shouldReportPartialSuccessAndSetMarkerWhenOneOfThreeChildrenFails() throws Exception {
        // Given
        Node fanOut = Node.builder().id("fan").type(HandlerTypes.PARALLEL).prompt("a, b, c").build();
        Graph graph =
                Graph.builder("g")
                        .node(fanOut)
                        .node(child("a", "ok"))
                        .node(child("b", "ok"))
                        .node(child("c", "bad"))
                        .build();
        RunContext context = new RunContext();

        // When
        Outcome outcome = new ParallelHandler(registry).execute(fanOut, context, graph, LOG_DIR);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.PARTIAL_SUCCESS);
        assertThat(outcome.getContextUpdates())
                .containsEntry("fan.complete", true)
                .containsEntry("a.done", true)
                .containsEntry("b.done", true);
        assertThat(outcome.getNotes()).isEqualTo("2/3 children succeeded");
    }

    @Test
    void shouldFailWhenAllChildrenFailAndCountExceptionsAsFailures() throws Exception {
        Node fanOut = Node.builder().id("fan").type(HandlerTypes.PARALLEL).prompt("x,y").build();
        Graph graph =
                Graph.builder("g").node(fanOut).node(child("x", "bad")).node(child("y", "boom")).build();

        Outcome outcome =
                new ParallelHandler(registry).execute(fanOut, new RunContext(), graph, LOG_DIR);

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FAIL);
        assertThat(outcome.getFailureReason()).isEqualTo("All children failed");
        assertThat(outcome.getContextUpdates()).containsEntry("fan.complete", true);
    }

    @Test
    void shouldSucceedWithMarkerWhenNoChildrenAreListed() throws Exception {
        Node fanOut = Node.builder().id("fan").type(HandlerTypes.PARALLEL).build();
        Graph graph = Graph.builder("g").node(fanOut).build();

        Outcome outcome =
                new ParallelHandler(registry).execute(fanOut, new RunContext(), graph, LOG_DIR);

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(outcome.getContextUpdates()).containsEntry("fan.complete", true);
    }

    @Test
    void shouldFailWhenNoListedChildExists() throws Exception {
        Node fanOut = Node.builder().id("fan").type(HandlerTypes.PARALLEL).prompt("ghost").build();
        Graph graph = Graph.builder("g").node(fanOut).build();

        Outcome outcome =
                new ParallelHandler(registry).execute(fanOut, new RunContext(), graph, LOG_DIR);

        assertThat(outcome.failed()).isTrue();
    }

    @Test
    void shouldApplyLastCompletedWriteWhenChildrenShareAKey() throws Exception {
        // Given
        CountDownLatch firstWritten = new CountDownLatch(1);
        registry.register("early", (node, context, graph, logDir) -> {
            firstWritten.countDown();
            return Outcome.success(Map.of("shared", "early"));
        });
        registry.register("late", (node, context, graph, logDir) -> {
            firstWritten.await();
            Thread.sleep(50);
            return Outcome.success(Map.of("shared", "late"));
        });
        Node fanOut = Node.builder().id("fan").type(HandlerTypes.PARALLEL).prompt("l, e").build();
        Graph graph =
                Graph.builder("g").node(fanOut).node(child("l", "late")).node(child("e", "early")).build();

        // When
        Outcome outcome =
                new ParallelHandler(registry).execute(fanOut, new RunContext(), graph, LOG_DIR);

        // Then
        assertThat(outcome.getContextUpdates()).containsEntry("shared", "late");
    }

    @Test
    void shouldCountChildrenPastTheBranchTimeoutAsFailed() throws Exception {
        registry.register("slow", (node, context, graph, logDir) -> {
            Thread.sleep(5_000);
            return Outcome.success();
        });
        Node fanOut = Node.builder().id("fan").type(HandlerTypes.PARALLEL).prompt("fast, slow").build();
        Graph graph =
                Graph.builder("g").node(fanOut).node(child("fast", "ok")).node(child("slow", "slow")).build();

        Outcome outcome =
                new ParallelHandler(registry, Duration.ofMillis(200))
                        .execute(fanOut, new RunContext(), graph, LOG_DIR);

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.PARTIAL_SUCCESS);
        assertThat(outcome.getNotes()).isEqualTo("1/2 children succeeded");
    }

    private static Node child(String id, String type) {
        return Node.builder().id(id).type(type).build();
    }
}
