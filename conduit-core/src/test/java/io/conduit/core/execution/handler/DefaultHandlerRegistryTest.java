package io.conduit.core.execution.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.graph.NodeShape;
import io.conduit.core.interviewer.AutoApproveInterviewer;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultHandlerRegistryTest {

    @Nested
    class Resolution {

        @Test
        void shouldPreferExplicitTypeOverShape() {
            // Given
            DefaultHandlerRegistry registry = DefaultHandlerRegistry.withBuiltins(null, null, null);
            NodeHandler custom = (node, context, graph, logDir) -> Outcome.success();
            registry.register("lint", custom);
            Node node = Node.builder().id("n").shape(NodeShape.BOX).type("lint").build();

            // Then
            assertThat(registry.resolve(node)).isSameAs(custom);
        }

        @Test
        void shouldFallBackToShapeWhenTypeIsUnregistered() {
            DefaultHandlerRegistry registry = DefaultHandlerRegistry.withBuiltins(null, null, null);
            Node node = Node.builder().id("n").shape(NodeShape.DIAMOND).type("unknown").build();

            assertThat(registry.resolve(node)).isInstanceOf(ConditionalHandler.class);
        }

        @Test
        void shouldUseDefaultHandlerLast() {
            DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
            NodeHandler fallback = (node, context, graph, logDir) -> Outcome.success();
            registry.setDefaultHandler(fallback);

            assertThat(registry.resolve(Node.builder().id("n").shape("star").build())).isSameAs(fallback);
        }

        @Test
        void shouldThrowWhenNothingResolves() {
            DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
            Node node = Node.builder().id("n").shape("star").type("mystery").build();

            assertThatThrownBy(() -> registry.resolve(node))
                    .isInstanceOf(HandlerNotFoundException.class)
                    .hasMessageContaining("'n'")
                    .hasMessageContaining("mystery");
        }

        @Test
        void shouldHonourCustomShapeMapping() {
            DefaultHandlerRegistry registry = DefaultHandlerRegistry.withBuiltins(null, null, null);
            registry.mapShape("star", HandlerTypes.EXIT);

            assertThat(registry.resolve(Node.builder().id("n").shape("star").build()))
                    .isInstanceOf(ExitHandler.class);
        }
    }

    @Test
    void shouldRegisterWaitHumanOnlyWithAnInterviewer() {
        assertThat(DefaultHandlerRegistry.withBuiltins(null, null, null).hasHandler(HandlerTypes.WAIT_HUMAN))
                .isFalse();
        assertThat(
                        DefaultHandlerRegistry.withBuiltins(null, new AutoApproveInterviewer(), null)
                                .hasHandler(HandlerTypes.WAIT_HUMAN))
                .isTrue();
    }

    @Test
    void shouldUseStubBackendWhenNoneIsGiven() throws Exception {
        DefaultHandlerRegistry registry = DefaultHandlerRegistry.withBuiltins(null, null, null);
        Node node = Node.builder().id("draft").prompt("Write a haiku").build();

        Outcome outcome =
                registry.resolve(node)
                        .execute(node, new RunContext(), Graph.builder("g").node(node).build(), Path.of("logs"));

        assertThat(outcome.getContextUpdates())
                .containsEntry("draft.response", "stub response: Write a haiku");
    }
}
