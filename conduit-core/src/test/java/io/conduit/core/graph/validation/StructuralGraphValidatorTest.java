package io.conduit.core.graph.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.graph.NodeShape;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StructuralGraphValidatorTest {

    private final StructuralGraphValidator validator = new StructuralGraphValidator();

    private static Graph.Builder linear() {
        return Graph.builder("g")
                .node(Node.builder().id("start").shape(NodeShape.START).build())
                .node(Node.builder().id("work").prompt("Do it").build())
                .node(Node.builder().id("exit").shape(NodeShape.EXIT).build())
                .edge("start", "work")
                .edge("work", "exit");
    }

    private static List<String> rules(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::rule).toList();
    }

    @Test
    void shouldAcceptWellFormedGraph() {
        assertThat(validator.validate(linear().build())).isEmpty();
    }

    @Nested
    class Errors {

        @Test
        void shouldReportMissingStartAndExit() {
            Graph graph = Graph.builder("g").node(Node.builder().id("work").prompt("x").build()).build();

            assertThat(rules(validator.validate(graph))).contains("start_node", "terminal_node");
        }

        @Test
        void shouldReportEachOfSeveralStartNodes() {
            Graph graph =
                    linear().node(Node.builder().id("start2").shape(NodeShape.START).build()).build();

            assertThat(validator.validate(graph))
                    .filteredOn(d -> d.rule().equals("start_node"))
                    .extracting(Diagnostic::nodeId)
                    .containsExactly("start", "start2");
        }

        @Test
        void shouldReportUnreachableNodeAndDanglingEdge() {
            Graph graph =
                    linear()
                            .node(Node.builder().id("orphan").prompt("x").build())
                            .edge("work", "ghost")
                            .build();

            List<Diagnostic> diagnostics = validator.validate(graph);

            assertThat(diagnostics)
                    .filteredOn(d -> d.rule().equals("reachability"))
                    .extracting(Diagnostic::nodeId)
                    .containsExactly("orphan");
            assertThat(diagnostics)
                    .filteredOn(d -> d.rule().equals("edge_target_exists"))
                    .singleElement()
                    .satisfies(d -> assertThat(d.message()).contains("ghost"));
        }

        @Test
        void shouldReportEdgesIntoStartAndOutOfExit() {
            Graph graph = linear().edge("work", "start").edge("exit", "work").build();

            assertThat(rules(validator.validate(graph)))
                    .contains("start_no_incoming", "exit_no_outgoing");
        }

        @Test
        void shouldReportMalformedCondition() {
            Graph graph =
                    Graph.builder("g")
                            .node(Node.builder().id("start").shape(NodeShape.START).build())
                            .node(Node.builder().id("exit").shape(NodeShape.EXIT).build())
                            .edge(Edge.builder("start", "exit").condition("outcome").build())
                            .build();

            assertThat(validator.validate(graph))
                    .filteredOn(Diagnostic::isError)
                    .extracting(Diagnostic::rule)
                    .containsExactly("condition_syntax");
        }

        @Test
        void shouldThrowWithOnlyErrorsAttached() {
            Graph graph = Graph.builder("g").node(Node.builder().id("work").type("mystery").build()).build();

            assertThatThrownBy(() -> validator.validateOrThrow(graph))
                    .isInstanceOfSatisfying(
                            GraphValidationException.class,
                            e -> assertThat(e.getErrors()).allMatch(Diagnostic::isError).isNotEmpty());
        }
    }

    @Nested
    class Warnings {

        @Test
        void shouldWarnWithoutBlocking() {
            // Given
            Graph graph =
                    Graph.builder("g")
                            .node(Node.builder().id("start").shape(NodeShape.START).build())
                            .node(Node.builder().id("lint").type("lint").fidelity("tiny").build())
                            .node(
                                    Node.builder()
                                            .id("gate")
                                            .prompt("check")
                                            .goalGate(true)
                                            .retryTarget("nowhere")
                                            .build())
                            .node(Node.builder().id("empty").build())
                            .node(Node.builder().id("exit").shape(NodeShape.EXIT).build())
                            .edge("start", "lint")
                            .edge("lint", "gate")
                            .edge("gate", "empty")
                            .edge("empty", "exit")
                            .build();

            // When
            List<Diagnostic> warnings = validator.validateOrThrow(graph);

            // Then
            assertThat(warnings).allMatch(d -> d.severity() == Severity.WARNING);
            assertThat(rules(warnings))
                    .containsExactlyInAnyOrder(
                            "type_known", "fidelity_valid", "retry_target_exists", "prompt_on_llm_nodes");
        }

        @Test
        void shouldWarnAboutGoalGateWithoutAnyRetryTarget() {
            Graph graph =
                    linear().node(Node.builder().id("gate").prompt("x").goalGate(true).build())
                            .edge("work", "gate")
                            .build();

            assertThat(rules(validator.validate(graph))).containsExactly("goal_gate_has_retry");
        }

        @Test
        void shouldAcceptGraphLevelRetryTargetForGoalGate() {
            Graph graph =
                    linear().node(Node.builder().id("gate").prompt("x").goalGate(true).build())
                            .edge("work", "gate")
                            .attribute("retry_target", "work")
                            .build();

            assertThat(validator.validate(graph)).isEmpty();
        }
    }

    @Test
    void shouldRunExtraRulesAfterBuiltIns() {
        ValidationRule custom =
                graph -> List.of(Diagnostic.forGraph("custom", Severity.INFO, "note", ""));

        List<Diagnostic> diagnostics = new StructuralGraphValidator(List.of(custom)).validate(linear().build());

        assertThat(rules(diagnostics)).containsExactly("custom");
    }
}
