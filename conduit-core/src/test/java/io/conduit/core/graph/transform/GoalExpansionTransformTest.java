package io.conduit.core.graph.transform;

import static org.assertj.core.api.Assertions.assertThat;

import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import org.junit.jupiter.api.Test;

class GoalExpansionTransformTest {

    private final GoalExpansionTransform transform = new GoalExpansionTransform();

    @Test
    void shouldSubstituteGoalIntoPrompts() {
        // Given
        Graph graph =
                Graph.builder("g")
                        .attribute("goal", "ship the release")
                        .node(Node.builder().id("plan").prompt("Plan how to $goal, then $goal").build())
                        .node(Node.builder().id("review").prompt("Review").build())
                        .build();

        // When
        Graph expanded = transform.apply(graph);

        // Then
        assertThat(expanded.node("plan"))
                .map(Node::getPrompt)
                .contains("Plan how to ship the release, then ship the release");
        assertThat(expanded.node("review")).map(Node::getPrompt).contains("Review");
    }

    @Test
    void shouldReturnSameGraphWithoutGoal() {
        Graph graph = Graph.builder("g").node(Node.builder().id("plan").prompt("Do $goal").build()).build();

        assertThat(transform.apply(graph)).isSameAs(graph);
    }
}
