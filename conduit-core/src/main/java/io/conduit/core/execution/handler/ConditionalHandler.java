package io.conduit.core.execution.handler;

import io.conduit.core.condition.ConditionEvaluator;
import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/// Branch node handler. Picks an outgoing edge label as the preferred label.
///
/// ### Resolution
/// 1. the first outgoing edge whose own condition holds against an assumed SUCCESS outcome
/// 2. when the prompt is a condition expression, its result selects an edge
///    labelled yes/true/y or no/false/n
/// 3. otherwise the prompt is read as a context key whose value is matched
///    case-insensitively against edge labels
///
/// When nothing matches the outcome is SUCCESS with no preference, leaving the
/// choice to the edge selector's weight rules.
public final class ConditionalHandler implements NodeHandler {

    private static final Set<String> TRUE_LABELS = Set.of("yes", "true", "y");
    private static final Set<String> FALSE_LABELS = Set.of("no", "false", "n");

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
        String prompt = node.promptOrLabel();
        List<Edge> outgoing = graph.outgoingEdges(node.getId());
        Outcome assumedSuccess = Outcome.builder().status(OutcomeStatus.SUCCESS).build();

        for (Edge edge : outgoing) {
            if (edge.hasCondition()
                    && ConditionEvaluator.evaluate(edge.condition(), assumedSuccess, context)) {
                return preferring(edge.label());
            }
        }

        if (prompt.contains("=")) {
            boolean result = ConditionEvaluator.evaluate(prompt, assumedSuccess, context);
            Set<String> wanted = result ? TRUE_LABELS : FALSE_LABELS;
            for (Edge edge : outgoing) {
                if (wanted.contains(normalize(edge.label()))) {
                    return preferring(edge.label());
                }
            }
        } else if (!prompt.isEmpty()) {
            String value = normalize(context.getString(prompt));
            if (!value.isEmpty()) {
                for (Edge edge : outgoing) {
                    if (normalize(edge.label()).equals(value)) {
                        return preferring(edge.label());
                    }
                }
            }
        }

        return Outcome.success();
    }

    private static Outcome preferring(String label) {
        return Outcome.builder().status(OutcomeStatus.SUCCESS).preferredLabel(label).build();
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
