package io.conduit.core.execution;

import io.conduit.core.condition.ConditionEvaluator;
import io.conduit.core.graph.Edge;
import io.conduit.core.state.RunContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/// Chooses the outgoing edge to follow after a node completes.
///
/// ### Priority
/// Each step short-circuits the ones after it:
/// 1. edges whose condition holds, best by weight then by target id
/// 2. the first edge whose normalized label equals the outcome's normalized preferred label
/// 3. for each suggested next id in order, the first edge targeting it
/// 4. the best unconditional edge by weight then by target id
/// 5. the best of all edges by weight then by target id
///
/// "Best" means highest weight, ties broken by ascending lexical `toNode`.
///
/// @implNote Stateless and thread-safe.
public final class EdgeSelector {

    private static final Comparator<Edge> BEST_FIRST =
            Comparator.comparingInt(Edge::weight).reversed().thenComparing(Edge::toNode);

    private static final Pattern ACCELERATOR =
            Pattern.compile("^(?:\\[[a-z0-9]\\]\\s*|[a-z0-9]\\)\\s*|[a-z0-9]\\s*-\\s+)");

    private EdgeSelector() {}

    /// Selects the next edge.
    ///
    /// @param edges outgoing edges of the completed node, not null
    /// @param outcome the node's outcome, not null
    /// @param context current run context, not null
    /// @return selected edge, or empty when `edges` is empty
    /// @throws io.conduit.core.condition.ConditionSyntaxException if an edge condition is malformed
    public static Optional<Edge> select(List<Edge> edges, Outcome outcome, RunContext context) {
        if (edges.isEmpty()) {
            return Optional.empty();
        }

        Optional<Edge> conditional = selectConditional(edges, outcome, context);
        if (conditional.isPresent()) {
            return conditional;
        }

        String preferred = normalizeLabel(outcome.getPreferredLabel());
        if (!preferred.isEmpty()) {
            for (Edge edge : edges) {
                if (normalizeLabel(edge.label()).equals(preferred)) {
                    return Optional.of(edge);
                }
            }
        }

        for (String suggested : outcome.getSuggestedNextIds()) {
            for (Edge edge : edges) {
                if (edge.toNode().equals(suggested)) {
                    return Optional.of(edge);
                }
            }
        }

        Optional<Edge> unconditional =
                edges.stream().filter(e -> !e.hasCondition()).min(BEST_FIRST);
        if (unconditional.isPresent()) {
            return unconditional;
        }
        return edges.stream().min(BEST_FIRST);
    }

    /// Applies only the condition-match step.
    ///
    /// Used for routing failed outcomes, where only explicit conditions
    /// (typically `outcome=fail`) may move the run forward.
    ///
    /// @return best edge among those whose condition holds, or empty
    public static Optional<Edge> selectConditional(
            List<Edge> edges, Outcome outcome, RunContext context) {
        List<Edge> matched = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.hasCondition()
                    && ConditionEvaluator.evaluate(edge.condition(), outcome, context)) {
                matched.add(edge);
            }
        }
        return matched.stream().min(BEST_FIRST);
    }

    /// Normalizes an edge label for comparison.
    ///
    /// Lower-cases, trims and strips one leading accelerator prefix of the form
    /// `[k] `, `k) ` or `k - `.
    ///
    /// @param label raw label, may be null
    /// @return normalized label, never null
    public static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return ACCELERATOR.matcher(normalized).replaceFirst("").trim();
    }
}
