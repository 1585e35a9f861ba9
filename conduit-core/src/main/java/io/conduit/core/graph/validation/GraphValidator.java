package io.conduit.core.graph.validation;

import io.conduit.core.graph.Graph;
import java.util.List;

/// Checks a graph before it runs.
///
/// @see StructuralGraphValidator for the built-in rule set
public interface GraphValidator {

    /// Runs every rule.
    ///
    /// @param graph graph to check, not null
    /// @return all findings of every severity, never null
    List<Diagnostic> validate(Graph graph);

    /// Runs every rule and rejects the graph if any finding is an ERROR.
    ///
    /// @param graph graph to check, not null
    /// @return the non-error findings
    /// @throws GraphValidationException if any ERROR diagnostic was produced
    default List<Diagnostic> validateOrThrow(Graph graph) {
        List<Diagnostic> diagnostics = validate(graph);
        List<Diagnostic> errors = diagnostics.stream().filter(Diagnostic::isError).toList();
        if (!errors.isEmpty()) {
            throw new GraphValidationException(errors);
        }
        return diagnostics;
    }
}
