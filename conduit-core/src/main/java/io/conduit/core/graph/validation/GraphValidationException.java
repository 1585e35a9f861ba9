package io.conduit.core.graph.validation;

import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/// Thrown when pre-run validation finds ERROR-severity diagnostics.
public class GraphValidationException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2875036610472297735L;

    private final transient List<Diagnostic> errors;

    public GraphValidationException(List<Diagnostic> errors) {
        super(
                "Validation failed with "
                        + errors.size()
                        + " error(s): "
                        + errors.stream().map(Diagnostic::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    /// Returns the ERROR diagnostics that blocked the run.
    public List<Diagnostic> getErrors() {
        return errors;
    }
}
