package io.conduit.core.condition;

import java.io.Serial;

/// Thrown when an edge condition expression cannot be parsed.
public class ConditionSyntaxException extends IllegalArgumentException {
    @Serial private static final long serialVersionUID = 4127789301553472710L;

    private final String expression;

    public ConditionSyntaxException(String message, String expression) {
        super(message + ": '" + expression + "'");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
