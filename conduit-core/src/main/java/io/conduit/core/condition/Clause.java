package io.conduit.core.condition;

import java.util.Objects;

/// One `key op literal` comparison of a condition expression.
///
/// @param key the left-hand key, never blank
/// @param operator comparison operator, not null
/// @param literal right-hand literal with surrounding whitespace trimmed, may be empty
public record Clause(String key, Operator operator, String literal) {

    public Clause {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Clause key must not be blank");
        }
        Objects.requireNonNull(operator, "operator must not be null");
        literal = literal != null ? literal : "";
    }

    @Override
    public String toString() {
        return key + operator.symbol() + literal;
    }
}
