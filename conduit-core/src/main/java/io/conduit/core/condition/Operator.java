package io.conduit.core.condition;

/// Comparison operators supported in edge conditions.
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    boolean test(String actual, String expected) {
        boolean equal = actual.equals(expected);
        return this == EQUALS ? equal : !equal;
    }
}
