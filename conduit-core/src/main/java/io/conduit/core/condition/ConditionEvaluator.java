package io.conduit.core.condition;

import io.conduit.core.execution.Outcome;
import io.conduit.core.state.RunContext;
import java.util.ArrayList;
import java.util.List;

/// Evaluates edge condition expressions against a node outcome and the run context.
///
/// ### Grammar
/// {@snippet :
/// Expr   = Clause ( '&&' Clause )*
/// Clause = Key ( '!=' | '=' ) Literal
/// }
///
/// Clauses are AND-combined and evaluation stops at the first false clause.
/// A blank expression is true. All comparisons are exact string comparisons.
///
/// ### Key resolution
/// - `outcome` resolves to the outcome's status wire value (`success`, `fail`, ...)
/// - `preferred_label` resolves to the outcome's preferred label
/// - `context.X` resolves to the context value at `context.X`, then at `X`
/// - any other key is looked up directly in the context
///
/// Missing values resolve to the empty string.
///
/// @implNote Stateless and thread-safe.
public final class ConditionEvaluator {

    private static final String AND = "&&";
    private static final String CONTEXT_PREFIX = "context.";

    private ConditionEvaluator() {}

    /// Evaluates a condition expression.
    ///
    /// @param expression the condition, may be null or blank
    /// @param outcome outcome of the node that just ran, not null
    /// @param context current run context, not null
    /// @return true if every clause holds
    /// @throws ConditionSyntaxException if the expression is malformed
    public static boolean evaluate(String expression, Outcome outcome, RunContext context) {
        if (expression == null || expression.isBlank()) {
            return true;
        }
        for (String part : expression.split(AND, -1)) {
            Clause clause = parseClause(part.trim(), expression);
            String actual = resolveKey(clause.key(), outcome, context);
            if (!clause.operator().test(actual, clause.literal())) {
                return false;
            }
        }
        return true;
    }

    /// Parses an expression into its clauses without evaluating it.
    ///
    /// @param expression the condition, may be null or blank
    /// @return clauses in source order, empty for a blank expression
    /// @throws ConditionSyntaxException if any clause is malformed
    public static List<Clause> parse(String expression) {
        List<Clause> clauses = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return clauses;
        }
        for (String part : expression.split(AND, -1)) {
            clauses.add(parseClause(part.trim(), expression));
        }
        return clauses;
    }

    /// Resolves a clause key to its string value.
    ///
    /// @param key the key, not null
    /// @param outcome outcome supplying `outcome` and `preferred_label`, not null
    /// @param context run context for all other keys, not null
    /// @return resolved value, empty when missing, never null
    public static String resolveKey(String key, Outcome outcome, RunContext context) {
        if ("outcome".equals(key)) {
            return outcome.getStatus().value();
        }
        if ("preferred_label".equals(key)) {
            return outcome.getPreferredLabel();
        }
        if (key.startsWith(CONTEXT_PREFIX)) {
            Object full = context.get(key);
            if (full != null) {
                return full.toString();
            }
            Object bare = context.get(key.substring(CONTEXT_PREFIX.length()));
            return bare != null ? bare.toString() : "";
        }
        Object value = context.get(key);
        return value != null ? value.toString() : "";
    }

    private static Clause parseClause(String text, String expression) {
        if (text.isEmpty()) {
            throw new ConditionSyntaxException("Empty clause in condition", expression);
        }
        // '!=' contains '=', so it has to be tried first
        Operator operator;
        int index = text.indexOf(Operator.NOT_EQUALS.symbol());
        if (index >= 0) {
            operator = Operator.NOT_EQUALS;
        } else {
            index = text.indexOf(Operator.EQUALS.symbol());
            if (index < 0) {
                throw new ConditionSyntaxException("Clause has no operator", expression);
            }
            operator = Operator.EQUALS;
        }
        String key = text.substring(0, index).trim();
        if (key.isEmpty()) {
            throw new ConditionSyntaxException("Clause has an empty key", expression);
        }
        String literal = text.substring(index + operator.symbol().length()).trim();
        return new Clause(key, operator, literal);
    }
}
