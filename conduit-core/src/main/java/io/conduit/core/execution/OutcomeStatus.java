package io.conduit.core.execution;

/// Status of a single node execution.
///
/// Each status has a lower-case wire value used by condition expressions
/// (`outcome=success`) and stored in the run context under `outcome`.
///
/// @see Outcome
public enum OutcomeStatus {

    /// Node finished and produced what was asked.
    SUCCESS("success"),

    /// Node finished with some, but not all, of its work succeeding.
    PARTIAL_SUCCESS("partial_success"),

    /// Node failed; consumes one attempt of the node's retry budget.
    FAIL("fail"),

    /// Node is waiting on something else; the engine polls it again without consuming budget.
    RETRY("retry"),

    /// Node chose not to run.
    SKIPPED("skipped");

    private final String value;

    OutcomeStatus(String value) {
        this.value = value;
    }

    /// Returns the lower-case wire value.
    public String value() {
        return value;
    }

    /// Parses a wire value back into a status.
    ///
    /// @param value lower-case status value, not null
    /// @return matching status
    /// @throws IllegalArgumentException if the value is unknown
    public static OutcomeStatus fromValue(String value) {
        for (OutcomeStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown outcome status: " + value);
    }
}
