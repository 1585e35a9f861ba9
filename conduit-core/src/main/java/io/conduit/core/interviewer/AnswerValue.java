package io.conduit.core.interviewer;

/// Canonical answer values for structured questions.
public enum AnswerValue {
    YES,
    NO,
    SKIPPED,
    TIMEOUT
}
