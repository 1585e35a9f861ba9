package io.conduit.core.interviewer;

/// Kind of question presented to a human.
public enum QuestionType {
    YES_NO,
    MULTIPLE_CHOICE,
    FREEFORM,
    CONFIRMATION
}
