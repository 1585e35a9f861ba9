package io.conduit.serialization;

/// JSON field names of a stage `status.json` file.
final class OutcomeFields {

    static final String OUTCOME = "outcome";
    static final String PREFERRED_NEXT_LABEL = "preferred_next_label";
    static final String SUGGESTED_NEXT_IDS = "suggested_next_ids";
    static final String CONTEXT_UPDATES = "context_updates";
    static final String NOTES = "notes";
    static final String FAILURE_REASON = "failure_reason";

    private OutcomeFields() {}
}
