package io.conduit.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable result a handler returns after executing a node.
///
/// Besides the status, an outcome carries routing hints for the
/// {@link EdgeSelector} (`preferredLabel`, `suggestedNextIds`), the context
/// updates the engine merges into the run context once the node is accepted,
/// and diagnostic text.
///
/// ### Factory Methods
/// - {@link #success()} for a plain success
/// - {@link #fail(String)} for a handler-reported failure
/// - {@link #retry(String)} for a barrier poll
/// - {@link #builder()} for everything else
///
/// @implNote Immutable after construction. A fresh outcome is created by every
/// handler invocation.
///
/// @see OutcomeStatus for the possible statuses
public final class Outcome {

    private final OutcomeStatus status;
    private final String preferredLabel;
    private final List<String> suggestedNextIds;
    private final Map<String, Object> contextUpdates;
    private final String notes;
    private final String failureReason;

    private Outcome(Builder builder) {
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.preferredLabel = builder.preferredLabel;
        this.suggestedNextIds = List.copyOf(builder.suggestedNextIds);
        this.contextUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.contextUpdates));
        this.notes = builder.notes;
        this.failureReason = builder.failureReason;
    }

    /// Returns the execution status.
    ///
    /// @return status, never null
    public OutcomeStatus getStatus() {
        return status;
    }

    /// Returns the label the handler would like the edge selector to follow.
    ///
    /// @return preferred label, empty when none, never null
    public String getPreferredLabel() {
        return preferredLabel;
    }

    /// Returns ordered fallback target node ids.
    ///
    /// @return unmodifiable list, never null
    public List<String> getSuggestedNextIds() {
        return suggestedNextIds;
    }

    /// Returns the updates to merge into the run context.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> getContextUpdates() {
        return contextUpdates;
    }

    public String getNotes() {
        return notes;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /// Returns true for SUCCESS and PARTIAL_SUCCESS.
    public boolean succeeded() {
        return status == OutcomeStatus.SUCCESS || status == OutcomeStatus.PARTIAL_SUCCESS;
    }

    /// Returns true only for FAIL.
    public boolean failed() {
        return status == OutcomeStatus.FAIL;
    }

    /// Creates a success outcome with no hints or updates.
    public static Outcome success() {
        return builder().status(OutcomeStatus.SUCCESS).build();
    }

    /// Creates a success outcome carrying context updates.
    ///
    /// @param contextUpdates updates to merge, not null
    public static Outcome success(Map<String, ?> contextUpdates) {
        return builder().status(OutcomeStatus.SUCCESS).contextUpdates(contextUpdates).build();
    }

    /// Creates a failure outcome.
    ///
    /// @param failureReason why the node failed, not null
    public static Outcome fail(String failureReason) {
        return builder().status(OutcomeStatus.FAIL).failureReason(failureReason).build();
    }

    /// Creates a poll outcome asking the engine to run the node again.
    ///
    /// @param notes what the node is waiting for, not null
    public static Outcome retry(String notes) {
        return builder().status(OutcomeStatus.RETRY).notes(notes).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome other)) return false;
        return status == other.status
                && preferredLabel.equals(other.preferredLabel)
                && suggestedNextIds.equals(other.suggestedNextIds)
                && contextUpdates.equals(other.contextUpdates)
                && notes.equals(other.notes)
                && failureReason.equals(other.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, preferredLabel, suggestedNextIds, contextUpdates, notes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Outcome{").append(status.value());
        if (!preferredLabel.isEmpty()) sb.append(", preferredLabel='").append(preferredLabel).append('\'');
        if (!failureReason.isEmpty()) sb.append(", failureReason='").append(failureReason).append('\'');
        if (!notes.isEmpty()) sb.append(", notes='").append(notes).append('\'');
        return sb.append('}').toString();
    }

    /// Builder for {@link Outcome}. Text fields default to empty strings.
    public static final class Builder {
        private OutcomeStatus status = OutcomeStatus.SUCCESS;
        private String preferredLabel = "";
        private List<String> suggestedNextIds = List.of();
        private Map<String, Object> contextUpdates = Map.of();
        private String notes = "";
        private String failureReason = "";

        private Builder() {}

        public Builder status(OutcomeStatus status) {
            this.status = status;
            return this;
        }

        public Builder preferredLabel(String preferredLabel) {
            this.preferredLabel = preferredLabel != null ? preferredLabel : "";
            return this;
        }

        public Builder suggestedNextIds(List<String> suggestedNextIds) {
            this.suggestedNextIds = suggestedNextIds;
            return this;
        }

        public Builder contextUpdates(Map<String, ?> contextUpdates) {
            this.contextUpdates = new LinkedHashMap<>(contextUpdates);
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes != null ? notes : "";
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason != null ? failureReason : "";
            return this;
        }

        public Outcome build() {
            return new Outcome(this);
        }
    }
}
