package io.conduit.core.execution;

import io.conduit.core.state.RunContext;
import java.util.List;
import java.util.Optional;

/// Final result of a {@link PipelineEngine} run.
///
/// ### Permitted Subtypes
/// - {@link Completed} - the run reached an exit node with every goal gate satisfied
/// - {@link Failed} - the run stopped on an unrouted failure, dead end or bound
public sealed interface RunResult {

    /// Context at the end of the run.
    RunContext context();

    /// Ids of the stages that completed, in completion order.
    List<String> completedNodes();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /// The run reached an exit node.
    ///
    /// @param outcome outcome of the last stage before the exit node, not null
    /// @param context final run context, not null
    /// @param completedNodes completed stages in order, not null
    record Completed(Outcome outcome, RunContext context, List<String> completedNodes)
            implements RunResult {

        public Completed {
            completedNodes = List.copyOf(completedNodes);
        }
    }

    /// The run stopped without reaching an exit node.
    ///
    /// @param nodeId node the engine was at when it stopped, not null
    /// @param reason human-readable failure reason, not null
    /// @param lastOutcome outcome of the last executed stage, may be null
    /// @param context run context at the point of failure, not null
    /// @param completedNodes completed stages in order, not null
    record Failed(
            String nodeId,
            String reason,
            Outcome lastOutcome,
            RunContext context,
            List<String> completedNodes)
            implements RunResult {

        public Failed {
            completedNodes = List.copyOf(completedNodes);
        }

        public Optional<Outcome> lastOutcomeIfAny() {
            return Optional.ofNullable(lastOutcome);
        }
    }
}
