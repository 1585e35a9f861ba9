package io.conduit.core.event;

import io.conduit.core.execution.Outcome;
import java.time.Duration;

/// Lifecycle events emitted by the pipeline engine.
///
/// ### Order within one step
/// {@snippet :
/// StageStarted
/// (StageFailed [StageRetrying])*   // once per failed attempt
/// StageCompleted
/// CheckpointSaved
/// }
/// A run opens with {@link PipelineStarted} and closes with exactly one of
/// {@link PipelineCompleted} or {@link PipelineFailed}.
public sealed interface PipelineEvent
        permits PipelineEvent.PipelineStarted,
                PipelineEvent.PipelineCompleted,
                PipelineEvent.PipelineFailed,
                PipelineEvent.StageStarted,
                PipelineEvent.StageCompleted,
                PipelineEvent.StageFailed,
                PipelineEvent.StageRetrying,
                PipelineEvent.CheckpointSaved {

    record PipelineStarted(String graphName) implements PipelineEvent {}

    /// @param outcome outcome of the last executed stage before the exit node
    record PipelineCompleted(String graphName, Outcome outcome) implements PipelineEvent {}

    record PipelineFailed(String graphName, String error) implements PipelineEvent {}

    record StageStarted(String nodeId) implements PipelineEvent {}

    record StageCompleted(String nodeId, Outcome outcome) implements PipelineEvent {}

    /// @param willRetry true when retry budget remains and the node will run again
    record StageFailed(String nodeId, String error, boolean willRetry) implements PipelineEvent {}

    /// @param attempt 1-indexed number of the attempt about to run
    /// @param delay wait before the next attempt
    record StageRetrying(String nodeId, int attempt, Duration delay) implements PipelineEvent {}

    /// @param location where the checkpoint was stored, e.g. a file path
    record CheckpointSaved(String nodeId, String location) implements PipelineEvent {}
}
