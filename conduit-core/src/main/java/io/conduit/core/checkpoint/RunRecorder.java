package io.conduit.core.checkpoint;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import java.io.IOException;
import java.time.Instant;

/// Records a run's artifacts: one manifest at start and one status record per
/// completed stage.
///
/// Failures are reported as {@link IOException}; the engine logs them and
/// carries on.
///
/// @see #NOOP for a recorder that records nothing
public interface RunRecorder {

    /// A recorder that discards everything.
    RunRecorder NOOP = new RunRecorder() {};

    /// Records the run manifest.
    ///
    /// @param graph the graph being run, not null
    /// @param startedAt run start time, not null
    /// @throws IOException if the manifest cannot be written
    default void recordManifest(Graph graph, Instant startedAt) throws IOException {}

    /// Records the final outcome of a stage.
    ///
    /// @param nodeId the stage's node id, not null
    /// @param outcome the accepted outcome, not null
    /// @throws IOException if the status cannot be written
    default void recordStageStatus(String nodeId, Outcome outcome) throws IOException {}
}
