package io.conduit.core.checkpoint;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Snapshot of engine progress used to resume a run.
///
/// `currentNode` is the node the engine will execute next on resume. The
/// engine saves a checkpoint after every completed stage, pointing at the node
/// it is about to advance to.
///
/// @param timestamp when the checkpoint was taken, not null
/// @param currentNode node to execute on resume, not blank
/// @param completedNodes ids of completed stages in completion order, never null
/// @param nodeRetries attempts used per node, never null
/// @param contextValues full run context values, never null
/// @param logs run log entries in append order, never null
public record Checkpoint(
        Instant timestamp,
        String currentNode,
        List<String> completedNodes,
        Map<String, Integer> nodeRetries,
        Map<String, Object> contextValues,
        List<String> logs) {

    public Checkpoint {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (currentNode == null || currentNode.isBlank()) {
            throw new IllegalArgumentException("currentNode must not be blank");
        }
        completedNodes = completedNodes != null ? List.copyOf(completedNodes) : List.of();
        nodeRetries = nodeRetries != null ? Map.copyOf(nodeRetries) : Map.of();
        // context values may legitimately hold nulls, which Map.copyOf rejects
        contextValues =
                contextValues != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(contextValues))
                        : Map.of();
        logs = logs != null ? List.copyOf(logs) : List.of();
    }

    /// Creates a checkpoint stamped with the current time.
    public static Checkpoint now(
            String currentNode,
            List<String> completedNodes,
            Map<String, Integer> nodeRetries,
            Map<String, Object> contextValues,
            List<String> logs) {
        return new Checkpoint(
                Instant.now(), currentNode, completedNodes, nodeRetries, contextValues, logs);
    }
}
