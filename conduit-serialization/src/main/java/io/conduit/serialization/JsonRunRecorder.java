package io.conduit.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.conduit.core.checkpoint.RunRecorder;
import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/// Writes run artifacts as JSON files under the run directory.
///
/// ```
/// {runDir}/
///   manifest.json          {"name", "goal", "started_at"}
///   {nodeId}/status.json   {"outcome", "preferred_next_label", "suggested_next_ids",
///                           "context_updates", "notes"}
/// ```
public final class JsonRunRecorder implements RunRecorder {

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String STATUS_FILE = "status.json";

    private final Path runDir;
    private final ObjectMapper mapper;

    /// @param runDir the run's directory, created on first write, not null
    public JsonRunRecorder(Path runDir) {
        this.runDir = Objects.requireNonNull(runDir, "runDir must not be null");
        this.mapper = CheckpointSerializer.createMapper();
    }

    @Override
    public void recordManifest(Graph graph, Instant startedAt) throws IOException {
        ObjectNode manifest = mapper.createObjectNode();
        manifest.put("name", graph.getName());
        manifest.put("goal", graph.goal());
        manifest.put("started_at", startedAt.toString());
        Files.createDirectories(runDir);
        mapper.writeValue(runDir.resolve(MANIFEST_FILE).toFile(), manifest);
    }

    @Override
    public void recordStageStatus(String nodeId, Outcome outcome) throws IOException {
        Path stageDir = runDir.resolve(nodeId);
        Files.createDirectories(stageDir);
        mapper.writeValue(stageDir.resolve(STATUS_FILE).toFile(), outcome);
    }
}
