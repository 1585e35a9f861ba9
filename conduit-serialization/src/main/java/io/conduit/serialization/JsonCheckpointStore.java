package io.conduit.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.checkpoint.CheckpointStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Checkpoint store that keeps the latest checkpoint in `{runDir}/checkpoint.json`.
///
/// Each save replaces the file through a temporary sibling and a move, so a
/// reader never sees a half-written checkpoint.
///
/// @implNote Not safe for concurrent writers on the same run directory.
public final class JsonCheckpointStore implements CheckpointStore {

    private static final Logger logger = Logger.getLogger(JsonCheckpointStore.class.getName());

    public static final String FILE_NAME = "checkpoint.json";

    private final Path runDir;
    private final ObjectMapper mapper;

    /// @param runDir the run's directory, created on first save, not null
    public JsonCheckpointStore(Path runDir) {
        this.runDir = Objects.requireNonNull(runDir, "runDir must not be null");
        this.mapper = CheckpointSerializer.createMapper();
    }

    public Path file() {
        return runDir.resolve(FILE_NAME);
    }

    @Override
    public String save(Checkpoint checkpoint) throws IOException {
        Files.createDirectories(runDir);
        Path target = file();
        Path temp = runDir.resolve(FILE_NAME + ".tmp");
        Files.write(temp, mapper.writeValueAsBytes(checkpoint));
        try {
            Files.move(
                    temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move unsupported in " + runDir + ", replacing checkpoint in place");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target.toString();
    }

    @Override
    public Optional<Checkpoint> load() throws IOException {
        Path target = file();
        if (!Files.exists(target)) {
            return Optional.empty();
        }
        String json = Files.readString(target, StandardCharsets.UTF_8);
        return Optional.of(mapper.readValue(json, Checkpoint.class));
    }
}
