package io.conduit.core.checkpoint;

import java.io.IOException;
import java.util.Optional;

/// Persists the latest checkpoint of one run.
///
/// A store instance belongs to a single run; each save replaces the previous
/// checkpoint.
///
/// ### Usage
/// {@snippet :
/// String location = store.save(checkpoint);
///
/// // later, resume
/// store.load().ifPresent(cp -> engine = factory.resume(graph, cp));
/// }
///
/// @see InMemoryCheckpointStore for the in-memory implementation
public interface CheckpointStore {

    /// Saves a checkpoint, replacing any previous one.
    ///
    /// @param checkpoint the checkpoint to persist, not null
    /// @return a human-readable location, e.g. a file path, never null
    /// @throws IOException if the checkpoint cannot be written
    String save(Checkpoint checkpoint) throws IOException;

    /// Loads the latest checkpoint.
    ///
    /// @return the checkpoint, or empty if none was saved
    /// @throws IOException if a stored checkpoint cannot be read
    Optional<Checkpoint> load() throws IOException;
}
