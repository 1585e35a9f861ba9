package io.conduit.core.checkpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// In-memory checkpoint store (default implementation).
///
/// Keeps only the latest checkpoint. {@link #withHistory()} creates a store
/// that keeps every saved checkpoint, for tests that inspect the sequence.
///
/// @implNote Thread-safe.
public final class InMemoryCheckpointStore implements CheckpointStore {

    static final String LOCATION = "memory";

    private final boolean keepHistory;
    private final List<Checkpoint> history = new ArrayList<>();

    public InMemoryCheckpointStore() {
        this(false);
    }

    private InMemoryCheckpointStore(boolean keepHistory) {
        this.keepHistory = keepHistory;
    }

    /// Creates a store that retains every saved checkpoint in save order.
    public static InMemoryCheckpointStore withHistory() {
        return new InMemoryCheckpointStore(true);
    }

    @Override
    public synchronized String save(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        if (!keepHistory) {
            history.clear();
        }
        history.add(checkpoint);
        return LOCATION;
    }

    @Override
    public synchronized Optional<Checkpoint> load() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /// Returns the retained checkpoints in save order: all of them for a
    /// store made by {@link #withHistory()}, else at most the latest.
    public synchronized List<Checkpoint> history() {
        return List.copyOf(history);
    }

    public synchronized void clear() {
        history.clear();
    }
}
