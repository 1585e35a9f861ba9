package io.conduit.core.execution;

import java.time.Duration;

/// Waits between retry attempts and retry polls.
///
/// The engine never calls {@link Thread#sleep} directly so tests can run
/// backoff schedules without waiting.
@FunctionalInterface
public interface Sleeper {

    /// Blocks the calling thread with {@link Thread#sleep}.
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /// Returns immediately.
    Sleeper NONE = duration -> {};

    /// Waits for the given duration.
    ///
    /// @param duration how long to wait, not null
    /// @throws InterruptedException if the thread is interrupted while waiting
    void sleep(Duration duration) throws InterruptedException;
}
