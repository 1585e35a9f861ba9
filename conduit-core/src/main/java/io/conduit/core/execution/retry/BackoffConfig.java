package io.conduit.core.execution.retry;

/// Exponential backoff parameters for node retries.
///
/// @param initialDelayMs delay before the first retry, in milliseconds, not negative
/// @param backoffFactor multiplier applied per attempt, at least 1.0
/// @param maxDelayMs upper bound on the unjittered delay, in milliseconds
/// @param jitter whether to scale each delay by a uniform factor in [0.5, 1.5]
public record BackoffConfig(
        long initialDelayMs, double backoffFactor, long maxDelayMs, boolean jitter) {

    public static final long DEFAULT_INITIAL_DELAY_MS = 200;
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final long DEFAULT_MAX_DELAY_MS = 60_000;

    public BackoffConfig {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1.0");
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must not be below initialDelayMs");
        }
    }

    /// Returns the default configuration: 200 ms, factor 2.0, capped at 60 s, jittered.
    public static BackoffConfig defaults() {
        return new BackoffConfig(
                DEFAULT_INITIAL_DELAY_MS, DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_DELAY_MS, true);
    }

    /// Returns the default cap with the given initial delay and factor.
    public static BackoffConfig of(long initialDelayMs, double backoffFactor) {
        return new BackoffConfig(initialDelayMs, backoffFactor, DEFAULT_MAX_DELAY_MS, true);
    }

    /// Returns a copy with jitter switched off.
    public BackoffConfig withoutJitter() {
        return new BackoffConfig(initialDelayMs, backoffFactor, maxDelayMs, false);
    }
}
