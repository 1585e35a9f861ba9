package io.conduit.core.execution.retry;

import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

/// How many times a node may run and how long to wait between attempts.
///
/// `maxAttempts` counts the first attempt, so a value of 1 means no retries.
///
/// ### Presets
/// | Name | Attempts | Initial delay | Factor |
/// |---|---|---|---|
/// | `none` | 1 | 200 ms | 2.0 |
/// | `standard` | 5 | 200 ms | 2.0 |
/// | `aggressive` | 5 | 500 ms | 2.0 |
/// | `linear` | 3 | 500 ms | 1.0 |
/// | `patient` | 3 | 2000 ms | 3.0 |
///
/// @param maxAttempts total attempts allowed, at least 1
/// @param backoff delay parameters, not null
public record RetryPolicy(int maxAttempts, BackoffConfig backoff) {

    private static final Logger logger = Logger.getLogger(RetryPolicy.class.getName());

    /// Graph attribute holding the default number of retries for nodes without their own.
    public static final String DEFAULT_MAX_RETRY_ATTRIBUTE = "default_max_retry";

    private static final Map<String, RetryPolicy> PRESETS =
            Map.of(
                    "none", new RetryPolicy(1, BackoffConfig.defaults()),
                    "standard", new RetryPolicy(5, BackoffConfig.of(200, 2.0)),
                    "aggressive", new RetryPolicy(5, BackoffConfig.of(500, 2.0)),
                    "linear", new RetryPolicy(3, BackoffConfig.of(500, 1.0)),
                    "patient", new RetryPolicy(3, BackoffConfig.of(2000, 3.0)));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(backoff, "backoff must not be null");
    }

    /// Returns the delay to wait after the given failed attempt.
    ///
    /// @param attempt 1-indexed attempt number
    /// @return `min(initial * factor^(attempt-1), max)`, jittered when enabled
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-indexed, got " + attempt);
        }
        double delay = backoff.initialDelayMs() * Math.pow(backoff.backoffFactor(), attempt - 1);
        delay = Math.min(delay, backoff.maxDelayMs());
        if (backoff.jitter()) {
            delay *= ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        }
        return Duration.ofMillis(Math.round(delay));
    }

    /// Returns true when a further attempt is allowed after `attemptsUsed`.
    public boolean allowsAnotherAttempt(int attemptsUsed) {
        return attemptsUsed < maxAttempts;
    }

    /// Looks up a named preset.
    ///
    /// @param name preset name, case-insensitive
    /// @return the preset, or empty if unknown
    public static Optional<RetryPolicy> preset(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PRESETS.get(name.toLowerCase(Locale.ROOT)));
    }

    /// Builds the policy for a node.
    ///
    /// A node with non-zero `maxRetries` gets `maxRetries + 1` attempts. Otherwise
    /// the graph attribute `default_max_retry` supplies the retry count; a missing
    /// or unparseable value means no retries. Retry counts are capped so the
    /// attempt count stays within `int` range.
    ///
    /// @param node the node about to run, not null
    /// @param graph the owning graph, not null
    /// @return policy with default backoff, never null
    public static RetryPolicy forNode(Node node, Graph graph) {
        int retries = node.getMaxRetries();
        if (retries == 0) {
            String fallback = graph.getAttributes().getOrDefault(DEFAULT_MAX_RETRY_ATTRIBUTE, "0");
            try {
                retries = Math.max(0, Integer.parseInt(fallback.trim()));
            } catch (NumberFormatException e) {
                logger.fine("Ignoring unparseable " + DEFAULT_MAX_RETRY_ATTRIBUTE + ": " + fallback);
                retries = 0;
            }
        }
        int attempts = Math.min(retries, Integer.MAX_VALUE - 1) + 1;
        return new RetryPolicy(attempts, BackoffConfig.defaults());
    }
}
