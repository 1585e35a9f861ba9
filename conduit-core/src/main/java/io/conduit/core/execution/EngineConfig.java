package io.conduit.core.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/// Per-run limits and locations for a {@link PipelineEngine}.
///
/// @param logsRoot directory under which each stage gets `{logsRoot}/{nodeId}`, not null
/// @param maxSteps maximum number of node visits before the run fails, positive
/// @param maxRetryPolls maximum consecutive RETRY outcomes from one node, non-negative
/// @param retryPollInterval wait between RETRY polls, not null
/// @param runTimeout overall deadline for the run, null for none
/// @param checkpointEnabled whether a checkpoint is saved after each stage
public record EngineConfig(
        Path logsRoot,
        int maxSteps,
        int maxRetryPolls,
        Duration retryPollInterval,
        Duration runTimeout,
        boolean checkpointEnabled) {

    public static final int DEFAULT_MAX_STEPS = 1000;
    public static final int DEFAULT_MAX_RETRY_POLLS = 600;
    public static final Duration DEFAULT_RETRY_POLL_INTERVAL = Duration.ofMillis(500);

    public EngineConfig {
        Objects.requireNonNull(logsRoot, "logsRoot must not be null");
        Objects.requireNonNull(retryPollInterval, "retryPollInterval must not be null");
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        if (maxRetryPolls < 0) {
            throw new IllegalArgumentException(
                    "maxRetryPolls must not be negative, got " + maxRetryPolls);
        }
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero())) {
            throw new IllegalArgumentException("runTimeout must be positive, got " + runTimeout);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder starting from the default limits.
    public static final class Builder {
        private Path logsRoot = Path.of("logs");
        private int maxSteps = DEFAULT_MAX_STEPS;
        private int maxRetryPolls = DEFAULT_MAX_RETRY_POLLS;
        private Duration retryPollInterval = DEFAULT_RETRY_POLL_INTERVAL;
        private Duration runTimeout;
        private boolean checkpointEnabled = true;

        private Builder() {}

        public Builder logsRoot(Path logsRoot) {
            this.logsRoot = logsRoot;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxRetryPolls(int maxRetryPolls) {
            this.maxRetryPolls = maxRetryPolls;
            return this;
        }

        public Builder retryPollInterval(Duration retryPollInterval) {
            this.retryPollInterval = retryPollInterval;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        public Builder checkpointEnabled(boolean checkpointEnabled) {
            this.checkpointEnabled = checkpointEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(
                    logsRoot,
                    maxSteps,
                    maxRetryPolls,
                    retryPollInterval,
                    runTimeout,
                    checkpointEnabled);
        }
    }
}
