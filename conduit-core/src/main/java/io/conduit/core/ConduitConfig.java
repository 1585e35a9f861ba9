package io.conduit.core;

import io.conduit.core.execution.EngineConfig;
import io.conduit.core.execution.handler.ParallelHandler;
import java.nio.file.Path;
import java.time.Duration;

/// Configuration options for a Conduit environment.
///
/// Use the {@link Builder} for fluent configuration or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// - `logsRoot`: `logs` (relative to the working directory)
/// - `maxSteps`: `1000`
/// - `maxRetryPolls`: `600`
/// - `retryPollInterval`: `500 ms`
/// - `runTimeout`: none
/// - `branchTimeout`: `5 min`
/// - `checkpointEnabled`: `true`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link ConduitFactory}.
/// Do not modify after environment creation.
///
/// @see ConduitFactory#createEnvironment(ConduitConfig)
/// @see Builder
public class ConduitConfig {
    private Path logsRoot = Path.of("logs");
    private int maxSteps = EngineConfig.DEFAULT_MAX_STEPS;
    private int maxRetryPolls = EngineConfig.DEFAULT_MAX_RETRY_POLLS;
    private Duration retryPollInterval = EngineConfig.DEFAULT_RETRY_POLL_INTERVAL;
    private Duration runTimeout;
    private Duration branchTimeout = ParallelHandler.DEFAULT_BRANCH_TIMEOUT;
    private boolean checkpointEnabled = true;

    /// Creates a configuration with default values.
    public ConduitConfig() {}

    /// Returns the directory under which each run gets its own `{runId}` directory.
    ///
    /// @return the logs root, never null
    public Path getLogsRoot() {
        return logsRoot;
    }

    public void setLogsRoot(Path logsRoot) {
        this.logsRoot = logsRoot;
    }

    /// Returns the maximum number of node visits per run.
    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    /// Returns how many consecutive RETRY outcomes a node may produce before
    /// the engine gives up on it.
    public int getMaxRetryPolls() {
        return maxRetryPolls;
    }

    public void setMaxRetryPolls(int maxRetryPolls) {
        this.maxRetryPolls = maxRetryPolls;
    }

    public Duration getRetryPollInterval() {
        return retryPollInterval;
    }

    public void setRetryPollInterval(Duration retryPollInterval) {
        this.retryPollInterval = retryPollInterval;
    }

    /// Returns the overall run deadline.
    ///
    /// @return the timeout, or null when runs are unbounded in time
    public Duration getRunTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }

    /// Returns the bound applied to each branch of a parallel node.
    public Duration getBranchTimeout() {
        return branchTimeout;
    }

    public void setBranchTimeout(Duration branchTimeout) {
        this.branchTimeout = branchTimeout;
    }

    public boolean isCheckpointEnabled() {
        return checkpointEnabled;
    }

    public void setCheckpointEnabled(boolean checkpointEnabled) {
        this.checkpointEnabled = checkpointEnabled;
    }

    /// Derives the engine limits for one run.
    ///
    /// @param runDir the run's own directory, not null
    /// @return engine configuration rooted at `runDir`, never null
    public EngineConfig toEngineConfig(Path runDir) {
        return EngineConfig.builder()
                .logsRoot(runDir)
                .maxSteps(maxSteps)
                .maxRetryPolls(maxRetryPolls)
                .retryPollInterval(retryPollInterval)
                .runTimeout(runTimeout)
                .checkpointEnabled(checkpointEnabled)
                .build();
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ConduitConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}. The returned config can still be modified
    /// via setters after building.
    public static class Builder {
        private final ConduitConfig config = new ConduitConfig();

        public Builder logsRoot(Path logsRoot) {
            config.logsRoot = logsRoot;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            config.maxSteps = maxSteps;
            return this;
        }

        public Builder maxRetryPolls(int maxRetryPolls) {
            config.maxRetryPolls = maxRetryPolls;
            return this;
        }

        public Builder retryPollInterval(Duration retryPollInterval) {
            config.retryPollInterval = retryPollInterval;
            return this;
        }

        /// Sets the overall run deadline.
        ///
        /// @param runTimeout deadline, null for none
        /// @return this builder for chaining, never null
        public Builder runTimeout(Duration runTimeout) {
            config.runTimeout = runTimeout;
            return this;
        }

        public Builder branchTimeout(Duration branchTimeout) {
            config.branchTimeout = branchTimeout;
            return this;
        }

        public Builder checkpointEnabled(boolean checkpointEnabled) {
            config.checkpointEnabled = checkpointEnabled;
            return this;
        }

        /// Builds and returns the configured {@link ConduitConfig} instance.
        ///
        /// @return the configured instance, never null
        public ConduitConfig build() {
            return config;
        }
    }
}
