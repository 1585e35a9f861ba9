package io.conduit.core.event;

import io.conduit.core.event.PipelineEvent.CheckpointSaved;
import io.conduit.core.event.PipelineEvent.PipelineCompleted;
import io.conduit.core.event.PipelineEvent.PipelineFailed;
import io.conduit.core.event.PipelineEvent.PipelineStarted;
import io.conduit.core.event.PipelineEvent.StageCompleted;
import io.conduit.core.event.PipelineEvent.StageFailed;
import io.conduit.core.event.PipelineEvent.StageRetrying;
import io.conduit.core.event.PipelineEvent.StageStarted;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// Writes every pipeline event to the log.
///
/// Lifecycle events go to INFO, failures and retries to WARNING, checkpoint
/// saves to FINE.
///
/// ### Log Format
/// ```
/// [pipeline] started: <graph>
/// [nodeId] started
/// [nodeId] completed: success
/// [nodeId] failed (will retry): <error>
/// [nodeId] retrying attempt 2 after 400ms
/// ```
public final class LoggingEventListener implements Consumer<PipelineEvent> {

    private static final Logger logger = Logger.getLogger(LoggingEventListener.class.getName());

    @Override
    public void accept(PipelineEvent event) {
        if (event instanceof PipelineStarted e) {
            logger.info("[pipeline] started: " + e.graphName());
        } else if (event instanceof PipelineCompleted e) {
            logger.info("[pipeline] completed: " + e.graphName());
        } else if (event instanceof PipelineFailed e) {
            logger.warning("[pipeline] failed: " + e.graphName() + ": " + e.error());
        } else if (event instanceof StageStarted e) {
            logger.info("[" + e.nodeId() + "] started");
        } else if (event instanceof StageCompleted e) {
            logger.info("[" + e.nodeId() + "] completed: " + e.outcome().getStatus().value());
        } else if (event instanceof StageFailed e) {
            logger.warning(
                    "["
                            + e.nodeId()
                            + "] failed"
                            + (e.willRetry() ? " (will retry)" : "")
                            + ": "
                            + e.error());
        } else if (event instanceof StageRetrying e) {
            logger.warning(
                    "["
                            + e.nodeId()
                            + "] retrying attempt "
                            + (e.attempt() + 1)
                            + " after "
                            + e.delay().toMillis()
                            + "ms");
        } else if (event instanceof CheckpointSaved e) {
            logger.fine("[" + e.nodeId() + "] checkpoint saved: " + e.location());
        }
    }
}
