package io.conduit.serialization;

/// JSON field names of the checkpoint file.
final class CheckpointFields {

    static final String TIMESTAMP = "timestamp";
    static final String CURRENT_NODE = "current_node";
    static final String COMPLETED_NODES = "completed_nodes";
    static final String NODE_RETRIES = "node_retries";
    static final String CONTEXT_VALUES = "context_values";
    static final String LOGS = "logs";

    private CheckpointFields() {}
}
