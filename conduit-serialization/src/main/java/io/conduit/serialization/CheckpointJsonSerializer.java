package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conduit.core.checkpoint.Checkpoint;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link Checkpoint} as a snake_case JSON object.
///
/// ```
/// {
///   "timestamp": "2025-01-15T10:30:00Z",
///   "current_node": "review",
///   "completed_nodes": ["start", "draft"],
///   "node_retries": {"draft": 1},
///   "context_values": {...},
///   "logs": [...]
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link ConduitJacksonModule}.
/// @see CheckpointJsonDeserializer for the inverse operation
class CheckpointJsonSerializer extends StdSerializer<Checkpoint> {

    @Serial private static final long serialVersionUID = 3920571286104315547L;

    CheckpointJsonSerializer() {
        super(Checkpoint.class);
    }

    @Override
    public void serialize(Checkpoint checkpoint, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(CheckpointFields.TIMESTAMP, checkpoint.timestamp().toString());
        gen.writeStringField(CheckpointFields.CURRENT_NODE, checkpoint.currentNode());
        provider.defaultSerializeField(
                CheckpointFields.COMPLETED_NODES, checkpoint.completedNodes(), gen);
        provider.defaultSerializeField(CheckpointFields.NODE_RETRIES, checkpoint.nodeRetries(), gen);
        provider.defaultSerializeField(
                CheckpointFields.CONTEXT_VALUES, checkpoint.contextValues(), gen);
        provider.defaultSerializeField(CheckpointFields.LOGS, checkpoint.logs(), gen);
        gen.writeEndObject();
    }
}
