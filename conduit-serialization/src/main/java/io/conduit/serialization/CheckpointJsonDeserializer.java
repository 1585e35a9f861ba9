package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conduit.core.checkpoint.Checkpoint;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/// Reads the JSON written by {@link CheckpointJsonSerializer} back into a {@link Checkpoint}.
///
/// Missing collections deserialize as empty. Context values come back as the
/// JSON-natural Java types: `String`, `Integer`/`Long`, `Double`, `Boolean`,
/// `List` and `Map`.
///
/// @implNote Package-private. Registered by {@link ConduitJacksonModule}.
class CheckpointJsonDeserializer extends StdDeserializer<Checkpoint> {

    @Serial private static final long serialVersionUID = -6043170905728147362L;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> RETRY_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    CheckpointJsonDeserializer() {
        super(Checkpoint.class);
    }

    @Override
    public Checkpoint deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode timestamp = root.get(CheckpointFields.TIMESTAMP);
        JsonNode currentNode = root.get(CheckpointFields.CURRENT_NODE);
        if (timestamp == null || currentNode == null) {
            throw ctxt.weirdStringException(
                    root.toString(), Checkpoint.class, "checkpoint requires timestamp and current_node");
        }
        Instant instant;
        try {
            instant = Instant.parse(timestamp.asText());
        } catch (DateTimeParseException e) {
            throw ctxt.weirdStringException(
                    timestamp.asText(), Instant.class, "timestamp is not ISO-8601");
        }

        return new Checkpoint(
                instant,
                currentNode.asText(),
                read(mapper, root, CheckpointFields.COMPLETED_NODES, STRING_LIST),
                read(mapper, root, CheckpointFields.NODE_RETRIES, RETRY_MAP),
                read(mapper, root, CheckpointFields.CONTEXT_VALUES, OBJECT_MAP),
                read(mapper, root, CheckpointFields.LOGS, STRING_LIST));
    }

    private static <T> T read(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<T> type)
            throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.readerFor(type).readValue(node);
    }
}
