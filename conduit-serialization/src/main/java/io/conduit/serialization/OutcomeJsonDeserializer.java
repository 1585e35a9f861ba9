package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Reads a stage `status.json` object back into an {@link Outcome}.
///
/// @implNote Package-private. Registered by {@link ConduitJacksonModule}.
class OutcomeJsonDeserializer extends StdDeserializer<Outcome> {

    @Serial private static final long serialVersionUID = -1398305563720915064L;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    OutcomeJsonDeserializer() {
        super(Outcome.class);
    }

    @Override
    public Outcome deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String status = text(root, OutcomeFields.OUTCOME);
        OutcomeStatus outcomeStatus;
        try {
            outcomeStatus = OutcomeStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw ctxt.weirdStringException(status, OutcomeStatus.class, e.getMessage());
        }

        Outcome.Builder builder =
                Outcome.builder()
                        .status(outcomeStatus)
                        .preferredLabel(text(root, OutcomeFields.PREFERRED_NEXT_LABEL))
                        .notes(text(root, OutcomeFields.NOTES))
                        .failureReason(text(root, OutcomeFields.FAILURE_REASON));
        JsonNode suggested = root.get(OutcomeFields.SUGGESTED_NEXT_IDS);
        if (suggested != null && !suggested.isNull()) {
            builder.suggestedNextIds(mapper.readerFor(STRING_LIST).readValue(suggested));
        }
        JsonNode updates = root.get(OutcomeFields.CONTEXT_UPDATES);
        if (updates != null && !updates.isNull()) {
            builder.contextUpdates(mapper.readerFor(OBJECT_MAP).readValue(updates));
        }
        return builder.build();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? "" : node.asText();
    }
}
