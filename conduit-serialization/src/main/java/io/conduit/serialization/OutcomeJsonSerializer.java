package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conduit.core.execution.Outcome;
import java.io.IOException;
import java.io.Serial;

/// Writes an {@link Outcome} in the per-stage `status.json` shape.
///
/// `failure_reason` is omitted when empty.
///
/// @implNote Package-private. Registered by {@link ConduitJacksonModule}.
class OutcomeJsonSerializer extends StdSerializer<Outcome> {

    @Serial private static final long serialVersionUID = 7716032458891020143L;

    OutcomeJsonSerializer() {
        super(Outcome.class);
    }

    @Override
    public void serialize(Outcome outcome, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(OutcomeFields.OUTCOME, outcome.getStatus().value());
        gen.writeStringField(OutcomeFields.PREFERRED_NEXT_LABEL, outcome.getPreferredLabel());
        provider.defaultSerializeField(
                OutcomeFields.SUGGESTED_NEXT_IDS, outcome.getSuggestedNextIds(), gen);
        provider.defaultSerializeField(
                OutcomeFields.CONTEXT_UPDATES, outcome.getContextUpdates(), gen);
        gen.writeStringField(OutcomeFields.NOTES, outcome.getNotes());
        if (!outcome.getFailureReason().isEmpty()) {
            gen.writeStringField(OutcomeFields.FAILURE_REASON, outcome.getFailureReason());
        }
        gen.writeEndObject();
    }
}
