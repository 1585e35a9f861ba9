package io.conduit.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.execution.Outcome;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the Conduit serializer/deserializer pairs.
///
/// - `Checkpoint`: {@link CheckpointJsonSerializer} / {@link CheckpointJsonDeserializer}
/// - `Outcome`: {@link OutcomeJsonSerializer} / {@link OutcomeJsonDeserializer}
///
/// @see CheckpointSerializer for the convenience factory API
public class ConduitJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5518026742617338210L;

    public ConduitJacksonModule() {
        super("ConduitJacksonModule");

        addSerializer(Checkpoint.class, new CheckpointJsonSerializer());
        addDeserializer(Checkpoint.class, new CheckpointJsonDeserializer());

        addSerializer(Outcome.class, new OutcomeJsonSerializer());
        addDeserializer(Outcome.class, new OutcomeJsonDeserializer());
    }
}
