package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.conduit.core.checkpoint.Checkpoint;
import io.conduit.core.execution.Outcome;

/// Utility class for converting checkpoints and stage outcomes to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = CheckpointSerializer.toJson(checkpoint);
/// Checkpoint restored = CheckpointSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see ConduitJacksonModule for the registered type handlers
public final class CheckpointSerializer {

    private CheckpointSerializer() {}

    /// Serializes a checkpoint to pretty-printed JSON.
    ///
    /// @param checkpoint the checkpoint to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Checkpoint checkpoint) {
        try {
            return createMapper().writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize checkpoint: " + e.getMessage(), e);
        }
    }

    /// Deserializes a checkpoint from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized checkpoint, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Checkpoint fromJson(String json) {
        try {
            return createMapper().readValue(json, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize checkpoint: " + e.getMessage(), e);
        }
    }

    /// Serializes a stage outcome in the `status.json` shape.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String outcomeToJson(Outcome outcome) {
        try {
            return createMapper().writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize outcome: " + e.getMessage(), e);
        }
    }

    /// @throws IllegalArgumentException if deserialization fails
    public static Outcome outcomeFromJson(String json) {
        try {
            return createMapper().readValue(json, Outcome.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize outcome: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Conduit run state.
    ///
    /// Registers:
    /// - `ConduitJacksonModule` for checkpoints and outcomes
    /// - `JavaTimeModule` for `Instant` and `Duration` context values
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ConduitJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
