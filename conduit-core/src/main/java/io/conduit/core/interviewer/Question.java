package io.conduit.core.interviewer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A question posed to a human while a pipeline is paused.
///
/// @param text question text, not null
/// @param type question kind, not null
/// @param options choices for multiple-choice and yes/no questions, never null
/// @param defaultAnswer answer to assume on empty input, may be null
/// @param timeout how long to wait for an answer, null for no limit
/// @param stage id of the node asking, empty when not tied to a node
/// @param metadata free-form extra data, never null
public record Question(
        String text,
        QuestionType type,
        List<Option> options,
        String defaultAnswer,
        Duration timeout,
        String stage,
        Map<String, Object> metadata) {

    public Question {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(type, "type must not be null");
        options = options != null ? List.copyOf(options) : List.of();
        stage = stage != null ? stage : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /// Creates a question with no default, timeout or metadata.
    public static Question of(String text, QuestionType type, List<Option> options, String stage) {
        return new Question(text, type, options, null, null, stage, Map.of());
    }

    /// Returns a copy with the given timeout.
    public Question withTimeout(Duration timeout) {
        return new Question(text, type, options, defaultAnswer, timeout, stage, metadata);
    }

    /// Returns a copy with the given default answer.
    public Question withDefault(String defaultAnswer) {
        return new Question(text, type, options, defaultAnswer, timeout, stage, metadata);
    }
}
