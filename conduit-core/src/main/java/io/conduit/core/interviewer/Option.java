package io.conduit.core.interviewer;

import java.util.Objects;

/// A selectable choice of a multiple-choice question.
///
/// @param key identifier the answering side selects by, not null
/// @param label human-readable text, not null
public record Option(String key, String label) {

    public Option {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
