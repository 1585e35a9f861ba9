package io.conduit.core.interviewer;

/// A human's response to a {@link Question}.
///
/// Structured answers carry an {@link AnswerValue}. Option selections carry the
/// chosen {@link Option} and free-text answers carry only `text`; for both the
/// `value` is null.
///
/// @param value canonical value, null for option and free-text answers
/// @param selectedOption chosen option, may be null
/// @param text answer text, never null
public record Answer(AnswerValue value, Option selectedOption, String text) {

    public Answer {
        text = text != null ? text : "";
    }

    public static Answer yes() {
        return new Answer(AnswerValue.YES, null, "YES");
    }

    public static Answer no() {
        return new Answer(AnswerValue.NO, null, "NO");
    }

    public static Answer skipped() {
        return new Answer(AnswerValue.SKIPPED, null, "");
    }

    public static Answer timeout() {
        return new Answer(AnswerValue.TIMEOUT, null, "");
    }

    /// Creates an answer selecting the given option; text is the option label.
    public static Answer option(Option option) {
        return new Answer(null, option, option.label());
    }

    /// Creates a free-text answer.
    public static Answer text(String text) {
        return new Answer(null, null, text);
    }

    public boolean isYes() {
        return value == AnswerValue.YES;
    }

    public boolean isNo() {
        return value == AnswerValue.NO;
    }

    public boolean wasSkipped() {
        return value == AnswerValue.SKIPPED;
    }

    public boolean timedOut() {
        return value == AnswerValue.TIMEOUT;
    }

    public boolean hasSelectedOption() {
        return selectedOption != null;
    }
}
