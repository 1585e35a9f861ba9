package io.conduit.core.interviewer;

import java.util.Objects;
import java.util.function.Function;

/// Delegates each question to a caller-supplied function.
public final class CallbackInterviewer implements Interviewer {

    private final Function<Question, Answer> callback;

    public CallbackInterviewer(Function<Question, Answer> callback) {
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
    }

    @Override
    public Answer ask(Question question) {
        Answer answer = callback.apply(question);
        return Objects.requireNonNull(answer, "callback returned a null answer");
    }
}
