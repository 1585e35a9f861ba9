package io.conduit.core.interviewer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Forwards questions to another interviewer and records every exchange.
///
/// @implNote Thread-safe.
public final class RecordingInterviewer implements Interviewer {

    /// One recorded exchange.
    public record Exchange(Question question, Answer answer) {}

    private final Interviewer delegate;
    private final List<Exchange> transcript = new ArrayList<>();

    public RecordingInterviewer(Interviewer delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public Answer ask(Question question) {
        Answer answer = delegate.ask(question);
        synchronized (transcript) {
            transcript.add(new Exchange(question, answer));
        }
        return answer;
    }

    /// Returns the recorded exchanges in order.
    public List<Exchange> transcript() {
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }

    public void clear() {
        synchronized (transcript) {
            transcript.clear();
        }
    }
}
