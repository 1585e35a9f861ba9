package io.conduit.core.interviewer;

/// Asks a human a question and returns the answer.
///
/// The engine thread blocks inside {@link #ask(Question)} until an answer is
/// available. Implementations that wait on an external party should honor
/// {@link Question#timeout()} and answer {@link Answer#timeout()} when it expires.
/// An interrupted wait also answers {@link Answer#timeout()}, with the thread's
/// interrupt flag left set so the caller can tell the two apart.
///
/// ### Implementations
/// - {@link AutoApproveInterviewer} approves everything, for unattended runs
/// - {@link CallbackInterviewer} delegates to a function
/// - {@link QueueInterviewer} exchanges questions and answers through queues
/// - {@link RecordingInterviewer} wraps another interviewer and keeps a transcript
/// - {@link ConsoleInterviewer} prompts on a terminal
@FunctionalInterface
public interface Interviewer {

    /// Asks a question, blocking until answered.
    ///
    /// @param question the question, not null
    /// @return the answer, never null
    Answer ask(Question question);
}
