package io.conduit.core.interviewer;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Exchanges questions and answers with another thread through a pair of queues.
///
/// The engine side calls {@link #ask(Question)}, which publishes the question
/// and blocks for an answer. The answering side polls {@link #pendingQuestion(Duration)}
/// and replies through {@link #respond(Question, Answer)}, or through
/// {@link #respond(Answer)} for whichever question is waiting.
///
/// The wait is bounded by the question's own timeout when it has one, else by
/// the interviewer's default timeout, else unbounded. An expired wait yields
/// {@link Answer#timeout()} and withdraws the question; a late answer to it is
/// discarded. An interrupted wait also yields {@link Answer#timeout()} and
/// leaves the thread's interrupt flag set.
///
/// @implNote Thread-safe.
public final class QueueInterviewer implements Interviewer {

    private static final Logger logger = Logger.getLogger(QueueInterviewer.class.getName());

    private final BlockingQueue<Question> questions = new LinkedBlockingQueue<>();
    private final BlockingQueue<Reply> replies = new LinkedBlockingQueue<>();
    private final Duration defaultTimeout;
    private volatile Question waiting;

    /// Creates an interviewer that waits indefinitely unless a question sets a timeout.
    public QueueInterviewer() {
        this(null);
    }

    /// @param defaultTimeout wait bound for questions without their own, null for none
    public QueueInterviewer(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Answer ask(Question question) {
        waiting = question;
        questions.add(question);
        Duration timeout = question.timeout() != null ? question.timeout() : defaultTimeout;
        try {
            Answer answer = awaitAnswer(question, timeout);
            if (answer == null) {
                questions.remove(question);
                logger.warning("No answer within " + timeout + " for stage '" + question.stage() + "'");
                return Answer.timeout();
            }
            return answer;
        } catch (InterruptedException e) {
            questions.remove(question);
            Thread.currentThread().interrupt();
            return Answer.timeout();
        } finally {
            waiting = null;
        }
    }

    private Answer awaitAnswer(Question question, Duration timeout) throws InterruptedException {
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
        while (true) {
            Reply reply;
            if (timeout == null) {
                reply = replies.take();
            } else {
                reply = replies.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (reply == null) {
                    return null;
                }
            }
            if (reply.question() == question) {
                return reply.answer();
            }
            logger.fine("Discarding answer for a question that is no longer waiting");
        }
    }

    /// Submits an answer for the question currently waiting. An answer sent
    /// while no question waits is discarded.
    public void respond(Answer answer) {
        replies.add(new Reply(waiting, Objects.requireNonNull(answer, "answer must not be null")));
    }

    /// Submits an answer for a question taken from {@link #pendingQuestion(Duration)}.
    public void respond(Question question, Answer answer) {
        Objects.requireNonNull(question, "question must not be null");
        replies.add(new Reply(question, Objects.requireNonNull(answer, "answer must not be null")));
    }

    /// Takes the next published question, waiting up to `timeout`.
    ///
    /// @return the question, or empty if none arrived in time
    public Optional<Question> pendingQuestion(Duration timeout) {
        try {
            return Optional.ofNullable(questions.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private record Reply(Question question, Answer answer) {}
}
