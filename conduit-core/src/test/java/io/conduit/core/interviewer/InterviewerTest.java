package io.conduit.core.interviewer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InterviewerTest {

    private static final List<Option> CHOICES =
            List.of(new Option("0", "[A] Approve"), new Option("1", "[R] Rework"));

    @Nested
    class AutoApprove {

        private final AutoApproveInterviewer interviewer = new AutoApproveInterviewer();

        @Test
        void shouldAnswerYesToYesNoQuestions() {
            Answer answer = interviewer.ask(Question.of("Ok?", QuestionType.YES_NO, List.of(), "s"));

            assertThat(answer.isYes()).isTrue();
        }

        @Test
        void shouldPickFirstOption() {
            Answer answer =
                    interviewer.ask(Question.of("Pick", QuestionType.MULTIPLE_CHOICE, CHOICES, "s"));

            assertThat(answer.selectedOption()).isEqualTo(CHOICES.get(0));
        }

        @Test
        void shouldApproveFreeform() {
            Answer answer = interviewer.ask(Question.of("Notes?", QuestionType.FREEFORM, List.of(), "s"));

            assertThat(answer.text()).isEqualTo(AutoApproveInterviewer.APPROVED);
        }
    }

    @Nested
    class Queue {

        @Test
        void shouldTimeOutWhenNobodyAnswers() {
            // Given
            QueueInterviewer interviewer = new QueueInterviewer(Duration.ofMillis(50));

            // When
            Answer answer = interviewer.ask(Question.of("Ok?", QuestionType.YES_NO, List.of(), "gate"));

            // Then
            assertThat(answer.timedOut()).isTrue();
        }

        @Test
        void shouldHandAnswerFromOtherThread() throws Exception {
            // Given
            QueueInterviewer interviewer = new QueueInterviewer();
            CompletableFuture<Answer> pending =
                    CompletableFuture.supplyAsync(
                            () -> interviewer.ask(Question.of("Ok?", QuestionType.YES_NO, List.of(), "gate")));

            // When
            Optional<Question> asked = interviewer.pendingQuestion(Duration.ofSeconds(5));
            interviewer.respond(Answer.no());

            // Then
            assertThat(asked).map(Question::stage).contains("gate");
            assertThat(pending.get(5, TimeUnit.SECONDS).isNo()).isTrue();
        }

        @Test
        void shouldDiscardLateAnswerToTimedOutQuestion() throws Exception {
            // Given
            QueueInterviewer interviewer = new QueueInterviewer(Duration.ofMillis(50));
            Answer first = interviewer.ask(Question.of("Deploy?", QuestionType.YES_NO, List.of(), "deploy"));
            interviewer.respond(Answer.no());

            // When
            CompletableFuture<Answer> second =
                    CompletableFuture.supplyAsync(
                            () ->
                                    interviewer.ask(
                                            Question.of("Ok?", QuestionType.YES_NO, List.of(), "review")
                                                    .withTimeout(Duration.ofSeconds(5))));
            Optional<Question> asked = interviewer.pendingQuestion(Duration.ofSeconds(5));
            interviewer.respond(asked.orElseThrow(), Answer.yes());

            // Then
            assertThat(first.timedOut()).isTrue();
            assertThat(asked).map(Question::stage).contains("review");
            assertThat(second.get(5, TimeUnit.SECONDS).isYes()).isTrue();
        }

        @Test
        void shouldAnswerTimeoutAndKeepInterruptFlagWhenInterrupted() {
            QueueInterviewer interviewer = new QueueInterviewer();
            Thread.currentThread().interrupt();

            Answer answer = interviewer.ask(Question.of("Ok?", QuestionType.YES_NO, List.of(), "gate"));

            assertThat(answer.timedOut()).isTrue();
            assertThat(Thread.interrupted()).isTrue();
            assertThat(interviewer.pendingQuestion(Duration.ofMillis(10))).isEmpty();
        }

        @Test
        void shouldReportNoPendingQuestion() {
            assertThat(new QueueInterviewer().pendingQuestion(Duration.ofMillis(10))).isEmpty();
        }
    }

    @Nested
    class Recording {

        @Test
        void shouldKeepTranscriptInOrder() {
            RecordingInterviewer interviewer = new RecordingInterviewer(new AutoApproveInterviewer());
            Question first = Question.of("One?", QuestionType.YES_NO, List.of(), "a");
            Question second = Question.of("Two?", QuestionType.FREEFORM, List.of(), "b");

            interviewer.ask(first);
            interviewer.ask(second);

            assertThat(interviewer.transcript())
                    .extracting(RecordingInterviewer.Exchange::question)
                    .containsExactly(first, second);

            interviewer.clear();
            assertThat(interviewer.transcript()).isEmpty();
        }
    }

    @Nested
    class Callback {

        @Test
        void shouldRejectNullAnswer() {
            CallbackInterviewer interviewer = new CallbackInterviewer(q -> null);
            Question question = Question.of("Ok?", QuestionType.YES_NO, List.of(), "a");

            assertThatThrownBy(() -> interviewer.ask(question)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class Console {

        private final ByteArrayOutputStream output = new ByteArrayOutputStream();

        private ConsoleInterviewer reading(String input) {
            return new ConsoleInterviewer(
                    new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                    new PrintStream(output, true, StandardCharsets.UTF_8));
        }

        @Test
        void shouldSelectOptionByAccelerator() {
            Answer answer =
                    reading("r\n").ask(Question.of("Pick", QuestionType.MULTIPLE_CHOICE, CHOICES, "s"));

            assertThat(answer.selectedOption()).isEqualTo(CHOICES.get(1));
            assertThat(output.toString(StandardCharsets.UTF_8)).contains("[0] [A] Approve");
        }

        @Test
        void shouldParseYes() {
            Answer answer = reading("yes\n").ask(Question.of("Ok?", QuestionType.YES_NO, List.of(), "s"));

            assertThat(answer.isYes()).isTrue();
        }

        @Test
        void shouldUseDefaultOnEmptyInput() {
            Question question =
                    Question.of("Notes?", QuestionType.FREEFORM, List.of(), "s").withDefault("none");

            assertThat(reading("\n").ask(question).text()).isEqualTo("none");
        }

        @Test
        void shouldKeepLineTypedAfterTimeoutForNextQuestion() throws Exception {
            // Given
            PipedOutputStream keyboard = new PipedOutputStream();
            ConsoleInterviewer interviewer =
                    new ConsoleInterviewer(
                            new PipedInputStream(keyboard),
                            new PrintStream(output, true, StandardCharsets.UTF_8));
            Answer first =
                    interviewer.ask(
                            Question.of("Ok?", QuestionType.YES_NO, List.of(), "s")
                                    .withTimeout(Duration.ofMillis(100)));

            // When
            keyboard.write("y\n".getBytes(StandardCharsets.UTF_8));
            keyboard.flush();
            Answer second =
                    interviewer.ask(
                            Question.of("Still ok?", QuestionType.YES_NO, List.of(), "s")
                                    .withTimeout(Duration.ofSeconds(5)));

            // Then
            assertThat(first.timedOut()).isTrue();
            assertThat(second.isYes()).isTrue();
        }

        @Test
        void shouldTimeOutAtEndOfInput() {
            Answer answer = reading("").ask(Question.of("Ok?", QuestionType.YES_NO, List.of(), "s"));

            assertThat(answer.timedOut()).isTrue();
        }
    }
}
