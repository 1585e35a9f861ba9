package io.conduit.core.interviewer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Prompts a human on a terminal.
///
/// Yes/no and confirmation questions accept `y`/`yes`/`n`/`no`. Multiple-choice
/// questions accept the option key, its accelerator, or its label. Empty input
/// falls back to the question's default. End of input and an expired timeout
/// both yield {@link Answer#timeout()}.
///
/// @implNote A timed read runs on a daemon thread, since a blocked console read
/// cannot be interrupted. A read that outlives its timeout stays pending, and the
/// next question takes the line it returns.
public final class ConsoleInterviewer implements Interviewer {

    private static final Logger logger = Logger.getLogger(ConsoleInterviewer.class.getName());
    private static final String RULE = "=".repeat(60);

    private final BufferedReader in;
    private final PrintStream out;
    private final ExecutorService reader =
            Executors.newSingleThreadExecutor(
                    r -> {
                        Thread t = new Thread(r, "console-interviewer");
                        t.setDaemon(true);
                        return t;
                    });

    private Future<String> pending;

    /// Creates an interviewer on standard input and output.
    public ConsoleInterviewer() {
        this(System.in, System.out);
    }

    public ConsoleInterviewer(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public Answer ask(Question question) {
        out.println();
        out.println(RULE);
        out.println("  " + question.text());
        out.println(RULE);

        if (question.type() == QuestionType.YES_NO
                || question.type() == QuestionType.CONFIRMATION) {
            return askYesNo(question);
        }
        if (question.type() == QuestionType.MULTIPLE_CHOICE) {
            return askMultipleChoice(question);
        }
        return askFreeform(question);
    }

    private Answer askYesNo(Question question) {
        String raw = readLine("  [Y]es / [N]o: ", question.timeout());
        if (raw == null) {
            return Answer.timeout();
        }
        String input = raw.trim().toLowerCase(Locale.ROOT);
        if (input.equals("y") || input.equals("yes")) {
            return Answer.yes();
        }
        if (input.equals("n") || input.equals("no")) {
            return Answer.no();
        }
        if (input.isEmpty()) {
            if (question.defaultAnswer() == null) {
                return Answer.skipped();
            }
            String fallback = question.defaultAnswer().toLowerCase(Locale.ROOT);
            return fallback.equals("y") || fallback.equals("yes") ? Answer.yes() : Answer.no();
        }
        return new Answer(AnswerValue.NO, null, raw.trim());
    }

    private Answer askMultipleChoice(Question question) {
        Map<String, Option> byAccelerator = new HashMap<>();
        for (Option option : question.options()) {
            Accelerators.Parsed parsed = Accelerators.parse(option.label());
            if (parsed.hasKey()) {
                byAccelerator.put(parsed.key().toLowerCase(Locale.ROOT), option);
            }
            out.println("  [" + option.key() + "] " + option.label());
        }

        String raw = readLine("  Choice: ", question.timeout());
        if (raw == null) {
            return Answer.timeout();
        }
        String input = raw.trim();

        for (Option option : question.options()) {
            if (option.key().equals(input)) {
                return Answer.option(option);
            }
        }
        Option accelerated = byAccelerator.get(input.toLowerCase(Locale.ROOT));
        if (accelerated != null) {
            return Answer.option(accelerated);
        }
        for (Option option : question.options()) {
            if (option.label().trim().equalsIgnoreCase(input)) {
                return Answer.option(option);
            }
        }
        if (question.defaultAnswer() != null) {
            for (Option option : question.options()) {
                if (option.key().equals(question.defaultAnswer())
                        || option.label().trim().equalsIgnoreCase(question.defaultAnswer())) {
                    return Answer.option(option);
                }
            }
        }
        return Answer.text(input);
    }

    private Answer askFreeform(Question question) {
        String raw = readLine("  > ", question.timeout());
        if (raw == null) {
            return Answer.timeout();
        }
        String input = raw.trim();
        if (input.isEmpty() && question.defaultAnswer() != null) {
            input = question.defaultAnswer();
        }
        return Answer.text(input);
    }

    /// Reads one line, returning null on end of input or timeout.
    private synchronized String readLine(String prompt, Duration timeout) {
        out.print(prompt);
        out.flush();
        if (pending == null) {
            pending = reader.submit(this::readBlocking);
        }
        try {
            String line;
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                line = pending.get();
            } else {
                line = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            pending = null;
            return line;
        } catch (TimeoutException e) {
            logger.warning("Console answer timed out after " + timeout);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            pending = null;
            if (e.getCause() instanceof IOException io) {
                throw new UncheckedIOException("Failed to read console input", io);
            }
            throw new IllegalStateException("Console reader failed", e.getCause());
        }
    }

    private String readBlocking() throws IOException {
        return in.readLine();
    }
}
