package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.execution.OutcomeStatus;
import io.conduit.core.graph.Edge;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.interviewer.Answer;
import io.conduit.core.interviewer.Interviewer;
import io.conduit.core.interviewer.Option;
import io.conduit.core.interviewer.Question;
import io.conduit.core.interviewer.QuestionType;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Handler for `wait.human` nodes: asks an {@link Interviewer} which way to go.
///
/// The question text is the node prompt (else label). Each labelled outgoing
/// edge becomes an option keyed by its index among the node's outgoing edges.
/// Two yes/no-like options make a YES_NO question, other options a
/// MULTIPLE_CHOICE one, and no options a FREEFORM one.
///
/// The answer becomes the preferred label: the selected option's label, else
/// the answer text, else the answer value. It is also stored under
/// `{nodeId}.answer`. A timed-out answer fails the node. An interrupt while
/// waiting is rethrown so the engine ends the run as cancelled.
///
/// When the node has a timeout it is passed on as the question timeout.
public final class WaitHumanHandler implements NodeHandler {

    private static final Logger logger = Logger.getLogger(WaitHumanHandler.class.getName());

    static final String TIMEOUT_REASON = "human answer timed out";

    private static final Set<String> YES_NO_LABELS = Set.of("yes", "no", "y", "n", "true", "false");

    private final Interviewer interviewer;

    public WaitHumanHandler(Interviewer interviewer) {
        this.interviewer = Objects.requireNonNull(interviewer, "interviewer must not be null");
    }

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir)
            throws InterruptedException {
        List<Edge> outgoing = graph.outgoingEdges(node.getId());
        List<Option> options = new ArrayList<>();
        for (int i = 0; i < outgoing.size(); i++) {
            Edge edge = outgoing.get(i);
            if (!edge.label().isEmpty()) {
                options.add(new Option(String.valueOf(i), edge.label()));
            }
        }

        QuestionType type;
        if (options.size() == 2 && isYesNoPair(options)) {
            type = QuestionType.YES_NO;
        } else if (!options.isEmpty()) {
            type = QuestionType.MULTIPLE_CHOICE;
        } else {
            type = QuestionType.FREEFORM;
        }

        Question question =
                Question.of(node.promptOrLabel(), type, options, node.getId())
                        .withTimeout(node.getTimeout());
        logger.info("Waiting for human answer at node " + node.getId());
        Answer answer = interviewer.ask(question);
        if (Thread.interrupted()) {
            throw new InterruptedException(
                    "Interrupted while waiting for a human answer at node " + node.getId());
        }

        if (answer.timedOut()) {
            return Outcome.fail(TIMEOUT_REASON);
        }

        String preferred;
        if (answer.hasSelectedOption()) {
            preferred = answer.selectedOption().label();
        } else if (!answer.text().isEmpty()) {
            preferred = answer.text();
        } else if (answer.value() != null) {
            preferred = answer.value().name();
        } else {
            preferred = "";
        }

        return Outcome.builder()
                .status(OutcomeStatus.SUCCESS)
                .preferredLabel(preferred)
                .contextUpdates(Map.of(node.getId() + ".answer", preferred))
                .build();
    }

    private static boolean isYesNoPair(List<Option> options) {
        for (Option option : options) {
            if (!YES_NO_LABELS.contains(option.label().trim().toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }
}
