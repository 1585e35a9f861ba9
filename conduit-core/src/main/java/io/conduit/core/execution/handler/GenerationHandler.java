package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Handler for `codergen` nodes: sends the node prompt to a {@link GenerationBackend}.
///
/// The response is stored under `{nodeId}.response`. A backend exception is
/// reported as a FAIL outcome carrying the exception text.
public final class GenerationHandler implements NodeHandler {

    private static final Logger logger = Logger.getLogger(GenerationHandler.class.getName());

    private final GenerationBackend backend;

    public GenerationHandler(GenerationBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
        String response;
        try {
            response =
                    backend.generate(
                            node.promptOrLabel(),
                            context.snapshot(),
                            node.getLlmModel(),
                            node.getFidelity(),
                            node.getReasoningEffort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail("Generation interrupted");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Generation failed for node " + node.getId(), e);
            return Outcome.fail("Generation backend error: " + e.getMessage());
        }
        return Outcome.success(Map.of(node.getId() + ".response", response != null ? response : ""));
    }
}
