package io.conduit.core.execution.handler;

import io.conduit.core.execution.Outcome;
import io.conduit.core.graph.Graph;
import io.conduit.core.graph.Node;
import io.conduit.core.state.RunContext;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Handler for `tool` nodes: invokes a registered {@link Tool} with a context snapshot.
///
/// The tool is looked up by node id, then by label. A missing tool or a thrown
/// exception is reported as FAIL.
public final class ToolHandler implements NodeHandler {

    private static final Logger logger = Logger.getLogger(ToolHandler.class.getName());

    private final ToolRegistry tools;

    public ToolHandler(ToolRegistry tools) {
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
    }

    @Override
    public Outcome execute(Node node, RunContext context, Graph graph, Path logDir) {
        Optional<Tool> tool = tools.get(node.getId());
        if (tool.isEmpty() && !node.getLabel().isEmpty()) {
            tool = tools.get(node.getLabel());
        }
        if (tool.isEmpty()) {
            return Outcome.fail(
                    "No tool registered for node '"
                            + node.getId()
                            + "' or label '"
                            + node.getLabel()
                            + "'");
        }

        Object result;
        try {
            result = tool.get().invoke(context.snapshot());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail("Tool '" + node.getId() + "' interrupted");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Tool failed for node " + node.getId(), e);
            return Outcome.fail("Tool '" + node.getId() + "' raised: " + e.getMessage());
        }

        if (result == null) {
            return Outcome.success();
        }
        if (result instanceof Map<?, ?> map) {
            Map<String, Object> updates = new LinkedHashMap<>();
            map.forEach((k, v) -> updates.put(String.valueOf(k), v));
            return Outcome.success(updates);
        }
        return Outcome.success(Map.of(node.getId() + ".result", result));
    }
}
