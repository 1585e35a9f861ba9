package io.conduit.core.execution.handler;

import java.util.Map;

/// A callable invoked by `tool` nodes.
///
/// A returned `Map` is merged into the run context as is; any other non-null
/// result is stored under `{nodeId}.result`.
@FunctionalInterface
public interface Tool {

    /// Invokes the tool.
    ///
    /// @param context snapshot of the run context, not null
    /// @return result, may be null for no context updates
    /// @throws Exception if the tool fails
    Object invoke(Map<String, Object> context) throws Exception;
}
