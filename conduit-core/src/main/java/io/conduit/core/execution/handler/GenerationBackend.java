package io.conduit.core.execution.handler;

import java.util.Map;

/// Produces text for `codergen` nodes, typically by calling a language model.
///
/// @see StubGenerationBackend for a deterministic implementation
/// @see GenerationHandler for the calling handler
@FunctionalInterface
public interface GenerationBackend {

    /// Generates a response.
    ///
    /// @param prompt the node prompt, not null
    /// @param context snapshot of the run context, read-only by convention, not null
    /// @param model requested model id, empty for the backend default
    /// @param fidelity requested context fidelity, empty for the default
    /// @param reasoningEffort requested reasoning effort, e.g. `high`
    /// @return generated text, never null
    /// @throws Exception if generation fails
    String generate(
            String prompt,
            Map<String, Object> context,
            String model,
            String fidelity,
            String reasoningEffort)
            throws Exception;
}
