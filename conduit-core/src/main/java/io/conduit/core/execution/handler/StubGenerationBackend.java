package io.conduit.core.execution.handler;

import java.util.Map;

/// Deterministic backend echoing the start of the prompt. Used when no real
/// backend is configured and in tests.
public final class StubGenerationBackend implements GenerationBackend {

    static final int PREVIEW_LENGTH = 50;

    @Override
    public String generate(
            String prompt,
            Map<String, Object> context,
            String model,
            String fidelity,
            String reasoningEffort) {
        String preview = prompt.length() > PREVIEW_LENGTH ? prompt.substring(0, PREVIEW_LENGTH) : prompt;
        return "stub response: " + preview;
    }
}
