package io.conduit.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.conduit.core.execution.handler.GenerationBackend;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link GenerationBackend}.
///
/// Sends the run context as a system message and the node prompt as a user
/// message. A node's `llm_model` picks a model from the named models; unknown
/// or empty names use the default model.
///
/// ### Context fidelity
/// | Fidelity | Context sent |
/// |---|---|
/// | empty, `full` | every value as-is |
/// | `truncate` | values cut to {@value #TRUNCATE_LIMIT} characters |
/// | `compact`, `summary:*` | values cut to {@value #COMPACT_LIMIT} characters |
///
/// Keys starting with `_` are never sent.
///
/// @implNote Thread-safe as long as the wrapped models are.
public class LangChain4jGenerationBackend implements GenerationBackend {

    private static final Logger logger =
            Logger.getLogger(LangChain4jGenerationBackend.class.getName());

    static final int TRUNCATE_LIMIT = 500;
    static final int COMPACT_LIMIT = 100;

    private final ChatModel defaultModel;
    private final Map<String, ChatModel> namedModels;

    /// @param defaultModel model used when a node names none, not null
    public LangChain4jGenerationBackend(ChatModel defaultModel) {
        this(defaultModel, Map.of());
    }

    /// @param defaultModel model used when a node names none or an unknown one, not null
    /// @param namedModels models selectable by a node's `llm_model`, not null
    public LangChain4jGenerationBackend(ChatModel defaultModel, Map<String, ChatModel> namedModels) {
        this.defaultModel = Objects.requireNonNull(defaultModel, "defaultModel must not be null");
        this.namedModels = Map.copyOf(namedModels);
    }

    /// Calls the selected chat model.
    ///
    /// @throws IllegalStateException if the model returns no text
    @Override
    public String generate(
            String prompt,
            Map<String, Object> context,
            String model,
            String fidelity,
            String reasoningEffort) {
        ChatModel chatModel = select(model);
        logger.fine(
                "Generating with model '" + (model == null || model.isEmpty() ? "default" : model)
                        + "', fidelity '" + fidelity + "', reasoning effort '" + reasoningEffort + "'");

        ChatResponse response = chatModel.chat(buildMessages(prompt, context, fidelity));
        if (response == null || response.aiMessage() == null) {
            throw new IllegalStateException("No response from model");
        }
        AiMessage aiMessage = response.aiMessage();
        if (aiMessage.text() == null) {
            throw new IllegalStateException("Model response contained no text");
        }
        return aiMessage.text();
    }

    ChatModel select(String model) {
        if (model == null || model.isEmpty()) {
            return defaultModel;
        }
        return namedModels.getOrDefault(model, defaultModel);
    }

    List<ChatMessage> buildMessages(String prompt, Map<String, Object> context, String fidelity) {
        List<ChatMessage> messages = new ArrayList<>();
        String system = buildSystemPrompt(context, limitFor(fidelity));
        if (!system.isEmpty()) {
            messages.add(SystemMessage.from(system));
        }
        messages.add(UserMessage.from(prompt));
        return messages;
    }

    private static String buildSystemPrompt(Map<String, Object> context, int limit) {
        if (context == null || context.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        context.forEach(
                (key, value) -> {
                    if (!key.startsWith("_")) {
                        sb.append("- ").append(key).append(": ").append(cut(value, limit)).append("\n");
                    }
                });
        if (sb.length() == 0) {
            return "";
        }
        return "Context information:\n" + sb;
    }

    private static int limitFor(String fidelity) {
        if (fidelity == null || fidelity.isEmpty() || "full".equals(fidelity)) {
            return Integer.MAX_VALUE;
        }
        return "truncate".equals(fidelity) ? TRUNCATE_LIMIT : COMPACT_LIMIT;
    }

    private static String cut(Object value, int limit) {
        String text = String.valueOf(value);
        return text.length() <= limit ? text : text.substring(0, limit) + "...";
    }
}
