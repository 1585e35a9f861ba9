package io.conduit.core.graph;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A single step in a pipeline graph.
///
/// Nodes are immutable descriptors produced by the graph loader. The `type`
/// (or, failing that, the `shape`) selects the handler; the `prompt` is
/// interpreted by that handler, e.g. as an LLM instruction, a comma-separated
/// list of child node ids, or a condition expression.
///
/// ### Contracts
/// - **Precondition**: `id` is non-blank
/// - **Invariant**: never mutated during a run; the attribute map is unmodifiable
///
/// @see Graph for node lookup
/// @see io.conduit.core.execution.handler.HandlerRegistry for handler resolution
public final class Node {

    private final String id;
    private final String label;
    private final String shape;
    private final String type;
    private final String prompt;
    private final int maxRetries;
    private final boolean goalGate;
    private final String retryTarget;
    private final String fallbackRetryTarget;
    private final String fidelity;
    private final String threadId;
    private final String nodeClass;
    private final Duration timeout;
    private final String llmModel;
    private final String llmProvider;
    private final String reasoningEffort;
    private final boolean autoStatus;
    private final boolean allowPartial;
    private final Map<String, String> attributes;

    private Node(Builder builder) {
        if (builder.id == null || builder.id.isBlank()) {
            throw new IllegalArgumentException("Node id must be a non-empty string");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for node " + builder.id);
        }
        this.id = builder.id;
        this.label = builder.label;
        this.shape = builder.shape;
        this.type = builder.type;
        this.prompt = builder.prompt;
        this.maxRetries = builder.maxRetries;
        this.goalGate = builder.goalGate;
        this.retryTarget = builder.retryTarget;
        this.fallbackRetryTarget = builder.fallbackRetryTarget;
        this.fidelity = builder.fidelity;
        this.threadId = builder.threadId;
        this.nodeClass = builder.nodeClass;
        this.timeout = builder.timeout;
        this.llmModel = builder.llmModel;
        this.llmProvider = builder.llmProvider;
        this.reasoningEffort = builder.reasoningEffort;
        this.autoStatus = builder.autoStatus;
        this.allowPartial = builder.allowPartial;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getShape() {
        return shape;
    }

    public String getType() {
        return type;
    }

    public String getPrompt() {
        return prompt;
    }

    /// Returns the number of extra attempts beyond the first, `0` meaning "use the graph default".
    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isGoalGate() {
        return goalGate;
    }

    public String getRetryTarget() {
        return retryTarget;
    }

    public String getFallbackRetryTarget() {
        return fallbackRetryTarget;
    }

    public String getFidelity() {
        return fidelity;
    }

    public String getThreadId() {
        return threadId;
    }

    public String getNodeClass() {
        return nodeClass;
    }

    /// Returns the per-node timeout, or null when none is declared.
    public Duration getTimeout() {
        return timeout;
    }

    public String getLlmModel() {
        return llmModel;
    }

    public String getLlmProvider() {
        return llmProvider;
    }

    public String getReasoningEffort() {
        return reasoningEffort;
    }

    public boolean isAutoStatus() {
        return autoStatus;
    }

    /// Returns whether an exhausted poll budget may be accepted as partial success.
    public boolean isAllowPartial() {
        return allowPartial;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /// Returns the label if set, otherwise the id.
    ///
    /// @return display name, never null
    public String displayName() {
        return label.isEmpty() ? id : label;
    }

    /// Returns the prompt if set, otherwise the label.
    ///
    /// Most handlers read their instruction this way so that graphs can put a
    /// short instruction directly in the label.
    ///
    /// @return prompt or label, never null
    public String promptOrLabel() {
        return prompt.isEmpty() ? label : prompt;
    }

    /// Creates a builder pre-populated with this node's fields.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .label(label)
                .shape(shape)
                .type(type)
                .prompt(prompt)
                .maxRetries(maxRetries)
                .goalGate(goalGate)
                .retryTarget(retryTarget)
                .fallbackRetryTarget(fallbackRetryTarget)
                .fidelity(fidelity)
                .threadId(threadId)
                .nodeClass(nodeClass)
                .timeout(timeout)
                .llmModel(llmModel)
                .llmProvider(llmProvider)
                .reasoningEffort(reasoningEffort)
                .autoStatus(autoStatus)
                .allowPartial(allowPartial)
                .attributes(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return maxRetries == other.maxRetries
                && goalGate == other.goalGate
                && autoStatus == other.autoStatus
                && allowPartial == other.allowPartial
                && id.equals(other.id)
                && label.equals(other.label)
                && shape.equals(other.shape)
                && type.equals(other.type)
                && prompt.equals(other.prompt)
                && retryTarget.equals(other.retryTarget)
                && fallbackRetryTarget.equals(other.fallbackRetryTarget)
                && fidelity.equals(other.fidelity)
                && threadId.equals(other.threadId)
                && nodeClass.equals(other.nodeClass)
                && Objects.equals(timeout, other.timeout)
                && llmModel.equals(other.llmModel)
                && llmProvider.equals(other.llmProvider)
                && reasoningEffort.equals(other.reasoningEffort)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, shape, type, prompt);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', shape='" + shape + "', type='" + type + "'}";
    }

    /// Builder for {@link Node}. String fields default to empty, never null.
    public static final class Builder {
        private String id;
        private String label = "";
        private String shape = NodeShape.BOX;
        private String type = "";
        private String prompt = "";
        private int maxRetries;
        private boolean goalGate;
        private String retryTarget = "";
        private String fallbackRetryTarget = "";
        private String fidelity = "";
        private String threadId = "";
        private String nodeClass = "";
        private Duration timeout;
        private String llmModel = "";
        private String llmProvider = "";
        private String reasoningEffort = "high";
        private boolean autoStatus;
        private boolean allowPartial;
        private Map<String, String> attributes = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder label(String label) {
            this.label = nullToEmpty(label);
            return this;
        }

        public Builder shape(String shape) {
            this.shape = nullToEmpty(shape);
            return this;
        }

        public Builder type(String type) {
            this.type = nullToEmpty(type);
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = nullToEmpty(prompt);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder goalGate(boolean goalGate) {
            this.goalGate = goalGate;
            return this;
        }

        public Builder retryTarget(String retryTarget) {
            this.retryTarget = nullToEmpty(retryTarget);
            return this;
        }

        public Builder fallbackRetryTarget(String fallbackRetryTarget) {
            this.fallbackRetryTarget = nullToEmpty(fallbackRetryTarget);
            return this;
        }

        public Builder fidelity(String fidelity) {
            this.fidelity = nullToEmpty(fidelity);
            return this;
        }

        public Builder threadId(String threadId) {
            this.threadId = nullToEmpty(threadId);
            return this;
        }

        public Builder nodeClass(String nodeClass) {
            this.nodeClass = nullToEmpty(nodeClass);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder llmModel(String llmModel) {
            this.llmModel = nullToEmpty(llmModel);
            return this;
        }

        public Builder llmProvider(String llmProvider) {
            this.llmProvider = nullToEmpty(llmProvider);
            return this;
        }

        public Builder reasoningEffort(String reasoningEffort) {
            this.reasoningEffort = nullToEmpty(reasoningEffort);
            return this;
        }

        public Builder autoStatus(boolean autoStatus) {
            this.autoStatus = autoStatus;
            return this;
        }

        public Builder allowPartial(boolean allowPartial) {
            this.allowPartial = allowPartial;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = new LinkedHashMap<>(attributes);
            return this;
        }

        public Builder attribute(String key, String value) {
            this.attributes.put(key, value);
            return this;
        }

        /// Builds the immutable node.
        ///
        /// @return new node, never null
        /// @throws IllegalArgumentException if the id is blank or maxRetries is negative
        public Node build() {
            return new Node(this);
        }

        private static String nullToEmpty(String value) {
            return value != null ? value : "";
        }
    }
}
