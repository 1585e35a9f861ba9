package io.conduit.core.execution.handler;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link ToolRegistry}.
public final class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    /// Creates an empty tool registry.
    public DefaultToolRegistry() {}

    /// Creates a tool registry with initial tools.
    ///
    /// @param initialTools tools by name, not null
    public DefaultToolRegistry(Map<String, Tool> initialTools) {
        Objects.requireNonNull(initialTools, "initialTools must not be null");
        initialTools.forEach(this::register);
    }

    @Override
    public void register(String name, Tool tool) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        Objects.requireNonNull(tool, "tool must not be null");
        tools.put(name, tool);
    }

    @Override
    public Optional<Tool> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(tools.keySet());
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.containsKey(name);
    }

    @Override
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.remove(name) != null;
    }
}
