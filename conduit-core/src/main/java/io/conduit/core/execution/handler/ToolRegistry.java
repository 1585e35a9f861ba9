package io.conduit.core.execution.handler;

import java.util.Optional;
import java.util.Set;

/// Registry of tools available to `tool` nodes, keyed by name.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry tools = new DefaultToolRegistry();
/// tools.register("lint", ctx -> Map.of("lint.clean", true));
/// }
///
/// @implNote Implementations should be thread-safe; tools may be looked up
/// from parallel branches.
public interface ToolRegistry {

    /// Registers a tool, replacing any existing one with the same name.
    ///
    /// @param name tool name, not blank
    /// @param tool the tool, not null
    void register(String name, Tool tool);

    /// Retrieves a tool by name.
    ///
    /// @param name tool name, not null
    /// @return the tool if found, empty otherwise
    Optional<Tool> get(String name);

    /// Returns the names of all registered tools.
    Set<String> names();

    /// Returns whether a tool with the given name is registered.
    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /// Removes a tool by name.
    ///
    /// @return true if the tool was removed, false if not found
    default boolean remove(String name) {
        return false;
    }
}
