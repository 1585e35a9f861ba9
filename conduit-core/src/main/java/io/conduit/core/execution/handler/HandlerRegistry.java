package io.conduit.core.execution.handler;

import io.conduit.core.graph.Node;
import java.util.Optional;

/// Registry mapping nodes to their handlers.
///
/// Resolution order for a node:
/// 1. explicit `type` attribute, when a handler is registered under it
/// 2. the handler type mapped from the node's `shape`
/// 3. the default handler, when one is set
///
/// ### Example usage
/// {@snippet :
/// HandlerRegistry registry = DefaultHandlerRegistry.withBuiltins(backend, interviewer, tools);
/// registry.register("lint", lintHandler);
/// NodeHandler handler = registry.resolve(node);
/// }
public interface HandlerRegistry {

    /// Registers a handler under a type string, replacing any existing one.
    ///
    /// @param type handler type, not blank
    /// @param handler the handler, not null
    void register(String type, NodeHandler handler);

    /// Maps a node shape to a handler type.
    ///
    /// @param shape shape name, not blank
    /// @param type handler type the shape resolves to, not blank
    void mapShape(String shape, String type);

    /// Sets the handler used when neither type nor shape resolves.
    ///
    /// @param handler fallback handler, null to clear
    void setDefaultHandler(NodeHandler handler);

    /// Returns the handler registered under a type.
    ///
    /// @param type handler type, not null
    /// @return the handler, or empty if none
    Optional<NodeHandler> getHandler(String type);

    /// Finds the handler for a node.
    ///
    /// @param node the node, not null
    /// @return resolved handler, or empty if nothing matches
    Optional<NodeHandler> find(Node node);

    /// Resolves the handler for a node.
    ///
    /// @param node the node, not null
    /// @return resolved handler, never null
    /// @throws HandlerNotFoundException if nothing matches
    default NodeHandler resolve(Node node) {
        return find(node)
                .orElseThrow(
                        () ->
                                new HandlerNotFoundException(
                                        "No handler for node '"
                                                + node.getId()
                                                + "' (type='"
                                                + node.getType()
                                                + "', shape='"
                                                + node.getShape()
                                                + "')"));
    }

    /// Returns true if a handler is registered under the type.
    default boolean hasHandler(String type) {
        return getHandler(type).isPresent();
    }
}
