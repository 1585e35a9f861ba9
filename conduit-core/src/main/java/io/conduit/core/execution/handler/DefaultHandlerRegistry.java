package io.conduit.core.execution.handler;

import io.conduit.core.graph.Node;
import io.conduit.core.graph.NodeShape;
import io.conduit.core.interviewer.Interviewer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of {@link HandlerRegistry}.
///
/// A new registry knows the standard shape mapping but has no handlers; use
/// {@link #withBuiltins} for one with all built-in handlers registered.
///
/// | Shape | Handler type |
/// |---|---|
/// | `Mdiamond` | `start` |
/// | `Msquare` | `exit` |
/// | `box` | `codergen` |
/// | `hexagon` | `wait.human` |
/// | `diamond` | `conditional` |
/// | `component` | `parallel` |
/// | `tripleoctagon` | `parallel.fan_in` |
/// | `parallelogram` | `tool` |
/// | `house` | `stack.manager_loop` |
///
/// @implNote Thread-safe. Registration is expected at setup time, but lookups
/// may run concurrently from parallel branches.
public class DefaultHandlerRegistry implements HandlerRegistry {

    private final Map<String, NodeHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, String> shapeToType = new ConcurrentHashMap<>();
    private volatile NodeHandler defaultHandler;

    /// Creates a registry with the standard shape mapping and no handlers.
    public DefaultHandlerRegistry() {
        shapeToType.put(NodeShape.START, HandlerTypes.START);
        shapeToType.put(NodeShape.EXIT, HandlerTypes.EXIT);
        shapeToType.put(NodeShape.BOX, HandlerTypes.CODERGEN);
        shapeToType.put(NodeShape.HEXAGON, HandlerTypes.WAIT_HUMAN);
        shapeToType.put(NodeShape.DIAMOND, HandlerTypes.CONDITIONAL);
        shapeToType.put(NodeShape.COMPONENT, HandlerTypes.PARALLEL);
        shapeToType.put(NodeShape.TRIPLE_OCTAGON, HandlerTypes.FAN_IN);
        shapeToType.put(NodeShape.PARALLELOGRAM, HandlerTypes.TOOL);
        shapeToType.put(NodeShape.HOUSE, HandlerTypes.STACK_MANAGER_LOOP);
    }

    /// Creates a registry with every built-in handler registered.
    ///
    /// @param backend generation backend for `codergen` nodes, null for {@link StubGenerationBackend}
    /// @param interviewer interviewer for `wait.human` nodes, null to leave that type unregistered
    /// @param tools tools for `tool` nodes, null for an empty registry
    /// @return populated registry, never null
    public static DefaultHandlerRegistry withBuiltins(
            GenerationBackend backend, Interviewer interviewer, ToolRegistry tools) {
        return withBuiltins(backend, interviewer, tools, ParallelHandler.DEFAULT_BRANCH_TIMEOUT);
    }

    /// Same as {@link #withBuiltins(GenerationBackend, Interviewer, ToolRegistry)}
    /// with an explicit bound on each parallel branch.
    public static DefaultHandlerRegistry withBuiltins(
            GenerationBackend backend,
            Interviewer interviewer,
            ToolRegistry tools,
            Duration branchTimeout) {
        DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
        registry.register(HandlerTypes.START, new StartHandler());
        registry.register(HandlerTypes.EXIT, new ExitHandler());
        registry.register(HandlerTypes.CONDITIONAL, new ConditionalHandler());
        registry.register(
                HandlerTypes.CODERGEN,
                new GenerationHandler(backend != null ? backend : new StubGenerationBackend()));
        if (interviewer != null) {
            registry.register(HandlerTypes.WAIT_HUMAN, new WaitHumanHandler(interviewer));
        }
        registry.register(HandlerTypes.PARALLEL, new ParallelHandler(registry, branchTimeout));
        registry.register(HandlerTypes.FAN_IN, new FanInHandler());
        registry.register(
                HandlerTypes.TOOL, new ToolHandler(tools != null ? tools : new DefaultToolRegistry()));
        registry.register(HandlerTypes.STACK_MANAGER_LOOP, new StackManagerHandler(registry));
        return registry;
    }

    @Override
    public void register(String type, NodeHandler handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.put(type, handler);
    }

    @Override
    public void mapShape(String shape, String type) {
        if (shape == null || shape.isBlank() || type == null || type.isBlank()) {
            throw new IllegalArgumentException("shape and type cannot be null or blank");
        }
        shapeToType.put(shape, type);
    }

    @Override
    public void setDefaultHandler(NodeHandler handler) {
        this.defaultHandler = handler;
    }

    @Override
    public Optional<NodeHandler> getHandler(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    @Override
    public Optional<NodeHandler> find(Node node) {
        if (!node.getType().isEmpty()) {
            NodeHandler explicit = handlers.get(node.getType());
            if (explicit != null) {
                return Optional.of(explicit);
            }
        }
        String mapped = shapeToType.get(node.getShape());
        if (mapped != null) {
            NodeHandler byShape = handlers.get(mapped);
            if (byShape != null) {
                return Optional.of(byShape);
            }
        }
        return Optional.ofNullable(defaultHandler);
    }
}
