package io.conduit.core.graph;

/// Shape names recognized by the engine and the handler registry.
///
/// Shapes are a visual marker carried over from the graph definition. Two of them
/// carry engine semantics ({@link #START} and {@link #EXIT}); the rest select a
/// handler family when a node declares no explicit `type`.
public final class NodeShape {

    public static final String START = "Mdiamond";
    public static final String EXIT = "Msquare";
    public static final String BOX = "box";
    public static final String HEXAGON = "hexagon";
    public static final String DIAMOND = "diamond";
    public static final String COMPONENT = "component";
    public static final String TRIPLE_OCTAGON = "tripleoctagon";
    public static final String PARALLELOGRAM = "parallelogram";
    public static final String HOUSE = "house";

    private NodeShape() {}
}
