package org.arenamap.graph;

/**
 * Node of a {@link RoomGraph}: either an {@link AreaNode} or a {@link ResourceNode}.
 */
public interface GraphNode {
    String id();

    /** Position of the node in graph order. */
    int index();

    double x();
    double y();

    boolean isArea();
}
