package org.arenamap.graph;

import org.arenamap.world.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outline of every room: four corner points joined in a cycle
 * (origin, top-right, end, bottom-left).
 */
public final class OutlineGraph {
    private static final Logger LOG = LoggerFactory.getLogger(OutlineGraph.class);

    private final List<int[]> corners = new ArrayList<>();
    private final List<int[]> edges = new ArrayList<>();

    private OutlineGraph() {}

    public static OutlineGraph build(List<Room> rooms) {
        OutlineGraph g = new OutlineGraph();
        for (Room r : rooms) {
            int first = g.corners.size();
            g.corners.add(new int[]{r.originX, r.originY});
            g.corners.add(new int[]{r.endX, r.originY});
            g.corners.add(new int[]{r.endX, r.endY});
            g.corners.add(new int[]{r.originX, r.endY});
            for (int k = 0; k < 4; k++) {
                g.edges.add(new int[]{first + k, first + (k + 1) % 4});
            }
        }
        LOG.info("The outlines graph has {} nodes and {} edges", g.nodeCount(), g.edgeCount());
        return g;
    }

    public int nodeCount() { return corners.size(); }
    public int edgeCount() { return edges.size(); }

    /** Corner as {x, y}. */
    public int[] corner(int index) { return corners.get(index).clone(); }

    public List<int[]> edges() { return Collections.unmodifiableList(edges); }
}
