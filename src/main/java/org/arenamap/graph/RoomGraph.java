package org.arenamap.graph;

import org.arenamap.world.GridView;
import org.arenamap.world.Room;
import org.arenamap.world.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rooms-and-corridors graph. Area nodes and the edges between them are fixed when the
 * graph is built; afterwards only resource nodes (and their edges to the areas that
 * contain them) can be appended.
 */
public final class RoomGraph implements WeightedGraph {
    private static final Logger LOG = LoggerFactory.getLogger(RoomGraph.class);

    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<AreaNode> areas = new ArrayList<>();
    private final List<ResourceNode> resources = new ArrayList<>();
    private final List<Map<Integer, Double>> adjacency = new ArrayList<>();

    private RoomGraph() {}

    public static RoomGraph build(List<Room> rooms) {
        RoomGraph g = new RoomGraph();

        for (int i = 0; i < rooms.size(); i++) {
            AreaNode n = new AreaNode("r" + i, i, rooms.get(i));
            g.nodes.add(n);
            g.areas.add(n);
            g.adjacency.add(new LinkedHashMap<>());
        }

        for (int i = 0; i < rooms.size(); i++) {
            for (int j = i + 1; j < rooms.size(); j++) {
                Room a = rooms.get(i), b = rooms.get(j);
                if (a.touches(b)) {
                    g.connect(i, j, distance(a.centerX(), a.centerY(), b.centerX(), b.centerY()));
                }
            }
        }

        LOG.info("The rooms and corridors graph has {} nodes and {} edges", g.nodeCount(), g.edgeCount());
        return g;
    }

    /**
     * Rooms graph of an already populated map: every cell that is not wall, floor or door
     * becomes a resource node.
     */
    public static RoomGraph withObjects(List<Room> rooms, GridView grid) {
        RoomGraph g = build(rooms);
        for (int x = 0; x < grid.sizeX(); x++) {
            for (int y = 0; y < grid.sizeY(); y++) {
                if (grid.tile(x, y) == Tile.RESOURCE) g.addResource(x, y, grid.get(x, y));
            }
        }
        LOG.info("The rooms, corridors and objects graph has {} nodes and {} edges", g.nodeCount(), g.edgeCount());
        return g;
    }

    /** Appends a resource node linked to every area whose rectangle holds the tile. */
    public ResourceNode addResource(int x, int y, char symbol) {
        int index = nodes.size();
        ResourceNode r = new ResourceNode(symbol + "@" + x + "," + y, index, x, y, symbol);
        nodes.add(r);
        resources.add(r);
        adjacency.add(new LinkedHashMap<>());

        for (AreaNode a : areas) {
            if (a.room().contains(x, y)) {
                connect(a.index(), index, distance(a.x(), a.y(), x, y));
            }
        }
        return r;
    }

    private void connect(int a, int b, double weight) {
        adjacency.get(a).put(b, weight);
        adjacency.get(b).put(a, weight);
    }

    public int nodeCount() { return nodes.size(); }

    public Map<Integer, Double> neighbours(int node) {
        return Collections.unmodifiableMap(adjacency.get(node));
    }

    public GraphNode node(int index) { return nodes.get(index); }

    public List<GraphNode> nodes() { return Collections.unmodifiableList(nodes); }
    public List<AreaNode> areas() { return Collections.unmodifiableList(areas); }
    public List<ResourceNode> resources() { return Collections.unmodifiableList(resources); }

    /** Number of direct neighbours of node that are resources with the given symbol. */
    public int adjacentResources(int node, char symbol) {
        int n = 0;
        for (int other : adjacency.get(node).keySet()) {
            GraphNode o = nodes.get(other);
            if (!o.isArea() && ((ResourceNode) o).symbol() == symbol) n++;
        }
        return n;
    }

    static double distance(double x1, double y1, double x2, double y2) {
        double dx = x1 - x2, dy = y1 - y2;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
