package org.arenamap.graph;

import org.arenamap.world.GridView;
import org.arenamap.world.LineOfSight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unweighted graph with one node per non-wall tile. {@link #reachability} links tiles a
 * king move apart; {@link #visibility} links every pair of tiles in line of sight, so the
 * degree of a node is its visibility.
 */
public final class TileGraph implements WeightedGraph {
    private static final Logger LOG = LoggerFactory.getLogger(TileGraph.class);

    // Forward half of the 8-neighbourhood; the other half is covered from the neighbour.
    private static final int[][] FORWARD = { {1, 0}, {1, 1}, {0, 1}, {-1, 1} };

    private final List<TileNode> nodes = new ArrayList<>();
    private final int[][] indexOf;
    private final List<Map<Integer, Double>> adjacency = new ArrayList<>();

    private TileGraph(GridView grid) {
        indexOf = new int[grid.sizeX()][grid.sizeY()];
        for (int x = 0; x < grid.sizeX(); x++) {
            for (int y = 0; y < grid.sizeY(); y++) {
                if (grid.isWall(x, y)) {
                    indexOf[x][y] = -1;
                    continue;
                }
                int i = nodes.size();
                nodes.add(new TileNode(i, x, y, grid.get(x, y)));
                adjacency.add(new LinkedHashMap<>());
                indexOf[x][y] = i;
            }
        }
    }

    public static TileGraph reachability(GridView grid) {
        TileGraph g = new TileGraph(grid);
        for (TileNode n : g.nodes) {
            for (int[] d : FORWARD) {
                int j = g.indexAt(n.x + d[0], n.y + d[1]);
                if (j >= 0) g.connect(n.index, j);
            }
        }
        LOG.info("The tiles graph has {} nodes and {} edges", g.nodeCount(), g.edgeCount());
        return g;
    }

    public static TileGraph visibility(GridView grid) {
        TileGraph g = new TileGraph(grid);
        for (int i = 0; i < g.nodes.size(); i++) {
            TileNode a = g.nodes.get(i);
            for (int j = i + 1; j < g.nodes.size(); j++) {
                TileNode b = g.nodes.get(j);
                if (LineOfSight.visible(grid, a.x, a.y, b.x, b.y)) g.connect(i, j);
            }
        }
        LOG.info("The visibility graph has {} nodes and {} edges", g.nodeCount(), g.edgeCount());
        return g;
    }

    private void connect(int a, int b) {
        adjacency.get(a).put(b, 1.0);
        adjacency.get(b).put(a, 1.0);
    }

    /** Node index of a tile, or -1 for walls and out-of-bounds tiles. */
    public int indexAt(int x, int y) {
        if (x < 0 || y < 0 || x >= indexOf.length || y >= indexOf[0].length) return -1;
        return indexOf[x][y];
    }

    public boolean connected(int x1, int y1, int x2, int y2) {
        int a = indexAt(x1, y1), b = indexAt(x2, y2);
        return a >= 0 && b >= 0 && adjacency.get(a).containsKey(b);
    }

    public int nodeCount() { return nodes.size(); }

    public Map<Integer, Double> neighbours(int node) {
        return Collections.unmodifiableMap(adjacency.get(node));
    }

    public TileNode node(int index) { return nodes.get(index); }
    public List<TileNode> nodes() { return Collections.unmodifiableList(nodes); }
}
