package org.arenamap.placement;

import org.arenamap.graph.GraphMetrics;
import org.arenamap.graph.RoomGraph;
import org.arenamap.graph.VisibilityMatrix;
import org.arenamap.world.Room;
import org.arenamap.world.TileGrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State owned by one placement run: the grid being populated, the room graph that grows
 * a resource node per placement, and the objects placed so far. The visibility matrix,
 * diameter and normalized degrees describe the map before any placement.
 */
public final class LevelContext {
    private final TileGrid grid;
    private final RoomGraph graph;
    private final VisibilityMatrix visibility;
    private final double diameter;
    private final double[] normalizedDegree;
    private final List<PlacedObject> placed = new ArrayList<>();

    private LevelContext(TileGrid grid, RoomGraph graph, VisibilityMatrix visibility) {
        this.grid = grid;
        this.graph = graph;
        this.visibility = visibility;
        this.diameter = GraphMetrics.diameter(graph);
        this.normalizedDegree = GraphMetrics.normalizedDegree(graph);
    }

    /** Clears pre-existing resources from the grid and derives the level graphs. */
    public static LevelContext prepare(TileGrid grid, List<Room> rooms) {
        grid.clearResources();
        return new LevelContext(grid, RoomGraph.build(rooms), VisibilityMatrix.compute(grid));
    }

    public TileGrid grid() { return grid; }
    public RoomGraph graph() { return graph; }
    public VisibilityMatrix visibility() { return visibility; }
    public double diameter() { return diameter; }

    public double[] normalizedDegree() { return normalizedDegree.clone(); }

    public List<PlacedObject> placed() { return Collections.unmodifiableList(placed); }

    void commit(int x, int y, char symbol) {
        grid.set(x, y, symbol);
        graph.addResource(x, y, symbol);
        placed.add(new PlacedObject(x, y, symbol));
    }

    /** Distance to the nearest placed object over the map diagonal; 0 before the first. */
    double objectDistance(int x, int y) {
        if (placed.isEmpty()) return 0.0;
        double best = Double.POSITIVE_INFINITY;
        for (PlacedObject p : placed) best = Math.min(best, p.distanceTo(x, y));
        return best / grid.diagonal();
    }
}
