package org.arenamap.placement;

import org.arenamap.graph.RoomGraph;
import org.arenamap.world.TileGrid;

import java.util.List;

public final class PlacementResult {
    private final TileGrid grid;
    private final RoomGraph graph;
    private final List<PlacedObject> placed;

    PlacementResult(TileGrid grid, RoomGraph graph, List<PlacedObject> placed) {
        this.grid = grid;
        this.graph = graph;
        this.placed = List.copyOf(placed);
    }

    public TileGrid grid() { return grid; }
    public RoomGraph graph() { return graph; }

    /** Every placed object in placement order. */
    public List<PlacedObject> placed() { return placed; }

    public long count(char symbol) {
        return placed.stream().filter(p -> p.symbol == symbol).count();
    }
}
