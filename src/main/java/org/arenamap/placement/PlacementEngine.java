package org.arenamap.placement;

import org.arenamap.ConfigurationException;
import org.arenamap.config.AnalyzerConfig;
import org.arenamap.graph.AreaNode;
import org.arenamap.graph.GraphMetrics;
import org.arenamap.graph.ResourceNode;
import org.arenamap.graph.RoomGraph;
import org.arenamap.world.Room;
import org.arenamap.world.TileGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy resource placement. Spawn points go first, then medkits, then ammo (half of it
 * aimed at weakly connected rooms, the rest at hubs). For every unit the engine picks the
 * best scoring room, then the best scoring free tile inside it, and commits it before
 * scoring the next unit.
 */
public final class PlacementEngine {
    private static final Logger LOG = LoggerFactory.getLogger(PlacementEngine.class);

    private final ResourceSpec spawn;
    private final ResourceSpec medkit;
    private final ResourceSpec ammo;

    public PlacementEngine(ResourceSpec spawn, ResourceSpec medkit, ResourceSpec ammo) {
        if (spawn.symbol == medkit.symbol || spawn.symbol == ammo.symbol || medkit.symbol == ammo.symbol) {
            throw new IllegalArgumentException("Resource symbols must differ: " + spawn + ", " + medkit + ", " + ammo);
        }
        this.spawn = spawn;
        this.medkit = medkit;
        this.ammo = ammo;
    }

    public static PlacementEngine withDefaults() {
        return new PlacementEngine(
                ResourceSpec.of(AnalyzerConfig.SPAWN_SYMBOL, AnalyzerConfig.SPAWN_COUNT),
                ResourceSpec.of(AnalyzerConfig.MEDKIT_SYMBOL, AnalyzerConfig.MEDKIT_COUNT),
                ResourceSpec.of(AnalyzerConfig.AMMO_SYMBOL, AnalyzerConfig.AMMO_COUNT));
    }

    /** Clears grid of old resources and populates it in place. */
    public PlacementResult populate(TileGrid grid, List<Room> rooms) {
        LOG.info("Initializing the placement of {} rooms on a {}x{} map", rooms.size(), grid.sizeX(), grid.sizeY());
        LevelContext ctx = LevelContext.prepare(grid, rooms);
        return populate(ctx);
    }

    public PlacementResult populate(LevelContext ctx) {
        double[] degree = ctx.normalizedDegree();
        double[] spawnFit = GraphMetrics.intervalFit(degree, AnalyzerConfig.SPAWN_DEGREE_LO, AnalyzerConfig.SPAWN_DEGREE_HI);
        double[] medkitFit = GraphMetrics.intervalFit(degree, AnalyzerConfig.MEDKIT_DEGREE_LO, AnalyzerConfig.MEDKIT_DEGREE_HI);
        double[] lowAmmoFit = GraphMetrics.intervalFit(degree, AnalyzerConfig.AMMO_LOW_DEGREE_LO, AnalyzerConfig.AMMO_LOW_DEGREE_HI);
        double[] highAmmoFit = GraphMetrics.intervalFit(degree, AnalyzerConfig.AMMO_HIGH_DEGREE_LO, AnalyzerConfig.AMMO_HIGH_DEGREE_HI);

        LOG.info("Placing the spawn points");
        place(ctx, ResourceKind.SPAWN, spawn, spawnFit, symbols(spawn), 0, spawn.count);

        LOG.info("Placing the medkits");
        place(ctx, ResourceKind.MEDKIT, medkit, medkitFit, symbols(spawn, medkit), 0, medkit.count);

        LOG.info("Placing the ammo");
        int low = ammo.count / 2;
        place(ctx, ResourceKind.AMMO, ammo, lowAmmoFit, symbols(ammo, medkit), 0, low);
        place(ctx, ResourceKind.AMMO, ammo, highAmmoFit, symbols(ammo, medkit), low, ammo.count);

        LOG.info("Placed {} objects", ctx.placed().size());
        return new PlacementResult(ctx.grid(), ctx.graph(), ctx.placed());
    }

    private void place(LevelContext ctx, ResourceKind kind, ResourceSpec spec, double[] degreeFit,
                       Set<Character> nearSymbols, int fromUnit, int toUnit) {
        for (int unit = fromUnit; unit < toUnit; unit++) {
            AreaNode room = bestRoom(ctx, kind, spec, degreeFit, nearSymbols, unit);
            int[] tile = bestTile(ctx, kind, room.room(), unit);
            ctx.commit(tile[0], tile[1], spec.symbol);
            LOG.debug("Added {} '{}' in {} at [{}, {}]", kind.label, spec.symbol, room.id(), tile[0], tile[1]);
        }
    }

    private AreaNode bestRoom(LevelContext ctx, ResourceKind kind, ResourceSpec spec, double[] degreeFit,
                              Set<Character> nearSymbols, int unit) {
        RoomGraph graph = ctx.graph();
        AreaNode best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (AreaNode area : graph.areas()) {
            if (!hasFreeTile(ctx.grid(), kind, area.room())) continue;

            double proximity = proximity(ctx, area, nearSymbols);
            double redundancy = (double) graph.adjacentResources(area.index(), spec.symbol) / spec.count;
            double score = degreeFit[area.index()] + proximity * AnalyzerConfig.PROXIMITY_WEIGHT - redundancy;

            LOG.trace("{} has fitness {} + {} * {} - {} = {}", area.id(), degreeFit[area.index()], proximity,
                    AnalyzerConfig.PROXIMITY_WEIGHT, redundancy, score);
            if (score > bestScore) {
                bestScore = score;
                best = area;
            }
        }

        if (best == null) {
            throw new ConfigurationException("No room has a free candidate tile left", kind.label, unit);
        }
        return best;
    }

    // Weighted path to the nearest resource of the given symbols over the diameter.
    private double proximity(LevelContext ctx, AreaNode area, Set<Character> symbols) {
        if (ctx.diameter() <= 0.0) return 0.0;

        RoomGraph graph = ctx.graph();
        double[] dist = null;
        double nearest = Double.POSITIVE_INFINITY;

        for (ResourceNode r : graph.resources()) {
            if (!symbols.contains(r.symbol())) continue;
            if (dist == null) dist = GraphMetrics.shortestPaths(graph, area.index());
            nearest = Math.min(nearest, dist[r.index()]);
        }

        if (nearest == Double.POSITIVE_INFINITY) return 0.0;
        return nearest / ctx.diameter();
    }

    private int[] bestTile(LevelContext ctx, ResourceKind kind, Room room, int unit) {
        TileGrid grid = ctx.grid();
        int[] best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int x = room.originX; x <= kind.lastX(room); x++) {
            for (int y = room.originY; y <= kind.lastY(room); y++) {
                if (!grid.isFree(x, y)) continue;

                double score = kind.visibilityScore(ctx.visibility().value(x, y))
                        + wallDistance(room, x, y) * kind.wallWeight
                        + ctx.objectDistance(x, y) * AnalyzerConfig.OBJECT_DISTANCE_WEIGHT;
                if (score > bestScore) {
                    bestScore = score;
                    best = new int[]{x, y};
                }
            }
        }

        if (best == null) {
            throw new ConfigurationException("No free tile in " + room, kind.label, unit);
        }
        return best;
    }

    /** Steps to the nearest wall on each axis over half the room's extent. */
    static double wallDistance(Room r, int x, int y) {
        double half = (r.endX - r.originX) / 2.0 + (r.endY - r.originY) / 2.0;
        if (half == 0.0) return 0.0;
        int steps = Math.min(Math.abs(r.originX - x), Math.abs(r.endX - x))
                + Math.min(Math.abs(r.originY - y), Math.abs(r.endY - y));
        return steps / half;
    }

    private static boolean hasFreeTile(TileGrid grid, ResourceKind kind, Room r) {
        for (int x = r.originX; x <= kind.lastX(r); x++)
            for (int y = r.originY; y <= kind.lastY(r); y++)
                if (grid.isFree(x, y)) return true;
        return false;
    }

    private static Set<Character> symbols(ResourceSpec... specs) {
        Set<Character> out = new HashSet<>();
        for (ResourceSpec s : specs) out.add(s.symbol);
        return out;
    }
}
