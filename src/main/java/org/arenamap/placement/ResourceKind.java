package org.arenamap.placement;

import org.arenamap.config.AnalyzerConfig;
import org.arenamap.world.Room;

/**
 * Kinds of resource the engine places, in placement order. Each kind decides how tile
 * visibility and distance from the room walls count toward a tile's score, and whether
 * the last row and column of a room are candidate tiles.
 */
public enum ResourceKind {
    // Hidden spots away from the walls
    SPAWN("spawn points", AnalyzerConfig.SPAWN_WALL_WEIGHT, true) {
        @Override
        public double visibilityScore(double v) { return 1.0 - v; }
    },
    // Half-exposed spots
    MEDKIT("medkits", AnalyzerConfig.ITEM_WALL_WEIGHT, false) {
        @Override
        public double visibilityScore(double v) { return 1.0 - Math.abs(0.5 - v) * 2.0; }
    },
    // Exposed spots
    AMMO("ammo", AnalyzerConfig.ITEM_WALL_WEIGHT, false) {
        @Override
        public double visibilityScore(double v) { return v; }
    };

    public final String label;
    public final double wallWeight;
    public final boolean farEdge;

    ResourceKind(String label, double wallWeight, boolean farEdge) {
        this.label = label;
        this.wallWeight = wallWeight;
        this.farEdge = farEdge;
    }

    /** Last line scanned for candidate tiles in room r. */
    public int lastX(Room r) { return farEdge ? r.endX : r.endX - 1; }

    /** Last column scanned for candidate tiles in room r. */
    public int lastY(Room r) { return farEdge ? r.endY : r.endY - 1; }

    public abstract double visibilityScore(double visibility);
}
