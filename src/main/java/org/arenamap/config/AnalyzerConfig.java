package org.arenamap.config;

public final class AnalyzerConfig {
    private AnalyzerConfig() {}

    // Map symbols
    public static final char WALL = 'w';
    public static final char FLOOR = 'r';
    public static final char DOOR = 'd';

    // Default resource recipe (symbol, count)
    public static final char SPAWN_SYMBOL = 's';
    public static final char MEDKIT_SYMBOL = 'h';
    public static final char AMMO_SYMBOL = 'a';
    public static final int SPAWN_COUNT = 5;
    public static final int MEDKIT_COUNT = 4;
    public static final int AMMO_COUNT = 4;

    // Genome geometry
    public static final int CORRIDOR_WIDTH = 3;

    // Reducer: hard stop for the merge fixpoint
    public static final int MAX_MERGE_PASSES = 10_000;

    // Degree-fit target intervals [lo, hi] over the normalized degree
    public static final double SPAWN_DEGREE_LO = 0.1;
    public static final double SPAWN_DEGREE_HI = 0.3;
    public static final double MEDKIT_DEGREE_LO = 0.3;
    public static final double MEDKIT_DEGREE_HI = 0.5;
    public static final double AMMO_LOW_DEGREE_LO = 0.2;
    public static final double AMMO_LOW_DEGREE_HI = 0.4;
    public static final double AMMO_HIGH_DEGREE_LO = 0.8;
    public static final double AMMO_HIGH_DEGREE_HI = 0.9;

    // Room fitness
    public static final double PROXIMITY_WEIGHT = 0.25;

    // Tile fitness
    public static final double SPAWN_WALL_WEIGHT = 0.5;
    public static final double ITEM_WALL_WEIGHT = 0.25;
    public static final double OBJECT_DISTANCE_WEIGHT = 0.5;

    // Files: <MAPNAME>_map.txt and <MAPNAME>_AB.txt
    public static final String MAP_SUFFIX = "_map.txt";
    public static final String GENOME_SUFFIX = "_AB.txt";
}
