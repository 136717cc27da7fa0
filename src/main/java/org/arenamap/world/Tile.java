package org.arenamap.world;

import org.arenamap.config.AnalyzerConfig;

public enum Tile {
    WALL(AnalyzerConfig.WALL),
    FLOOR(AnalyzerConfig.FLOOR),
    // Doors come from the map editor and never count as objects
    DOOR(AnalyzerConfig.DOOR),
    // Any other symbol: a placed object
    RESOURCE('\0');

    public final char glyph;

    Tile(char glyph) {
        this.glyph = glyph;
    }

    public static Tile of(char c) {
        for (Tile t : values()) {
            if (t != RESOURCE && t.glyph == c) return t;
        }
        return RESOURCE;
    }
}
