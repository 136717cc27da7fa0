package org.arenamap.placement;

import org.arenamap.config.AnalyzerConfig;

/** Symbol written into the map for a resource and how many units to place. */
public final class ResourceSpec {
    public final char symbol;
    public final int count;

    public ResourceSpec(char symbol, int count) {
        if (symbol == AnalyzerConfig.WALL || symbol == AnalyzerConfig.FLOOR || symbol == AnalyzerConfig.DOOR) {
            throw new IllegalArgumentException("'" + symbol + "' is reserved for the map itself");
        }
        if (count < 0) throw new IllegalArgumentException("negative count for '" + symbol + "'");
        this.symbol = symbol;
        this.count = count;
    }

    public static ResourceSpec of(char symbol, int count) {
        return new ResourceSpec(symbol, count);
    }

    @Override
    public String toString() {
        return "'" + symbol + "' x" + count;
    }
}
