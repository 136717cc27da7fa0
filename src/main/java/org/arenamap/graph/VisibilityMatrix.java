package org.arenamap.graph;

import org.arenamap.ConfigurationException;
import org.arenamap.world.GridView;
import org.arenamap.world.LineOfSight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Per-tile visibility: how many other non-wall tiles a tile sees, min-max normalized
 * over the whole map. Walls hold 0.
 */
public final class VisibilityMatrix {
    private static final Logger LOG = LoggerFactory.getLogger(VisibilityMatrix.class);

    private final int[][] counts;
    private final double[][] values;

    private VisibilityMatrix(int[][] counts, double[][] values) {
        this.counts = counts;
        this.values = values;
    }

    public static VisibilityMatrix compute(GridView grid) {
        int sx = grid.sizeX(), sy = grid.sizeY();

        List<int[]> open = new ArrayList<>();
        for (int x = 0; x < sx; x++)
            for (int y = 0; y < sy; y++)
                if (!grid.isWall(x, y)) open.add(new int[]{x, y});

        if (open.isEmpty()) throw new ConfigurationException("The map has no walkable tiles");

        // Tiles are independent; each worker writes only its own slot.
        int[] seen = new int[open.size()];
        IntStream.range(0, open.size()).parallel().forEach(i -> {
            int[] p = open.get(i);
            int n = 0;
            for (int j = 0; j < open.size(); j++) {
                if (j == i) continue;
                int[] q = open.get(j);
                if (LineOfSight.visible(grid, p[0], p[1], q[0], q[1])) n++;
            }
            seen[i] = n;
        });

        int min = Integer.MAX_VALUE, max = Integer.MIN_VALUE;
        for (int n : seen) {
            min = Math.min(min, n);
            max = Math.max(max, n);
        }
        if (max == min) {
            throw new ConfigurationException("Visibility is uniform over the map (every tile sees "
                    + max + " tiles), it cannot be normalized");
        }

        int[][] counts = new int[sx][sy];
        double[][] values = new double[sx][sy];
        double range = max - min;
        for (int i = 0; i < open.size(); i++) {
            int[] p = open.get(i);
            counts[p[0]][p[1]] = seen[i];
            values[p[0]][p[1]] = (seen[i] - min) / range;
        }

        LOG.info("Computed visibility of {} tiles (min {}, max {})", open.size(), min, max);
        return new VisibilityMatrix(counts, values);
    }

    public double value(int x, int y) { return values[x][y]; }

    /** Raw number of visible tiles before normalization. */
    public int count(int x, int y) { return counts[x][y]; }

    public int sizeX() { return values.length; }
    public int sizeY() { return values[0].length; }
}
