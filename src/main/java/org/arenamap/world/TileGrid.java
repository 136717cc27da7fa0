package org.arenamap.world;

import org.arenamap.config.AnalyzerConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable character grid of a level. Cells are addressed as {@code [x][y]} where x is the
 * line index and y the column, the same convention the genome uses.
 */
public final class TileGrid implements GridView {
    private final int sizeX, sizeY;
    private final char[][] cells;

    public TileGrid(int sizeX, int sizeY) {
        if (sizeX <= 0 || sizeY <= 0) throw new IllegalArgumentException("empty grid");
        this.sizeX = sizeX; this.sizeY = sizeY;
        cells = new char[sizeX][sizeY];

        for (int x = 0; x < sizeX; x++)
            for (int y = 0; y < sizeY; y++)
                cells[x][y] = AnalyzerConfig.WALL;
    }

    /** Builds a grid from equal-length rows; row i becomes line x = i. */
    public static TileGrid fromLines(List<String> lines) {
        if (lines == null || lines.isEmpty()) throw new IllegalArgumentException("no map rows");
        int width = lines.get(0).length();
        TileGrid grid = new TileGrid(lines.size(), width);
        for (int x = 0; x < lines.size(); x++) {
            String row = lines.get(x);
            if (row.length() != width) {
                throw new IllegalArgumentException("map row " + x + " has length " + row.length()
                        + ", expected " + width);
            }
            for (int y = 0; y < width; y++) grid.cells[x][y] = row.charAt(y);
        }
        return grid;
    }

    public int sizeX() { return sizeX; }
    public int sizeY() { return sizeY; }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < sizeX && y < sizeY;
    }

    public char get(int x, int y) {
        if (!inBounds(x, y)) return AnalyzerConfig.WALL;
        return cells[x][y];
    }

    public void set(int x, int y, char c) {
        if (!inBounds(x, y)) throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside grid");
        cells[x][y] = c;
    }

    public boolean isWall(int x, int y) {
        return get(x, y) == AnalyzerConfig.WALL;
    }

    public boolean isFree(int x, int y) {
        return inBounds(x, y) && cells[x][y] == AnalyzerConfig.FLOOR;
    }

    /** Turns every cell that is neither wall nor floor back into floor; returns how many. */
    public int clearResources() {
        int cleared = 0;
        for (int x = 0; x < sizeX; x++)
            for (int y = 0; y < sizeY; y++) {
                char c = cells[x][y];
                if (c != AnalyzerConfig.WALL && c != AnalyzerConfig.FLOOR) {
                    cells[x][y] = AnalyzerConfig.FLOOR;
                    cleared++;
                }
            }
        return cleared;
    }

    public int count(char symbol) {
        int n = 0;
        for (int x = 0; x < sizeX; x++)
            for (int y = 0; y < sizeY; y++)
                if (cells[x][y] == symbol) n++;
        return n;
    }

    public double diagonal() {
        return Math.sqrt((double) sizeX * sizeX + (double) sizeY * sizeY);
    }

    public TileGrid copy() {
        TileGrid g = new TileGrid(sizeX, sizeY);
        for (int x = 0; x < sizeX; x++) System.arraycopy(cells[x], 0, g.cells[x], 0, sizeY);
        return g;
    }

    public List<String> toLines() {
        List<String> out = new ArrayList<>(sizeX);
        for (int x = 0; x < sizeX; x++) out.add(new String(cells[x]));
        return out;
    }

    /** One row per line, no trailing line break. */
    public String toText() {
        return String.join("\n", toLines());
    }
}
