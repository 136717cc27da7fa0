package org.arenamap.world;

/**
 * Read-only view of a tile grid. {@code x} is the line of the map file, {@code y} the
 * column within that line.
 */
public interface GridView {
    int sizeX();
    int sizeY();

    boolean inBounds(int x, int y);
    boolean isWall(int x, int y);
    boolean isFree(int x, int y);

    char get(int x, int y);

    default Tile tile(int x, int y) {
        return Tile.of(get(x, y));
    }
}
