package org.arenamap.graph;

public final class TileNode {
    public final int index;
    public final int x, y;
    public final char symbol;

    TileNode(int index, int x, int y, char symbol) {
        this.index = index;
        this.x = x; this.y = y;
        this.symbol = symbol;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")'" + symbol + "'";
    }
}
