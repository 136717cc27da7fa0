package org.arenamap.graph;

public final class ResourceNode implements GraphNode {
    private final String id;
    private final int index;
    private final int tileX, tileY;
    private final char symbol;

    ResourceNode(String id, int index, int tileX, int tileY, char symbol) {
        this.id = id;
        this.index = index;
        this.tileX = tileX;
        this.tileY = tileY;
        this.symbol = symbol;
    }

    public String id() { return id; }
    public int index() { return index; }

    public int tileX() { return tileX; }
    public int tileY() { return tileY; }
    public char symbol() { return symbol; }

    public double x() { return tileX; }
    public double y() { return tileY; }

    public boolean isArea() { return false; }

    @Override
    public String toString() {
        return id + " '" + symbol + "' at (" + tileX + "," + tileY + ")";
    }
}
