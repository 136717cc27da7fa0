package org.arenamap.placement;

import java.util.Objects;

public final class PlacedObject {
    public final int x, y;
    public final char symbol;

    public PlacedObject(int x, int y, char symbol) {
        this.x = x; this.y = y;
        this.symbol = symbol;
    }

    public double distanceTo(int tx, int ty) {
        double dx = x - tx, dy = y - ty;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlacedObject)) return false;
        PlacedObject p = (PlacedObject) o;
        return x == p.x && y == p.y && symbol == p.symbol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, symbol);
    }

    @Override
    public String toString() {
        return "'" + symbol + "' at (" + x + "," + y + ")";
    }
}
