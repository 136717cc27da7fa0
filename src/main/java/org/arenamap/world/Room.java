package org.arenamap.world;

import org.arenamap.GeometryException;

import java.util.Objects;

/**
 * Axis-aligned room or corridor rectangle, bounds inclusive.
 */
public final class Room {
    public final int originX, originY, endX, endY;
    public final boolean corridor;

    public Room(int originX, int originY, int endX, int endY, boolean corridor) {
        if (endX < originX || endY < originY) {
            throw new GeometryException("Room end (" + endX + "," + endY
                    + ") lies before origin (" + originX + "," + originY + ")");
        }
        this.originX = originX; this.originY = originY;
        this.endX = endX; this.endY = endY;
        this.corridor = corridor;
    }

    public static Room room(int x, int y, int size) {
        return new Room(x, y, x + size - 1, y + size - 1, false);
    }

    public int sizeX() { return endX - originX + 1; }
    public int sizeY() { return endY - originY + 1; }

    public double centerX() { return originX / 2.0 + endX / 2.0; }
    public double centerY() { return originY / 2.0 + endY / 2.0; }

    public boolean contains(int x, int y) {
        return x >= originX && x <= endX && y >= originY && y <= endY;
    }

    /** True if this rectangle covers other entirely (equal bounds included). */
    public boolean contains(Room other) {
        return originX <= other.originX && originY <= other.originY
                && endX >= other.endX && endY >= other.endY;
    }

    // Overlapping or sharing a border on both axes; any wall tile in between separates.
    public boolean touches(Room other) {
        return !(originX > other.endX + 1 || other.originX > endX + 1)
                && !(originY > other.endY + 1 || other.originY > endY + 1);
    }

    public Room withEnd(int newEndX, int newEndY) {
        return new Room(originX, originY, newEndX, newEndY, corridor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Room)) return false;
        Room r = (Room) o;
        return originX == r.originX && originY == r.originY
                && endX == r.endX && endY == r.endY && corridor == r.corridor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originX, originY, endX, endY, corridor);
    }

    @Override
    public String toString() {
        return (corridor ? "Corridor" : "Room") + "<" + originX + "," + originY + ">"
                + "<" + endX + "," + endY + ">";
    }
}
