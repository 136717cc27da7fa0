package org.arenamap.graph;

import org.arenamap.world.Room;

public final class AreaNode implements GraphNode {
    private final String id;
    private final int index;
    private final Room room;

    AreaNode(String id, int index, Room room) {
        this.id = id;
        this.index = index;
        this.room = room;
    }

    public String id() { return id; }
    public int index() { return index; }
    public Room room() { return room; }

    public double x() { return room.centerX(); }
    public double y() { return room.centerY(); }

    public boolean isArea() { return true; }
    public boolean isCorridor() { return room.corridor; }

    @Override
    public String toString() {
        return id + " " + room;
    }
}
