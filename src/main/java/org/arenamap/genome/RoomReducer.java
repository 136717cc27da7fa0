package org.arenamap.genome;

import org.arenamap.GeometryException;
import org.arenamap.config.AnalyzerConfig;
import org.arenamap.world.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces the genome rectangles to a minimal room set: adjacent rooms with the same
 * profile are merged back together, then rooms covered by another room are dropped.
 * Both passes depend on list order (first match wins), so inputs are never reordered.
 */
public final class RoomReducer {
    private static final Logger LOG = LoggerFactory.getLogger(RoomReducer.class);

    private RoomReducer() {}

    public static List<Room> reduce(List<Room> rooms) {
        List<Room> merged = merge(rooms);
        List<Room> pruned = removeContained(merged);
        LOG.info("Refined {} genome rooms into {} rooms", rooms.size(), pruned.size());
        return pruned;
    }

    /** Merge passes until one pass merges nothing. */
    public static List<Room> merge(List<Room> rooms) {
        List<Room> work = new ArrayList<>(rooms);

        for (int pass = 0; pass < AnalyzerConfig.MAX_MERGE_PASSES; pass++) {
            int merges = mergePass(work);
            LOG.debug("Merge pass {} merged {} rooms", pass, merges);
            if (merges == 0) return work;
        }
        throw new GeometryException("Room merge did not settle after "
                + AnalyzerConfig.MAX_MERGE_PASSES + " passes");
    }

    private static int mergePass(List<Room> work) {
        int merges = 0;

        // The cursor is not moved back when an earlier room is absorbed, so the room that
        // slides under it waits for the next pass.
        for (int i = 0; i < work.size(); i++) {
            Room a = work.get(i);
            if (a.corridor) continue;

            int j = firstRightNeighbour(work, a);
            if (j < 0 || work.get(j).corridor) {
                j = firstLowerNeighbour(work, a);
                if (j >= 0 && work.get(j).corridor) j = -1;
            }
            if (j < 0) continue;

            Room b = work.get(j);
            work.set(i, a.withEnd(b.endX, b.endY));
            work.remove(j);
            merges++;
        }
        return merges;
    }

    // Starts strictly after a on x, at most one tile past its end, same y profile.
    private static int firstRightNeighbour(List<Room> work, Room a) {
        for (int j = 0; j < work.size(); j++) {
            Room b = work.get(j);
            if (b.originX > a.originX && b.originX <= a.endX + 1
                    && b.originY == a.originY && b.endY == a.endY) {
                return j;
            }
        }
        return -1;
    }

    private static int firstLowerNeighbour(List<Room> work, Room a) {
        for (int j = 0; j < work.size(); j++) {
            Room b = work.get(j);
            if (b.originY > a.originY && b.originY <= a.endY + 1
                    && b.originX == a.originX && b.endX == a.endX) {
                return j;
            }
        }
        return -1;
    }

    /**
     * Drops every room that another room in the list covers. Two rooms with identical
     * bounds cover each other, so both are dropped.
     */
    public static List<Room> removeContained(List<Room> rooms) {
        boolean[] removed = new boolean[rooms.size()];

        for (int i = 0; i < rooms.size(); i++) {
            for (int j = 0; j < rooms.size(); j++) {
                if (i != j && rooms.get(i).contains(rooms.get(j))) removed[j] = true;
            }
        }

        List<Room> out = new ArrayList<>();
        for (int i = 0; i < rooms.size(); i++) {
            if (!removed[i]) out.add(rooms.get(i));
        }
        return out;
    }
}
