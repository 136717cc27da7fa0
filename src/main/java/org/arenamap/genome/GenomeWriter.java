package org.arenamap.genome;

import org.arenamap.config.AnalyzerConfig;
import org.arenamap.world.Room;

import java.util.List;

/** Encodes rooms back into AB genome form. */
public final class GenomeWriter {
    private GenomeWriter() {}

    public static String write(List<Room> rooms) {
        StringBuilder plain = new StringBuilder();
        StringBuilder corridors = new StringBuilder();

        for (Room r : rooms) {
            if (r.corridor) {
                corridors.append('<').append(r.originX).append(',').append(r.originY).append(',')
                        .append(corridorLength(r)).append('>');
            } else {
                if (r.sizeX() != r.sizeY()) {
                    throw new IllegalArgumentException("Only square rooms have a genome form: " + r);
                }
                plain.append('<').append(r.originX).append(',').append(r.originY).append(',')
                        .append(r.sizeX()).append('>');
            }
        }

        if (corridors.length() == 0) return plain.toString();
        return plain.append('|').append(corridors).toString();
    }

    private static int corridorLength(Room r) {
        int w = AnalyzerConfig.CORRIDOR_WIDTH;
        // Horizontal wins for a 3x3 corridor, which parses back identically either way
        if (r.sizeY() == w) return r.sizeX();
        if (r.sizeX() == w) return -r.sizeY();
        throw new IllegalArgumentException("Corridor is not " + w + " tiles wide: " + r);
    }
}
