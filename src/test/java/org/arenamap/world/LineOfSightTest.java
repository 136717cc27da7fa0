package org.arenamap.world;

import org.arenamap.Arenas;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineOfSightTest {

    @Test
    void pillarBlocksStraightLines() {
        TileGrid g = Arenas.pillarGrid();

        assertFalse(LineOfSight.visible(g, 3, 1, 3, 5));
        assertFalse(LineOfSight.visible(g, 1, 3, 5, 3));
        assertFalse(LineOfSight.visible(g, 1, 1, 5, 5));
    }

    @Test
    void openLinesAreVisible() {
        TileGrid g = Arenas.pillarGrid();

        assertTrue(LineOfSight.visible(g, 1, 1, 1, 5));
        assertTrue(LineOfSight.visible(g, 1, 1, 5, 4));
        assertTrue(LineOfSight.visible(g, 2, 2, 2, 3));
    }

    @Test
    void wallsBetweenRoomsBlock() {
        TileGrid g = Arenas.fourRoomsGrid();

        // Corner room to the opposite corner room, through solid rock
        assertFalse(LineOfSight.visible(g, 1, 1, 17, 17));
        // Down the corridor from one room into the next
        assertTrue(LineOfSight.visible(g, 3, 3, 15, 3));
    }

    @Test
    void visibilityIsSymmetric() {
        TileGrid g = Arenas.fourRoomsGrid();
        List<int[]> open = new ArrayList<>();
        for (int x = 0; x < g.sizeX(); x++)
            for (int y = 0; y < g.sizeY(); y++)
                if (!g.isWall(x, y)) open.add(new int[]{x, y});

        for (int[] p : open) {
            for (int[] q : open) {
                assertEquals(LineOfSight.visible(g, p[0], p[1], q[0], q[1]),
                        LineOfSight.visible(g, q[0], q[1], p[0], p[1]),
                        "(" + p[0] + "," + p[1] + ") <-> (" + q[0] + "," + q[1] + ")");
            }
        }
    }
}
