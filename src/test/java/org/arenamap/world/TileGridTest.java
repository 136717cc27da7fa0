package org.arenamap.world;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TileGridTest {

    @Test
    void linesAreIndexedByX() {
        TileGrid g = TileGrid.fromLines(List.of("wwww", "wrsw", "wwww"));

        assertEquals(3, g.sizeX());
        assertEquals(4, g.sizeY());
        assertEquals('s', g.get(1, 2));
        assertTrue(g.isFree(1, 1));
        assertFalse(g.isFree(1, 2));
        assertEquals(Tile.RESOURCE, g.tile(1, 2));
    }

    @Test
    void outsideTheGridIsWall() {
        TileGrid g = TileGrid.fromLines(List.of("rr", "rr"));

        assertTrue(g.isWall(-1, 0));
        assertTrue(g.isWall(0, 2));
        assertFalse(g.isFree(2, 0));
    }

    @Test
    void rejectsRaggedRows() {
        assertThrows(IllegalArgumentException.class, () -> TileGrid.fromLines(List.of("www", "ww")));
    }

    @Test
    void clearResourcesLeavesOnlyWallsAndFloor() {
        TileGrid g = TileGrid.fromLines(List.of("wsw", "hra", "wdw"));

        assertEquals(4, g.clearResources());
        assertEquals(5, g.count('r'));
        assertEquals(4, g.count('w'));
    }

    @Test
    void textHasNoTrailingLineBreak() {
        TileGrid g = TileGrid.fromLines(List.of("wrw", "rrr"));

        assertEquals("wrw\nrrr", g.toText());
    }

    @Test
    void copyIsIndependent() {
        TileGrid g = TileGrid.fromLines(List.of("rr"));
        TileGrid c = g.copy();
        c.set(0, 0, 's');

        assertEquals('r', g.get(0, 0));
    }
}
