package org.arenamap.graph;

import org.arenamap.genome.GenomeParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OutlineGraphTest {

    @Test
    void everyRoomIsAClosedQuad() {
        OutlineGraph g = OutlineGraph.build(GenomeParser.parse("<0,0,4>|<3,1,6>"));

        assertEquals(8, g.nodeCount());
        assertEquals(8, g.edgeCount());
        assertArrayEquals(new int[]{3, 3}, g.corner(2));
        assertArrayEquals(new int[]{8, 3}, g.corner(6));
        assertArrayEquals(new int[]{7, 4}, g.edges().get(7));
    }
}
