package org.arenamap.genome;

import org.arenamap.Arenas;
import org.arenamap.world.Room;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GenomeWriterTest {

    @Test
    void writesTheGenomeItWasParsedFrom() {
        assertEquals(Arenas.FOUR_ROOMS_GENOME, GenomeWriter.write(Arenas.fourRooms()));
    }

    @Test
    void roomSetSurvivesWriteAndParse() {
        List<Room> rooms = List.of(
                new Room(20, 0, 22, 9, true),
                Room.room(0, 0, 5),
                new Room(5, 5, 12, 7, true),
                Room.room(30, 30, 2));

        List<Room> back = GenomeParser.parse(GenomeWriter.write(rooms));

        assertEquals(new HashSet<>(rooms), new HashSet<>(back));
    }

    @Test
    void rejectsNonSquareRooms() {
        assertThrows(IllegalArgumentException.class,
                () -> GenomeWriter.write(List.of(new Room(0, 0, 4, 2, false))));
    }
}
