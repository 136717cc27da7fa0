package org.arenamap.genome;

import org.arenamap.Arenas;
import org.arenamap.world.Room;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomReducerTest {

    @Test
    void fourCornerRoomsMergeIntoTheSquareTheyTile() {
        List<Room> rooms = GenomeParser.parse("<0,0,2><2,0,2><0,2,2><2,2,2>");

        assertEquals(List.of(new Room(0, 0, 3, 3, false)), RoomReducer.merge(rooms));
    }

    @Test
    void rowOfRoomsMergesAcrossPasses() {
        List<Room> rooms = GenomeParser.parse("<0,0,2><2,0,2><4,0,2>");

        assertEquals(List.of(new Room(0, 0, 5, 1, false)), RoomReducer.merge(rooms));
    }

    @Test
    void mergeIsAFixpoint() {
        List<Room> rooms = GenomeParser.parse("<0,0,2><2,0,2><0,2,2><2,2,2><10,10,3><13,10,3>|<4,0,6>");

        List<Room> once = RoomReducer.merge(rooms);
        assertEquals(once, RoomReducer.merge(once));
    }

    @Test
    void corridorsAreNeverMerged() {
        List<Room> rooms = GenomeParser.parse("<0,0,3>|<3,0,3>");

        assertEquals(rooms, RoomReducer.merge(rooms));
    }

    @Test
    void roomsWithDifferentProfilesStayApart() {
        List<Room> rooms = GenomeParser.parse("<0,0,2><2,0,3>");

        assertEquals(rooms, RoomReducer.merge(rooms));
    }

    @Test
    void containedRoomIsRemoved() {
        Room a = new Room(0, 0, 9, 9, false);
        Room b = new Room(2, 2, 5, 5, false);

        assertEquals(List.of(a), RoomReducer.removeContained(List.of(b, a)));
    }

    @Test
    void identicalRoomsRemoveEachOther() {
        Room a = new Room(0, 0, 3, 3, false);
        Room b = new Room(0, 0, 3, 3, false);

        assertTrue(RoomReducer.removeContained(List.of(a, b)).isEmpty());
    }

    @Test
    void reduceKeepsTheFourRoomArenaIntact() {
        List<Room> rooms = Arenas.fourRooms();

        assertEquals(rooms, RoomReducer.reduce(rooms));
    }

    @Test
    void reduceMergesThenPrunes() {
        // The two halves merge into a 6x3 room that covers the corridor
        List<Room> rooms = GenomeParser.parse("<0,0,3><3,0,3>|<1,0,4>");

        assertEquals(List.of(new Room(0, 0, 5, 2, false)), RoomReducer.reduce(rooms));
    }
}
