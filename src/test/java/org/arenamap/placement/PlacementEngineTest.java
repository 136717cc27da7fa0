package org.arenamap.placement;

import org.arenamap.Arenas;
import org.arenamap.ConfigurationException;
import org.arenamap.world.Room;
import org.arenamap.world.TileGrid;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementEngineTest {

    private static PlacementResult populateFourRooms() {
        TileGrid grid = Arenas.fourRoomsGrid();
        return PlacementEngine.withDefaults().populate(grid, Arenas.fourRooms());
    }

    @Test
    void placesEveryRequestedUnit() {
        PlacementResult result = populateFourRooms();
        TileGrid grid = result.grid();

        assertEquals(5, grid.count('s'));
        assertEquals(4, grid.count('h'));
        assertEquals(4, grid.count('a'));
        assertEquals(13, result.placed().size());
        assertEquals(5, result.count('s'));
    }

    @Test
    void noTwoObjectsShareATile() {
        List<PlacedObject> placed = populateFourRooms().placed();

        Set<Integer> tiles = new HashSet<>();
        for (PlacedObject p : placed) {
            assertTrue(tiles.add(p.x * Arenas.FOUR_ROOMS_SIZE + p.y), "duplicate tile " + p);
        }
    }

    @Test
    void placementIsDeterministic() {
        PlacementResult a = populateFourRooms();
        PlacementResult b = populateFourRooms();

        assertEquals(a.grid().toText(), b.grid().toText());
        assertEquals(a.placed(), b.placed());
    }

    @Test
    void placementOrderIsSpawnThenMedkitThenAmmo() {
        List<PlacedObject> placed = populateFourRooms().placed();

        StringBuilder order = new StringBuilder();
        for (PlacedObject p : placed) order.append(p.symbol);
        assertEquals("ssssshhhhaaaa", order.toString());
    }

    @Test
    void secondSpawnGoesToTheFarRoom() {
        List<Room> rooms = Arenas.fourRooms();
        List<PlacedObject> placed = populateFourRooms().placed();

        PlacedObject first = placed.get(0);
        PlacedObject second = placed.get(1);
        assertTrue(rooms.get(0).contains(first.x, first.y));
        assertFalse(rooms.get(0).contains(second.x, second.y));
        assertTrue(rooms.get(3).contains(second.x, second.y));
    }

    @Test
    void resourcesJoinTheRoomGraph() {
        PlacementResult result = populateFourRooms();

        assertEquals(8 + 13, result.graph().nodeCount());
        assertEquals(13, result.graph().resources().size());
        result.graph().resources().forEach(r -> assertTrue(result.graph().degree(r.index()) >= 1));
    }

    @Test
    void preExistingObjectsAreCleared() {
        TileGrid grid = Arenas.fourRoomsGrid();
        grid.set(2, 2, 'x');
        grid.set(14, 14, 'h');

        PlacementResult result = new PlacementEngine(ResourceSpec.of('s', 1), ResourceSpec.of('h', 1),
                ResourceSpec.of('a', 0)).populate(grid, Arenas.fourRooms());

        assertEquals(0, result.grid().count('x'));
        assertEquals(1, result.grid().count('h'));
        assertEquals(2, result.placed().size());
    }

    @Test
    void failsWhenTheMapRunsOutOfFreeTiles() {
        TileGrid grid = Arenas.pillarGrid();
        PlacementEngine engine = new PlacementEngine(ResourceSpec.of('s', 25), ResourceSpec.of('h', 0),
                ResourceSpec.of('a', 0));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> engine.populate(grid, Arenas.pillarRoom()));

        assertEquals("spawn points", e.resource());
        assertEquals(24, e.iteration());
        // Committed placements stay on the grid
        assertEquals(24, grid.count('s'));
    }

    @Test
    void ammoLeavesTheLastRowAndColumnOut() {
        // The bottom line of the room looks down the corridor and sees the most
        List<Room> rooms = List.of(new Room(1, 1, 3, 3, false), new Room(3, 4, 3, 10, true));
        TileGrid grid = Arenas.carve(5, 12, rooms);

        List<PlacedObject> placed = new PlacementEngine(ResourceSpec.of('s', 0), ResourceSpec.of('h', 0),
                ResourceSpec.of('a', 1)).populate(grid, rooms).placed();

        assertEquals(List.of(new PlacedObject(2, 2, 'a')), placed);
    }

    @Test
    void itemsNeedARoomWiderThanOneTile() {
        List<Room> rooms = List.of(new Room(1, 1, 1, 5, false));
        TileGrid grid = Arenas.carve(3, 7, rooms);
        grid.set(1, 2, 'w');

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new PlacementEngine(
                ResourceSpec.of('s', 1), ResourceSpec.of('h', 1), ResourceSpec.of('a', 0)).populate(grid, rooms));

        assertEquals("medkits", e.resource());
        assertEquals(0, e.iteration());
        assertEquals(1, grid.count('s'));
    }

    @Test
    void symbolsMustDiffer() {
        assertThrows(IllegalArgumentException.class, () -> new PlacementEngine(
                ResourceSpec.of('s', 1), ResourceSpec.of('s', 1), ResourceSpec.of('a', 1)));
    }

    @Test
    void wallDistanceIsRelativeToHalfTheRoom() {
        Room r = new Room(0, 0, 4, 4, false);

        assertEquals(1.0, PlacementEngine.wallDistance(r, 2, 2), 1e-9);
        assertEquals(0.0, PlacementEngine.wallDistance(r, 0, 0), 1e-9);
        assertEquals(0.5, PlacementEngine.wallDistance(r, 1, 1), 1e-9);
        assertEquals(0.0, PlacementEngine.wallDistance(new Room(3, 3, 3, 3, false), 3, 3), 1e-9);
    }
}
