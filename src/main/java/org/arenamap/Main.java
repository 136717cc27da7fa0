package org.arenamap;

import org.arenamap.genome.RoomReducer;
import org.arenamap.graph.OutlineGraph;
import org.arenamap.graph.RoomGraph;
import org.arenamap.graph.TileGraph;
import org.arenamap.io.MapFiles;
import org.arenamap.placement.PlacementEngine;
import org.arenamap.placement.PlacementResult;
import org.arenamap.world.Room;
import org.arenamap.world.TileGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = "usage:\n"
            + "  populate <inputDir> <outputDir> <MAPNAME>\n"
            + "  graphs <inputDir> <MAPNAME>";

    public static void main(String[] args) {
        System.exit(exitCode(args));
    }

    static int exitCode(String[] args) {
        try {
            return run(args);
        } catch (MapAnalysisException | UncheckedIOException | IllegalArgumentException e) {
            LOG.error("Analysis failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    static int run(String[] args) {
        if (args.length == 4 && "populate".equals(args[0])) {
            populate(Paths.get(args[1]), Paths.get(args[2]), args[3]);
            return 0;
        }
        if (args.length == 3 && "graphs".equals(args[0])) {
            graphs(Paths.get(args[1]), args[2]);
            return 0;
        }
        System.err.println(USAGE);
        return 2;
    }

    static PlacementResult populate(Path inputDir, Path outputDir, String mapName) {
        TileGrid grid = readMap(inputDir, mapName);
        List<Room> rooms = readRooms(inputDir, mapName);

        PlacementResult result = PlacementEngine.withDefaults().populate(grid, rooms);
        try {
            MapFiles.exportMap(result.grid(), MapFiles.mapFile(outputDir, mapName));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot export " + mapName, e);
        }
        return result;
    }

    static MapGraphs graphs(Path inputDir, String mapName) {
        TileGrid grid = readMap(inputDir, mapName);
        List<Room> rooms = readRooms(inputDir, mapName);

        return new MapGraphs(
                TileGraph.reachability(grid),
                RoomGraph.build(rooms),
                RoomGraph.withObjects(rooms, grid),
                TileGraph.visibility(grid),
                OutlineGraph.build(rooms));
    }

    private static TileGrid readMap(Path dir, String mapName) {
        requireFiles(dir, mapName);
        try {
            return MapFiles.readMap(MapFiles.mapFile(dir, mapName));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read map " + mapName, e);
        }
    }

    private static List<Room> readRooms(Path dir, String mapName) {
        try {
            return RoomReducer.reduce(MapFiles.readGenome(MapFiles.genomeFile(dir, mapName)));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read genome " + mapName, e);
        }
    }

    /** The graph views of one map. */
    static final class MapGraphs {
        final TileGraph reachability;
        final RoomGraph rooms;
        final RoomGraph objects;
        final TileGraph visibility;
        final OutlineGraph outlines;

        MapGraphs(TileGraph reachability, RoomGraph rooms, RoomGraph objects, TileGraph visibility,
                  OutlineGraph outlines) {
            this.reachability = reachability;
            this.rooms = rooms;
            this.objects = objects;
            this.visibility = visibility;
            this.outlines = outlines;
        }
    }

    private static void requireFiles(Path dir, String mapName) {
        if (!MapFiles.exists(dir, mapName)) {
            throw new UncheckedIOException(new IOException("Files not found: "
                    + MapFiles.mapFile(dir, mapName) + ", " + MapFiles.genomeFile(dir, mapName)));
        }
    }
}
