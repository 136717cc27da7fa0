package org.arenamap.io;

import org.arenamap.config.AnalyzerConfig;
import org.arenamap.genome.GenomeParser;
import org.arenamap.world.Room;
import org.arenamap.world.TileGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code <MAPNAME>_map.txt} / {@code <MAPNAME>_AB.txt} pairs and writes populated maps.
 */
public final class MapFiles {
    private static final Logger LOG = LoggerFactory.getLogger(MapFiles.class);

    private MapFiles() {}

    public static Path mapFile(Path dir, String mapName) {
        return dir.resolve(mapName + AnalyzerConfig.MAP_SUFFIX);
    }

    public static Path genomeFile(Path dir, String mapName) {
        return dir.resolve(mapName + AnalyzerConfig.GENOME_SUFFIX);
    }

    public static boolean exists(Path dir, String mapName) {
        return Files.isRegularFile(mapFile(dir, mapName)) && Files.isRegularFile(genomeFile(dir, mapName));
    }

    public static TileGrid readMap(Path file) throws IOException {
        LOG.info("Reading the map file {}", file);
        List<String> rows = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String row = line.strip();
            if (!row.isEmpty()) rows.add(row);
        }
        return TileGrid.fromLines(rows);
    }

    /** Parses the first line of the AB file. */
    public static List<Room> readGenome(Path file) throws IOException {
        LOG.info("Reading the AB file {}", file);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        return GenomeParser.parse(lines.isEmpty() ? "" : lines.get(0));
    }

    public static void exportMap(TileGrid grid, Path file) throws IOException {
        LOG.info("Exporting the map to {}", file);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, grid.toText(), StandardCharsets.UTF_8);
    }
}
