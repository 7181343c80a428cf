package com.tundrafire.server.collection;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tundrafire.server.harmonize.RawScene;
import com.tundrafire.server.harmonize.Sensor;
import com.tundrafire.server.raster.DateWindow;
import com.tundrafire.server.raster.RasterGrid;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Archive backed by a directory holding one JSON document per scene:
 * {@code {"sensor": "LANDSAT_8", "acquired": "2019-07-04", "grid": {...}, "bands": {"SR_B2": [...], ...}}}.
 */
public class JsonSceneArchive implements RasterArchive {

    private static final Logger logger = LoggerFactory.getLogger(JsonSceneArchive.class);

    public static class SceneHeader {
        public Sensor sensor;
        public String acquired;
        public GridDocument grid;
    }

    public static class SceneDocument extends SceneHeader {
        public Map<String, int[]> bands;
    }

    private static class IndexedScene {
        final Path path;
        final Sensor sensor;
        final LocalDate acquired;
        final RasterGrid grid;

        IndexedScene(Path path, Sensor sensor, LocalDate acquired, RasterGrid grid) {
            this.path = path;
            this.sensor = sensor;
            this.acquired = acquired;
            this.grid = grid;
        }
    }

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final List<IndexedScene> index = new ArrayList<>();

    public JsonSceneArchive(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Scene directory not found: " + directory);
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                SceneHeader header = mapper.readValue(file.toFile(), SceneHeader.class);
                if (header.sensor == null || header.acquired == null || header.grid == null) {
                    logger.warn("Skipping incomplete scene document {}", file);
                    continue;
                }
                index.add(new IndexedScene(file, header.sensor, LocalDate.parse(header.acquired),
                        header.grid.toGrid()));
            }
        }
        logger.info("Indexed {} scenes in {}", index.size(), directory);
    }

    @Override
    public List<RawScene> scenes(Sensor sensor, Geometry roi, DateWindow window) throws IOException {
        List<RawScene> result = new ArrayList<>();
        for (IndexedScene s : index) {
            if (s.sensor != sensor || !window.contains(s.acquired) || !s.grid.footprint().intersects(roi)) {
                continue;
            }
            SceneDocument doc = mapper.readValue(s.path.toFile(), SceneDocument.class);
            result.add(new RawScene(sensor, s.acquired, s.grid, doc.bands));
        }
        logger.debug("{} scenes of {} in {}", result.size(), sensor, window);
        return result;
    }

    public int size() {
        return index.size();
    }
}
