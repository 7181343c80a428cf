package com.tundrafire.server.vector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeoJsonExportSinkTest {

    private final GeometryFactory gf = new GeometryFactory();

    @Test
    void testWritesFeatureCollection(@TempDir Path dir) throws Exception {
        Path folder = dir.resolve("tundraFire_exports");
        GeoJsonExportSink sink = new GeoJsonExportSink(folder);
        Geometry square = gf.toGeometry(new Envelope(0, 60, 0, 60));
        Geometry pair = gf.toGeometry(new Envelope(0, 60, 0, 60))
                .union(gf.toGeometry(new Envelope(60, 120, 60, 120)));

        ExportOutcome outcome = sink.export(2019, "candidateFires__2019__drawROI_0px60m",
                List.of(new VectorFeature(square, 1), new VectorFeature(pair, 2)));

        Path file = folder.resolve("candidateFires__2019__drawROI_0px60m.geojson");
        assertTrue(Files.exists(file));
        assertEquals(2, outcome.getFeatureCount());
        assertEquals(3, outcome.getPixelCount());
        assertEquals(file.toString(), outcome.getLocation());

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals("FeatureCollection", root.get("type").asText());
        JsonNode features = root.get("features");
        assertEquals(2, features.size());
        assertEquals("Polygon", features.get(0).get("geometry").get("type").asText());
        assertEquals(5, features.get(0).get("geometry").get("coordinates").get(0).size());
        assertEquals(1, features.get(0).get("properties").get("label").asInt());
        assertEquals(1, features.get(0).get("properties").get("count").asInt());
        assertEquals("MultiPolygon", features.get(1).get("geometry").get("type").asText());
        assertEquals(2, features.get(1).get("geometry").get("coordinates").size());
    }

    @Test
    void testEmptyExportStillWritesFile(@TempDir Path dir) throws Exception {
        GeoJsonExportSink sink = new GeoJsonExportSink(dir);
        ExportOutcome outcome = sink.export(2019, "empty", List.of());
        assertEquals(0, outcome.getFeatureCount());
        JsonNode root = new ObjectMapper().readTree(dir.resolve("empty.geojson").toFile());
        assertEquals(0, root.get("features").size());
    }
}
