package com.tundrafire.server.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes each export as {@code <folder>/<name>.geojson}.
 */
public class GeoJsonExportSink implements ExportSink {

    private static final Logger logger = LoggerFactory.getLogger(GeoJsonExportSink.class);

    private final Path folder;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeoJsonExportSink(Path folder) {
        this.folder = folder;
    }

    public Path getFolder() {
        return folder;
    }

    @Override
    public ExportOutcome export(int year, String name, List<VectorFeature> features) throws IOException {
        Files.createDirectories(folder);
        Path target = folder.resolve(name + ".geojson");

        ObjectNode root = mapper.createObjectNode();
        root.put("type", "FeatureCollection");
        root.put("name", name);
        ArrayNode featureArray = root.putArray("features");
        int pixels = 0;
        for (VectorFeature feature : features) {
            ObjectNode node = featureArray.addObject();
            node.put("type", "Feature");
            node.set("geometry", geometry(feature.getGeometry()));
            ObjectNode props = node.putObject("properties");
            for (Map.Entry<String, Object> e : feature.getProperties().entrySet()) {
                props.putPOJO(e.getKey(), e.getValue());
            }
            pixels += feature.getCount();
        }
        mapper.writeValue(target.toFile(), root);
        logger.info("Exported {} features to {}", features.size(), target);
        return new ExportOutcome(name, features.size(), pixels, target.toString());
    }

    ObjectNode geometry(Geometry geometry) {
        ObjectNode node = mapper.createObjectNode();
        if (geometry instanceof Polygon) {
            node.put("type", "Polygon");
            node.set("coordinates", rings((Polygon) geometry));
        } else {
            node.put("type", "MultiPolygon");
            ArrayNode polygons = node.putArray("coordinates");
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                Geometry part = geometry.getGeometryN(i);
                if (!(part instanceof Polygon)) {
                    throw new IllegalArgumentException("Unsupported geometry part " + part.getGeometryType());
                }
                polygons.add(rings((Polygon) part));
            }
        }
        return node;
    }

    private ArrayNode rings(Polygon polygon) {
        ArrayNode rings = mapper.createArrayNode();
        rings.add(ring(polygon.getExteriorRing()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(ring(polygon.getInteriorRingN(i)));
        }
        return rings;
    }

    private ArrayNode ring(LineString ring) {
        ArrayNode coords = mapper.createArrayNode();
        for (Coordinate c : ring.getCoordinates()) {
            coords.addArray().add(c.x).add(c.y);
        }
        return coords;
    }
}
