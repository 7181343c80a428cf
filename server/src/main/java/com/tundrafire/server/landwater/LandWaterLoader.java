package com.tundrafire.server.landwater;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tundrafire.server.collection.GridDocument;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.RasterGrid;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code land_water.json}:
 * {@code {"waterGrid": {...}, "maxExtent": [0, 1, ...], "land": ["POLYGON ((...))", ...]}}.
 */
public class LandWaterLoader {

    private static final Logger logger = LoggerFactory.getLogger(LandWaterLoader.class);

    public static class LandWaterDocument {
        public GridDocument waterGrid;
        public int[] maxExtent;
        public List<String> land;
    }

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public StaticLandWaterReference load(InputStream in) throws IOException {
        LandWaterDocument doc = mapper.readValue(in, LandWaterDocument.class);
        if (doc.waterGrid == null || doc.maxExtent == null || doc.land == null) {
            throw new IllegalArgumentException("land_water document needs waterGrid, maxExtent and land");
        }
        RasterGrid grid = doc.waterGrid.toGrid();
        if (doc.maxExtent.length != grid.pixelCount()) {
            throw new IllegalArgumentException("maxExtent has " + doc.maxExtent.length + " values, grid needs "
                    + grid.pixelCount());
        }
        boolean[] water = new boolean[doc.maxExtent.length];
        for (int i = 0; i < water.length; i++) {
            water[i] = doc.maxExtent[i] != 0;
        }

        WKTReader reader = new WKTReader();
        List<Geometry> polygons = new ArrayList<>();
        for (String wkt : doc.land) {
            try {
                polygons.add(reader.read(wkt));
            } catch (ParseException e) {
                throw new IOException("Invalid land polygon: " + e.getMessage(), e);
            }
        }
        Geometry land = new GeometryFactory().buildGeometry(polygons).union();
        logger.info("Loaded land/water reference: {} land polygons, water grid {}", polygons.size(), grid);
        return new StaticLandWaterReference(new BooleanRaster(grid, water), land);
    }
}
