package com.tundrafire.server.vector;

import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.RasterGrid;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TiledExporterTest {

    /** Keeps exports in memory. */
    static class MemorySink implements ExportSink {
        final List<String> names = Collections.synchronizedList(new ArrayList<>());

        @Override
        public ExportOutcome export(int year, String name, List<VectorFeature> features) {
            names.add(name);
            int pixels = 0;
            for (VectorFeature f : features) {
                pixels += f.getCount();
            }
            return new ExportOutcome(name, features.size(), pixels, "memory:" + name);
        }
    }

    // 4 x 2 pixels of 60 m: the west half holds one pixel, the east half two separate pixels
    private static final RasterGrid GRID = new RasterGrid(0, 120, 60, 4, 2);

    private static BooleanRaster mask() {
        boolean[] v = new boolean[GRID.pixelCount()];
        v[GRID.index(0, 0)] = true;
        v[GRID.index(2, 0)] = true;
        v[GRID.index(3, 1)] = true;
        return new BooleanRaster(GRID, v);
    }

    @Test
    void testEachTileExportsOnlyItsOwnPixels() throws IOException {
        MemorySink sink = new MemorySink();
        TiledExporter exporter = new TiledExporter(new PolygonVectorizer(60, false, 0), sink);
        List<Tile> tiles = TileGrid.cover(new GeometryFactory().toGeometry(new Envelope(0, 240, 0, 120)), 120);

        List<ExportOutcome> outcomes = new ArrayList<>();
        for (Tile tile : tiles) {
            outcomes.add(exporter.exportTile(2019, mask(), tile));
        }

        assertEquals(2, outcomes.size());
        assertEquals("candidateFires__2019__ROIsub_00_0px60m", outcomes.get(0).getName());
        assertEquals("candidateFires__2019__ROIsub_01_0px60m", outcomes.get(1).getName());
        assertEquals(1, outcomes.get(0).getFeatureCount());
        assertEquals(2, outcomes.get(1).getFeatureCount());
        assertEquals(2, new HashSet<>(sink.names).size());
    }

    @Test
    void testPixelsOnSharedTileEdgesExportedOnce() throws IOException {
        // 30 m pixels with centres at x = 15, 45, 75, 105 and y = 15, 45; 45 m tiles put edges through centres
        RasterGrid fine = new RasterGrid(0, 60, 30, 4, 2);
        boolean[] all = new boolean[fine.pixelCount()];
        Arrays.fill(all, true);
        BooleanRaster mask = new BooleanRaster(fine, all);
        TiledExporter exporter = new TiledExporter(new PolygonVectorizer(30, true, 0), new MemorySink());

        List<Tile> tiles = TileGrid.cover(fine.footprint(), 45);
        int pixels = 0;
        for (Tile tile : tiles) {
            pixels += exporter.exportTile(2019, mask, tile).getPixelCount();
        }
        assertEquals(6, tiles.size());
        assertEquals(fine.pixelCount(), pixels);
    }

    @Test
    void testTileOutsideMaskIsEmpty() throws IOException {
        TiledExporter exporter = new TiledExporter(new PolygonVectorizer(60, true, 0), new MemorySink());
        Tile far = TileGrid.cover(new GeometryFactory().toGeometry(new Envelope(1000, 1100, 1000, 1100)), 120)
                .get(0);
        ExportOutcome outcome = exporter.exportTile(2019, mask(), far);
        assertEquals(0, outcome.getFeatureCount());
    }

    @Test
    void testSingleRegionExport() throws IOException {
        MemorySink sink = new MemorySink();
        TiledExporter exporter = new TiledExporter(new PolygonVectorizer(60, true, 0), sink);
        ExportOutcome outcome = exporter.exportRegion(2019, mask(), GRID.footprint(), ExportNaming.DRAWN_ROI_ID);
        assertEquals("candidateFires__2019__drawROI_0px60m", outcome.getName());
        // (2,0) and (3,1) touch diagonally
        assertEquals(2, outcome.getFeatureCount());
        assertEquals(3, outcome.getPixelCount());
    }

    @Test
    void testSinkFailureSurfaces() {
        ExportSink failing = (year, name, features) -> {
            throw new IOException("disk full");
        };
        TiledExporter exporter = new TiledExporter(new PolygonVectorizer(60, true, 0), failing);
        Tile tile = TileGrid.cover(GRID.footprint(), 120).get(0);
        IOException e = assertThrows(IOException.class, () -> exporter.exportTile(2019, mask(), tile));
        assertEquals("disk full", e.getMessage());
    }
}
