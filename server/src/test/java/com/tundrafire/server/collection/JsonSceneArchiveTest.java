package com.tundrafire.server.collection;

import com.tundrafire.server.harmonize.RawScene;
import com.tundrafire.server.harmonize.Sensor;
import com.tundrafire.server.raster.DateWindow;
import com.tundrafire.server.raster.RasterGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonSceneArchiveTest {

    private static final String SCENE = "{\"sensor\":\"LANDSAT_8\",\"acquired\":\"2019-07-04\","
            + "\"grid\":{\"originX\":0,\"originY\":30,\"pixelSize\":30,\"width\":2,\"height\":1},"
            + "\"bands\":{\"SR_B2\":[8000,8100],\"QA_PIXEL\":[0,8]}}";

    @Test
    void testQueriesBySensorDateAndFootprint(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("lc08_20190704.json"), SCENE.getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("notes.txt"), "ignored".getBytes(StandardCharsets.UTF_8));

        JsonSceneArchive archive = new JsonSceneArchive(dir);
        assertEquals(1, archive.size());

        RasterGrid grid = new RasterGrid(0, 30, 30, 2, 1);
        DateWindow july = new DateWindow(LocalDate.of(2019, 7, 1), LocalDate.of(2019, 8, 1));
        List<RawScene> found = archive.scenes(Sensor.LANDSAT_8, grid.footprint(), july);
        assertEquals(1, found.size());
        assertEquals(LocalDate.of(2019, 7, 4), found.get(0).getAcquired());
        assertArrayEquals(new int[] { 0, 8 }, found.get(0).getBands().get("QA_PIXEL"));

        assertTrue(archive.scenes(Sensor.LANDSAT_9, grid.footprint(), july).isEmpty());
        DateWindow june = new DateWindow(LocalDate.of(2019, 6, 1), LocalDate.of(2019, 7, 1));
        assertTrue(archive.scenes(Sensor.LANDSAT_8, grid.footprint(), june).isEmpty());
    }

    @Test
    void testMissingDirectoryRejected(@TempDir Path dir) {
        assertThrows(java.io.IOException.class, () -> new JsonSceneArchive(dir.resolve("absent")));
    }
}
