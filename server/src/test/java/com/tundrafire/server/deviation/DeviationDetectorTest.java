package com.tundrafire.server.deviation;

import com.tundrafire.server.SceneFixtures;
import com.tundrafire.server.composite.SeasonWindow;
import com.tundrafire.server.composite.TemporalCompositor;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviationDetectorTest {

    private static final RasterGrid GRID = SceneFixtures.grid(2, 1);
    private static final int YEAR = 2019;

    private DeviationDetector detector;
    private BooleanRaster land;

    @BeforeEach
    void setUp() {
        TemporalCompositor compositor = new TemporalCompositor(GRID, BooleanRaster.filled(GRID, true));
        detector = new DeviationDetector(compositor, SeasonWindow.SNOW_FREE);
        land = new BooleanRaster(GRID, new boolean[] { true, false });
    }

    private static Raster<IndexBand> obs(int year, float nbr, float nbr2) {
        return SceneFixtures.indexRaster(GRID, LocalDate.of(year, 7, 1),
                SceneFixtures.bands(IndexBand.NBR, nbr, IndexBand.NBR2, nbr2), 0.2f);
    }

    private static ObservationSet<IndexBand> set(List<Raster<IndexBand>> rasters) {
        return ObservationSet.of(IndexBand.class, IndexBand.ALL, rasters);
    }

    private static List<Raster<IndexBand>> history() {
        List<Raster<IndexBand>> list = new ArrayList<>();
        list.add(obs(YEAR - 3, 0.5f, 0.4f));
        list.add(obs(YEAR - 2, 0.6f, 0.5f));
        list.add(obs(YEAR - 1, 0.4f, 0.3f));
        // outside the baseline years
        list.add(obs(YEAR - 4, -1f, -1f));
        return list;
    }

    @Test
    void testMinimumOverFireYearAndNextYear() {
        List<Raster<IndexBand>> rasters = history();
        rasters.add(obs(YEAR, -0.2f, 0.1f));
        rasters.add(obs(YEAR + 1, 0.3f, 0.3f));

        DeviationResult result = detector.detect(set(rasters), YEAR, land);

        assertEquals(0.4f, result.getBaseline().value(IndexBand.NBR2, 0), 1e-6);
        assertEquals(0.25f, result.getRatio().value(IndexBand.NBR2, 0), 1e-6);
        assertEquals(-0.3f, result.getDifference().value(IndexBand.NBR2, 0), 1e-6);
        assertEquals(-0.2f, result.getMinimum().value(IndexBand.NBR, 0), 1e-6);
        assertEquals(IndexBand.INDICES, result.getRatio().bandSet());
    }

    @Test
    void testOutputsMaskedOutsideLand() {
        List<Raster<IndexBand>> rasters = history();
        rasters.add(obs(YEAR, -0.2f, 0.1f));

        DeviationResult result = detector.detect(set(rasters), YEAR, land);

        assertTrue(Float.isNaN(result.getRatio().value(IndexBand.NBR2, 1)));
        assertTrue(Float.isNaN(result.getDifference().value(IndexBand.NBR2, 1)));
        assertTrue(Float.isNaN(result.getMinimum().value(IndexBand.NBR, 1)));
    }

    @Test
    void testMissingNextYearFallsBackToFireYear() {
        List<Raster<IndexBand>> rasters = history();
        rasters.add(obs(YEAR, 0.1f, 0.2f));

        DeviationResult result = detector.detect(set(rasters), YEAR, land);

        assertEquals(0.5f, result.getRatio().value(IndexBand.NBR2, 0), 1e-6);
        assertEquals(0.1f, result.getMinimum().value(IndexBand.NBR, 0), 1e-6);
    }

    @Test
    void testNoObservationsYieldNoData() {
        DeviationResult result = detector.detect(set(history()), YEAR, land);
        assertTrue(Float.isNaN(result.getRatio().value(IndexBand.NBR2, 0)));
        assertTrue(Float.isNaN(result.getMinimum().value(IndexBand.NBR, 0)));
    }

    @Test
    void testZeroBaselineRatioIsNoData() {
        List<Raster<IndexBand>> rasters = new ArrayList<>();
        rasters.add(obs(YEAR - 1, 0.4f, 0f));
        rasters.add(obs(YEAR, 0.1f, 0.1f));

        DeviationResult result = detector.detect(set(rasters), YEAR, land);

        assertTrue(Float.isNaN(result.getRatio().value(IndexBand.NBR2, 0)));
        assertEquals(0.1f, result.getDifference().value(IndexBand.NBR2, 0), 1e-6);
    }
}
