package com.tundrafire.server.composite;

import com.tundrafire.server.SceneFixtures;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import com.tundrafire.server.raster.Reducer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemporalCompositorTest {

    private static final RasterGrid GRID = SceneFixtures.grid(2, 1);

    private static Raster<IndexBand> obs(LocalDate date, float nbr) {
        return SceneFixtures.indexRaster(GRID, date, SceneFixtures.bands(IndexBand.NBR, nbr), 0.1f);
    }

    private static ObservationSet<IndexBand> set(List<Raster<IndexBand>> rasters) {
        return ObservationSet.of(IndexBand.class, IndexBand.ALL, rasters);
    }

    @Test
    void testEmptyWindowYieldsFullNoDataRaster() {
        TemporalCompositor compositor = new TemporalCompositor(GRID, BooleanRaster.filled(GRID, true));
        ObservationSet<IndexBand> observations = set(List.of(obs(LocalDate.of(2018, 7, 1), 0.5f)));

        Raster<IndexBand> composite = compositor.composite(observations, IndexBand.INDICES,
                SeasonWindow.SNOW_FREE.forYear(2020), Reducer.MEDIAN);

        assertEquals(IndexBand.INDICES, composite.bandSet());
        for (IndexBand band : IndexBand.INDICES) {
            for (int i = 0; i < GRID.pixelCount(); i++) {
                assertTrue(Float.isNaN(composite.value(band, i)));
            }
        }
    }

    @Test
    void testMedianWithinSeasonOnly() {
        TemporalCompositor compositor = new TemporalCompositor(GRID, BooleanRaster.filled(GRID, true));
        ObservationSet<IndexBand> observations = set(List.of(
                obs(LocalDate.of(2019, 6, 20), 0.2f),
                obs(LocalDate.of(2019, 7, 20), 0.6f),
                obs(LocalDate.of(2019, 8, 20), 0.4f),
                // outside the snow-free season
                obs(LocalDate.of(2019, 5, 1), -0.9f),
                obs(LocalDate.of(2019, 9, 1), -0.9f)));

        Raster<IndexBand> composite = compositor.composite(observations, IndexBand.INDICES,
                SeasonWindow.SNOW_FREE.forYear(2019), Reducer.MEDIAN);

        assertEquals(0.4f, composite.value(IndexBand.NBR, 0), 1e-6);
        assertEquals(0.1f, composite.value(IndexBand.NDVI, 1), 1e-6);
        assertNull(composite.getAcquired());
    }

    @Test
    void testCompositeClippedToRoi() {
        BooleanRaster roi = new BooleanRaster(GRID, new boolean[] { true, false });
        TemporalCompositor compositor = new TemporalCompositor(GRID, roi);
        Raster<IndexBand> composite = compositor.composite(set(List.of(obs(LocalDate.of(2019, 7, 1), 0.3f))),
                IndexBand.INDICES, Reducer.MIN);
        assertEquals(0.3f, composite.value(IndexBand.NBR, 0), 1e-6);
        assertTrue(Float.isNaN(composite.value(IndexBand.NBR, 1)));
    }

    @Test
    void testFireCompositesUseAdjacentYears() {
        TemporalCompositor compositor = new TemporalCompositor(GRID, BooleanRaster.filled(GRID, true));
        ObservationSet<IndexBand> observations = set(List.of(
                obs(LocalDate.of(2018, 7, 1), 0.6f),
                obs(LocalDate.of(2019, 7, 1), 0.0f),
                obs(LocalDate.of(2020, 7, 1), -0.1f)));

        FireComposites composites = FireComposites.forYear(2019, observations, SeasonWindow.SNOW_FREE, compositor);

        assertEquals(0.6f, composites.value(FirePeriod.PRE, IndexBand.NBR, 0), 1e-6);
        assertEquals(-0.1f, composites.value(FirePeriod.POST, IndexBand.NBR, 0), 1e-6);
        assertEquals("pre_nbr", FirePeriod.PRE.bandName(IndexBand.NBR));
        assertEquals("post_tcg", FirePeriod.POST.bandName(IndexBand.TCG));
    }

    @Test
    void testSeasonWindowParsing() {
        SeasonWindow season = SeasonWindow.parse("06-15", "09-01");
        assertEquals(SeasonWindow.SNOW_FREE.forYear(2010).getStart(), season.forYear(2010).getStart());
        assertEquals(LocalDate.of(2016, 6, 15), season.span(2016, 2020).getStart());
        assertEquals(LocalDate.of(2020, 9, 1), season.span(2016, 2020).getEnd());
    }
}
