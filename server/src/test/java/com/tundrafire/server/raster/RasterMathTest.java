package com.tundrafire.server.raster;

import com.tundrafire.server.index.IndexBand;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RasterMathTest {

    private static final RasterGrid GRID = new RasterGrid(0, 30, 30, 3, 1);
    private static final Set<IndexBand> NBR = Set.of(IndexBand.NBR);

    private static Raster<IndexBand> nbr(float... values) {
        return Raster.builder(GRID, IndexBand.class).band(IndexBand.NBR, values)
                .acquired(LocalDate.of(2019, 7, 1)).build();
    }

    @Test
    void testDivideByZeroIsNoData() {
        Raster<IndexBand> ratio = RasterMath.divide(nbr(0.2f, 0.3f, Float.NaN), nbr(0.4f, 0f, 0.5f), NBR);
        assertEquals(0.5f, ratio.value(IndexBand.NBR, 0), 1e-6);
        assertTrue(Float.isNaN(ratio.value(IndexBand.NBR, 1)));
        assertTrue(Float.isNaN(ratio.value(IndexBand.NBR, 2)));
        assertEquals(LocalDate.of(2019, 7, 1), ratio.getAcquired());
    }

    @Test
    void testReducersSkipNoData() {
        List<Raster<IndexBand>> stack = List.of(
                nbr(1f, Float.NaN, Float.NaN),
                nbr(4f, 2f, Float.NaN),
                nbr(2f, Float.NaN, Float.NaN),
                nbr(3f, 6f, Float.NaN));

        Raster<IndexBand> median = RasterMath.reduce(stack, NBR, Reducer.MEDIAN);
        assertEquals(2.5f, median.value(IndexBand.NBR, 0), 1e-6);
        assertEquals(4f, median.value(IndexBand.NBR, 1), 1e-6);
        assertTrue(Float.isNaN(median.value(IndexBand.NBR, 2)));

        assertEquals(1f, RasterMath.reduce(stack, NBR, Reducer.MIN).value(IndexBand.NBR, 0));
        assertEquals(2.5f, RasterMath.reduce(stack, NBR, Reducer.MEAN).value(IndexBand.NBR, 0), 1e-6);
    }

    @Test
    void testMisalignedRastersRejected() {
        RasterGrid other = new RasterGrid(30, 30, 30, 3, 1);
        Raster<IndexBand> shifted = Raster.builder(other, IndexBand.class)
                .band(IndexBand.NBR, new float[3]).build();
        assertThrows(IllegalArgumentException.class, () -> RasterMath.subtract(nbr(1, 2, 3), shifted, NBR));
    }

    @Test
    void testMissingBandThrowsSchemaError() {
        assertThrows(BandSchemaException.class, () -> nbr(1, 2, 3).band(IndexBand.NBR2));
    }

    @Test
    void testDateWindowIsHalfOpen() {
        DateWindow w = new DateWindow(LocalDate.of(2019, 6, 15), LocalDate.of(2019, 9, 1));
        assertTrue(w.contains(LocalDate.of(2019, 6, 15)));
        assertTrue(w.contains(LocalDate.of(2019, 8, 31)));
        assertFalse(w.contains(LocalDate.of(2019, 9, 1)));
    }
}
