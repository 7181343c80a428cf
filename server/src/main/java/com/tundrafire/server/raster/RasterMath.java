package com.tundrafire.server.raster;

import java.util.Collection;
import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Pixelwise arithmetic over aligned rasters. Arithmetic on no data yields no data.
 */
public final class RasterMath {

    private RasterMath() {
    }

    /**
     * Band-by-band ratio over the given bands; a zero divisor yields no data.
     */
    public static <B extends Enum<B>> Raster<B> divide(Raster<B> a, Raster<B> b, Collection<B> bands) {
        return combine(a, b, bands, (x, y) -> y == 0.0 ? Double.NaN : x / y);
    }

    public static <B extends Enum<B>> Raster<B> subtract(Raster<B> a, Raster<B> b, Collection<B> bands) {
        return combine(a, b, bands, (x, y) -> x - y);
    }

    public static <B extends Enum<B>> Raster<B> combine(Raster<B> a, Raster<B> b, Collection<B> bands,
            DoubleBinaryOperator op) {
        requireSameGrid(a.getGrid(), b.getGrid());
        Raster.Builder<B> out = Raster.builder(a.getGrid(), a.getBandType()).acquired(a.getAcquired());
        for (B band : bands) {
            float[] x = a.band(band);
            float[] y = b.band(band);
            float[] r = new float[x.length];
            for (int i = 0; i < x.length; i++) {
                if (Float.isNaN(x[i]) || Float.isNaN(y[i])) {
                    r[i] = Float.NaN;
                } else {
                    double v = op.applyAsDouble(x[i], y[i]);
                    r[i] = Double.isFinite(v) ? (float) v : Float.NaN;
                }
            }
            out.band(band, r);
        }
        return out.build();
    }

    /**
     * Pixelwise reduction across a list of aligned rasters for the given bands.
     */
    public static <B extends Enum<B>> Raster<B> reduce(List<Raster<B>> rasters, Collection<B> bands,
            Reducer reducer) {
        if (rasters.isEmpty()) {
            throw new IllegalArgumentException("Nothing to reduce");
        }
        RasterGrid grid = rasters.get(0).getGrid();
        for (Raster<B> r : rasters) {
            requireSameGrid(grid, r.getGrid());
        }
        int n = rasters.size();
        double[] scratch = new double[n];
        Raster.Builder<B> out = Raster.builder(grid, rasters.get(0).getBandType());
        for (B band : bands) {
            float[][] inputs = new float[n][];
            for (int k = 0; k < n; k++) {
                inputs[k] = rasters.get(k).band(band);
            }
            float[] result = new float[grid.pixelCount()];
            for (int i = 0; i < result.length; i++) {
                for (int k = 0; k < n; k++) {
                    scratch[k] = inputs[k][i];
                }
                result[i] = (float) reducer.reduce(scratch, n);
            }
            out.band(band, result);
        }
        return out.build();
    }

    static void requireSameGrid(RasterGrid a, RasterGrid b) {
        if (!a.equals(b)) {
            throw new IllegalArgumentException("Rasters are not aligned: " + a + " vs " + b);
        }
    }
}
