package com.tundrafire.server;

import com.tundrafire.server.harmonize.BandLayout;
import com.tundrafire.server.harmonize.CanonicalBand;
import com.tundrafire.server.harmonize.RawScene;
import com.tundrafire.server.harmonize.Sensor;
import com.tundrafire.server.harmonize.SensorHarmonizer;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Synthetic scenes and rasters shared by the tests.
 */
public final class SceneFixtures {

    public static final double[] HEALTHY = { 0.03, 0.05, 0.04, 0.30, 0.15, 0.08 };
    public static final double[] BURNT = { 0.04, 0.06, 0.07, 0.12, 0.20, 0.22 };

    private SceneFixtures() {
    }

    /** 30 m grid with its north-west corner at (0, height * 30). */
    public static RasterGrid grid(int width, int height) {
        return new RasterGrid(0, height * 30.0, 30, width, height);
    }

    public static int toDn(double reflectance) {
        return (int) Math.round((reflectance - SensorHarmonizer.OFFSET) / SensorHarmonizer.SCALE);
    }

    /**
     * Scene with per-pixel reflectance (blue, green, red, nir, sswir, lswir) and QA values.
     */
    public static RawScene scene(Sensor sensor, LocalDate date, RasterGrid grid, double[][] reflectance, int[] qa) {
        BandLayout layout = sensor.getLayout();
        Map<String, int[]> bands = new HashMap<>();
        CanonicalBand[] order = CanonicalBand.REFLECTIVE.toArray(new CanonicalBand[0]);
        for (int b = 0; b < order.length; b++) {
            int[] dn = new int[grid.pixelCount()];
            for (int i = 0; i < dn.length; i++) {
                dn[i] = toDn(reflectance[i][b]);
            }
            bands.put(layout.sourceBand(order[b]), dn);
        }
        bands.put(BandLayout.QA_BAND, qa);
        return new RawScene(sensor, date, grid, bands);
    }

    /** Scene with identical reflectance and clear QA everywhere. */
    public static RawScene uniformScene(Sensor sensor, LocalDate date, RasterGrid grid, double[] reflectance) {
        double[][] pixels = new double[grid.pixelCount()][];
        Arrays.fill(pixels, reflectance);
        return scene(sensor, date, grid, pixels, new int[grid.pixelCount()]);
    }

    public static float[] filled(RasterGrid grid, float value) {
        float[] data = new float[grid.pixelCount()];
        Arrays.fill(data, value);
        return data;
    }

    /**
     * Index raster with every band set to {@code others}, overridden per band by {@code values}.
     */
    public static Raster<IndexBand> indexRaster(RasterGrid grid, LocalDate date, Map<IndexBand, Float> values,
            float others) {
        Raster.Builder<IndexBand> builder = Raster.builder(grid, IndexBand.class).acquired(date);
        for (IndexBand band : IndexBand.ALL) {
            builder.band(band, filled(grid, values.getOrDefault(band, others)));
        }
        return builder.build();
    }

    public static Map<IndexBand, Float> bands(IndexBand band, float value) {
        Map<IndexBand, Float> m = new EnumMap<>(IndexBand.class);
        m.put(band, value);
        return m;
    }

    public static Map<IndexBand, Float> bands(IndexBand a, float va, IndexBand b, float vb) {
        Map<IndexBand, Float> m = bands(a, va);
        m.put(b, vb);
        return m;
    }
}
