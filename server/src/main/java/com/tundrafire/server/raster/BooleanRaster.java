package com.tundrafire.server.raster;

import java.util.function.DoublePredicate;

/**
 * Boolean decision or quality raster.
 */
public final class BooleanRaster {

    private final RasterGrid grid;
    private final boolean[] values;

    public BooleanRaster(RasterGrid grid, boolean[] values) {
        if (values.length != grid.pixelCount()) {
            throw new IllegalArgumentException("Expected " + grid.pixelCount() + " values, got " + values.length);
        }
        this.grid = grid;
        this.values = values;
    }

    public static BooleanRaster filled(RasterGrid grid, boolean value) {
        boolean[] values = new boolean[grid.pixelCount()];
        if (value) {
            java.util.Arrays.fill(values, true);
        }
        return new BooleanRaster(grid, values);
    }

    /**
     * Applies a threshold predicate to one band. No-data pixels never satisfy the predicate.
     */
    public static <B extends Enum<B>> BooleanRaster where(Raster<B> raster, B band, DoublePredicate predicate) {
        float[] data = raster.band(band);
        boolean[] out = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            float v = data[i];
            out[i] = !Float.isNaN(v) && predicate.test(v);
        }
        return new BooleanRaster(raster.getGrid(), out);
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public boolean get(int index) {
        return values[index];
    }

    public boolean get(int col, int row) {
        return values[grid.index(col, row)];
    }

    public int count() {
        int n = 0;
        for (boolean v : values) {
            if (v) {
                n++;
            }
        }
        return n;
    }

    public BooleanRaster and(BooleanRaster other) {
        requireSameGrid(other);
        boolean[] out = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] && other.values[i];
        }
        return new BooleanRaster(grid, out);
    }

    public BooleanRaster or(BooleanRaster other) {
        requireSameGrid(other);
        boolean[] out = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] || other.values[i];
        }
        return new BooleanRaster(grid, out);
    }

    public BooleanRaster not() {
        boolean[] out = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = !values[i];
        }
        return new BooleanRaster(grid, out);
    }

    /**
     * Nearest-neighbour resampling: each target pixel takes the value under its centre, false outside this grid.
     */
    public BooleanRaster resampleTo(RasterGrid target) {
        if (target.equals(grid)) {
            return this;
        }
        boolean[] out = new boolean[target.pixelCount()];
        for (int row = 0; row < target.getHeight(); row++) {
            int srcRow = grid.rowOf(target.centerY(row));
            if (srcRow < 0) {
                continue;
            }
            for (int col = 0; col < target.getWidth(); col++) {
                int srcCol = grid.colOf(target.centerX(col));
                if (srcCol >= 0) {
                    out[target.index(col, row)] = values[grid.index(srcCol, srcRow)];
                }
            }
        }
        return new BooleanRaster(target, out);
    }

    /**
     * Copies the pixels of a window of this raster's grid, see {@link RasterGrid#window}.
     */
    public BooleanRaster crop(RasterGrid window) {
        if (window.equals(grid)) {
            return this;
        }
        int[] offset = window.offsetIn(grid);
        boolean[] out = new boolean[window.pixelCount()];
        for (int row = 0; row < window.getHeight(); row++) {
            System.arraycopy(values, grid.index(offset[0], offset[1] + row), out, window.index(0, row),
                    window.getWidth());
        }
        return new BooleanRaster(window, out);
    }

    private void requireSameGrid(BooleanRaster other) {
        if (!grid.equals(other.grid)) {
            throw new IllegalArgumentException("Grid mismatch: " + grid + " vs " + other.grid);
        }
    }
}
