package com.tundrafire.server.raster;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable multi-band float raster keyed by a band enumeration. {@code Float.NaN} marks no data.
 * <p>
 * Band arrays are shared between derived rasters and must not be modified after construction.
 */
public final class Raster<B extends Enum<B>> {

    private final RasterGrid grid;
    private final Class<B> bandType;
    private final EnumMap<B, float[]> bands;
    private final LocalDate acquired;

    private Raster(RasterGrid grid, Class<B> bandType, EnumMap<B, float[]> bands, LocalDate acquired) {
        this.grid = grid;
        this.bandType = bandType;
        this.bands = bands;
        this.acquired = acquired;
    }

    public static <B extends Enum<B>> Builder<B> builder(RasterGrid grid, Class<B> bandType) {
        return new Builder<>(grid, bandType);
    }

    /**
     * Raster carrying every requested band with every pixel set to no data.
     */
    public static <B extends Enum<B>> Raster<B> noData(RasterGrid grid, Class<B> bandType, Collection<B> bandSet) {
        Builder<B> builder = builder(grid, bandType);
        for (B band : bandSet) {
            float[] data = new float[grid.pixelCount()];
            Arrays.fill(data, Float.NaN);
            builder.band(band, data);
        }
        return builder.build();
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public Class<B> getBandType() {
        return bandType;
    }

    /**
     * Acquisition date, or null for composites.
     */
    public LocalDate getAcquired() {
        return acquired;
    }

    public Set<B> bandSet() {
        return bands.isEmpty() ? EnumSet.noneOf(bandType) : EnumSet.copyOf(bands.keySet());
    }

    public boolean hasBands(Collection<B> required) {
        return bands.keySet().containsAll(required);
    }

    public float[] band(B band) {
        float[] data = bands.get(band);
        if (data == null) {
            throw new BandSchemaException("Band " + band + " not present; raster has " + bands.keySet());
        }
        return data;
    }

    public float value(B band, int index) {
        return band(band)[index];
    }

    public Raster<B> select(Collection<B> keep) {
        EnumMap<B, float[]> out = new EnumMap<>(bandType);
        for (B band : keep) {
            out.put(band, band(band));
        }
        return new Raster<>(grid, bandType, out, acquired);
    }

    /**
     * Sets every band to no data wherever the mask is false.
     */
    public Raster<B> updateMask(BooleanRaster keep) {
        if (!grid.equals(keep.getGrid())) {
            throw new IllegalArgumentException("Mask grid " + keep.getGrid() + " does not match " + grid);
        }
        EnumMap<B, float[]> out = new EnumMap<>(bandType);
        for (Map.Entry<B, float[]> e : bands.entrySet()) {
            float[] src = e.getValue();
            float[] dst = new float[src.length];
            for (int i = 0; i < src.length; i++) {
                dst[i] = keep.get(i) ? src[i] : Float.NaN;
            }
            out.put(e.getKey(), dst);
        }
        return new Raster<>(grid, bandType, out, acquired);
    }

    /**
     * Nearest-neighbour resampling onto another grid; target pixels outside this raster become no data.
     */
    public Raster<B> resampleTo(RasterGrid target) {
        if (target.equals(grid)) {
            return this;
        }
        int[] lookup = new int[target.pixelCount()];
        for (int row = 0; row < target.getHeight(); row++) {
            int srcRow = grid.rowOf(target.centerY(row));
            for (int col = 0; col < target.getWidth(); col++) {
                int srcCol = grid.colOf(target.centerX(col));
                lookup[target.index(col, row)] = srcRow < 0 || srcCol < 0 ? -1 : grid.index(srcCol, srcRow);
            }
        }
        EnumMap<B, float[]> out = new EnumMap<>(bandType);
        for (Map.Entry<B, float[]> e : bands.entrySet()) {
            float[] src = e.getValue();
            float[] dst = new float[lookup.length];
            for (int i = 0; i < lookup.length; i++) {
                dst[i] = lookup[i] < 0 ? Float.NaN : src[lookup[i]];
            }
            out.put(e.getKey(), dst);
        }
        return new Raster<>(target, bandType, out, acquired);
    }

    @Override
    public String toString() {
        return "Raster{bands=" + bands.keySet() + ", grid=" + grid + ", acquired=" + acquired + '}';
    }

    public static final class Builder<B extends Enum<B>> {
        private final RasterGrid grid;
        private final Class<B> bandType;
        private final EnumMap<B, float[]> bands;
        private LocalDate acquired;

        private Builder(RasterGrid grid, Class<B> bandType) {
            this.grid = grid;
            this.bandType = bandType;
            this.bands = new EnumMap<>(bandType);
        }

        public Builder<B> band(B band, float[] data) {
            if (data.length != grid.pixelCount()) {
                throw new IllegalArgumentException("Band " + band + " has " + data.length + " values, grid needs "
                        + grid.pixelCount());
            }
            bands.put(band, data);
            return this;
        }

        public Builder<B> acquired(LocalDate date) {
            this.acquired = date;
            return this;
        }

        public Raster<B> build() {
            return new Raster<>(grid, bandType, new EnumMap<>(bands), acquired);
        }
    }
}
