package com.tundrafire.server.harmonize;

import com.tundrafire.server.raster.RasterGrid;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

/**
 * Unprocessed surface reflectance scene: stored digital numbers keyed by the product's own band identifiers.
 */
public class RawScene {
    private final Sensor sensor;
    private final LocalDate acquired;
    private final RasterGrid grid;
    private final Map<String, int[]> bands;

    public RawScene(Sensor sensor, LocalDate acquired, RasterGrid grid, Map<String, int[]> bands) {
        this.sensor = sensor;
        this.acquired = acquired;
        this.grid = grid;
        this.bands = Collections.unmodifiableMap(bands);
    }

    public Sensor getSensor() {
        return sensor;
    }

    public LocalDate getAcquired() {
        return acquired;
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public Map<String, int[]> getBands() {
        return bands;
    }

    @Override
    public String toString() {
        return "RawScene{sensor=" + sensor + ", acquired=" + acquired + '}';
    }
}
