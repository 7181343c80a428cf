package com.tundrafire.server.pipeline;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;

/**
 * Immutable parameters of one detection run.
 */
public final class RunConfiguration {

    public static final int MIN_YEAR = 1985;
    public static final int MAX_YEAR = 2023;

    private final int year;
    private final RoiMode mode;
    private final Geometry roi;
    private final boolean exportEnabled;

    public RunConfiguration(int year, RoiMode mode, Geometry roi, boolean exportEnabled) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException(
                    "Analysis year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got " + year);
        }
        if (mode == null) {
            throw new IllegalArgumentException("ROI mode is required");
        }
        if (roi == null || roi.isEmpty() || !(roi instanceof Polygonal)) {
            throw new IllegalArgumentException("ROI must be a non-empty polygon");
        }
        this.year = year;
        this.mode = mode;
        this.roi = roi;
        this.exportEnabled = exportEnabled;
    }

    public static RunConfiguration drawn(int year, Geometry polygon, boolean export) {
        return new RunConfiguration(year, RoiMode.DRAWN_POLYGON, polygon, export);
    }

    public static RunConfiguration defaultRegion(int year, Geometry region, boolean export) {
        return new RunConfiguration(year, RoiMode.DEFAULT_REGION, region, export);
    }

    public int getYear() {
        return year;
    }

    public RoiMode getMode() {
        return mode;
    }

    public Geometry getRoi() {
        return roi;
    }

    public boolean isExportEnabled() {
        return exportEnabled;
    }

    @Override
    public String toString() {
        return "RunConfiguration{year=" + year + ", mode=" + mode + ", export=" + exportEnabled + "}";
    }
}
