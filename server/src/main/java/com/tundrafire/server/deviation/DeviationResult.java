package com.tundrafire.server.deviation;

import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.Raster;

/**
 * Historical deviation rasters, each the pixelwise minimum over the fire-year and following-year windows.
 */
public class DeviationResult {
    private final Raster<IndexBand> baseline;
    private final Raster<IndexBand> ratio;
    private final Raster<IndexBand> difference;
    private final Raster<IndexBand> minimum;

    public DeviationResult(Raster<IndexBand> baseline, Raster<IndexBand> ratio, Raster<IndexBand> difference,
            Raster<IndexBand> minimum) {
        this.baseline = baseline;
        this.ratio = ratio;
        this.difference = difference;
        this.minimum = minimum;
    }

    /**
     * Median of the three preceding seasons.
     */
    public Raster<IndexBand> getBaseline() {
        return baseline;
    }

    /**
     * Observation divided by baseline, median per window.
     */
    public Raster<IndexBand> getRatio() {
        return ratio;
    }

    /**
     * Observation minus baseline, mean per window.
     */
    public Raster<IndexBand> getDifference() {
        return difference;
    }

    /**
     * Raw index minimum per window, no baseline.
     */
    public Raster<IndexBand> getMinimum() {
        return minimum;
    }
}
