package com.tundrafire.server.deviation;

import com.tundrafire.server.composite.SeasonWindow;
import com.tundrafire.server.composite.TemporalCompositor;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterMath;
import com.tundrafire.server.raster.Reducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Compares the fire year and the following year against a three-season historical baseline.
 * <p>
 * Each evaluation output is the minimum over the two windows, so either an immediate or a one-year-later response
 * can trigger detection.
 */
public class DeviationDetector {

    private static final Logger logger = LoggerFactory.getLogger(DeviationDetector.class);

    static final int BASELINE_YEARS = 3;
    private static final Set<IndexBand> BANDS = IndexBand.INDICES;

    private final TemporalCompositor compositor;
    private final SeasonWindow season;

    public DeviationDetector(TemporalCompositor compositor, SeasonWindow season) {
        this.compositor = compositor;
        this.season = season;
    }

    public DeviationResult detect(ObservationSet<IndexBand> observations, int year, BooleanRaster landMask) {
        ObservationSet<IndexBand> indices = observations.map(IndexBand.class, BANDS, r -> r.select(BANDS));
        Raster<IndexBand> baseline = baseline(indices, year);

        ObservationSet<IndexBand> ratios = indices.map(r -> RasterMath.divide(r, baseline, BANDS));
        ObservationSet<IndexBand> differences = indices.map(r -> RasterMath.subtract(r, baseline, BANDS));

        Raster<IndexBand> ratio = minOverWindows(ratios, year, Reducer.MEDIAN);
        Raster<IndexBand> difference = minOverWindows(differences, year, Reducer.MEAN);
        Raster<IndexBand> minimum = minOverWindows(indices, year, Reducer.MIN);

        logger.debug("Deviation rasters computed for {}", year);
        return new DeviationResult(baseline, ratio.updateMask(landMask), difference.updateMask(landMask),
                minimum.updateMask(landMask));
    }

    /**
     * Median over the seasons of the three years preceding {@code year}.
     */
    public Raster<IndexBand> baseline(ObservationSet<IndexBand> indices, int year) {
        ObservationSet<IndexBand> history = ObservationSet.empty(IndexBand.class, BANDS);
        for (int k = 1; k <= BASELINE_YEARS; k++) {
            history = history.merge(indices.filterDate(season.forYear(year - k)));
        }
        logger.debug("Baseline for {} from {} observations", year, history.size());
        return compositor.composite(history, BANDS, Reducer.MEDIAN);
    }

    private Raster<IndexBand> minOverWindows(ObservationSet<IndexBand> set, int year, Reducer reducer) {
        Raster<IndexBand> fireYear = compositor.composite(set, BANDS, season.forYear(year), reducer);
        Raster<IndexBand> nextYear = compositor.composite(set, BANDS, season.forYear(year + 1), reducer);
        return RasterMath.reduce(List.of(nextYear, fireYear), BANDS, Reducer.MIN);
    }
}
