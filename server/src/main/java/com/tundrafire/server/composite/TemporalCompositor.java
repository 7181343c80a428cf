package com.tundrafire.server.composite;

import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.DateWindow;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import com.tundrafire.server.raster.RasterMath;
import com.tundrafire.server.raster.Reducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Reduces an observation set over a time window to one composite on the analysis grid, clipped to the ROI.
 * <p>
 * The composite always carries every requested band. A window without observations yields the no-data raster, so
 * band arithmetic on the result never fails for lack of a band.
 */
public class TemporalCompositor {

    private static final Logger logger = LoggerFactory.getLogger(TemporalCompositor.class);

    private final RasterGrid grid;
    private final BooleanRaster roiMask;

    public TemporalCompositor(RasterGrid grid, BooleanRaster roiMask) {
        if (!grid.equals(roiMask.getGrid())) {
            throw new IllegalArgumentException("ROI mask must be on the analysis grid");
        }
        this.grid = grid;
        this.roiMask = roiMask;
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public BooleanRaster getRoiMask() {
        return roiMask;
    }

    public <B extends Enum<B>> Raster<B> composite(ObservationSet<B> observations, Set<B> bands, DateWindow window,
            Reducer reducer) {
        return composite(observations.filterDate(window), bands, reducer);
    }

    /**
     * Reduces every observation of the set, which the caller has already filtered.
     */
    public <B extends Enum<B>> Raster<B> composite(ObservationSet<B> observations, Set<B> bands, Reducer reducer) {
        if (observations.isEmpty()) {
            logger.debug("No observations to composite, emitting no-data {} raster", bands);
            return Raster.noData(grid, observations.getBandType(), bands);
        }
        logger.debug("Compositing {} observations with {}", observations.size(), reducer);
        return RasterMath.reduce(observations.getObservations(), bands, reducer).updateMask(roiMask);
    }
}
