package com.tundrafire.server.pipeline;

import com.tundrafire.server.burn.BurnMetric;
import com.tundrafire.server.classifier.ClassifierAdapter;
import com.tundrafire.server.deviation.DeviationResult;
import com.tundrafire.server.fusion.DecisionRasters;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import com.tundrafire.server.vector.ExportOutcome;

/**
 * Rasters computed for one analysed area: the drawn ROI, or one tile of the default region.
 */
public class AreaResult {
    private final String regionId;
    private final RasterGrid grid;
    private final int observationCount;
    private final Raster<BurnMetric> burnMetrics;
    private final Raster<ClassifierAdapter.Output> probability;
    private final DeviationResult deviation;
    private final DecisionRasters decisions;
    private final BooleanRaster candidates;
    private final ExportOutcome export;

    public AreaResult(String regionId, RasterGrid grid, int observationCount, Raster<BurnMetric> burnMetrics,
            Raster<ClassifierAdapter.Output> probability, DeviationResult deviation, DecisionRasters decisions,
            BooleanRaster candidates, ExportOutcome export) {
        this.regionId = regionId;
        this.grid = grid;
        this.observationCount = observationCount;
        this.burnMetrics = burnMetrics;
        this.probability = probability;
        this.deviation = deviation;
        this.decisions = decisions;
        this.candidates = candidates;
        this.export = export;
    }

    public AreaResult withExport(ExportOutcome outcome) {
        return new AreaResult(regionId, grid, observationCount, burnMetrics, probability, deviation, decisions,
                candidates, outcome);
    }

    public String getRegionId() {
        return regionId;
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public int getObservationCount() {
        return observationCount;
    }

    public Raster<BurnMetric> getBurnMetrics() {
        return burnMetrics;
    }

    public Raster<ClassifierAdapter.Output> getProbability() {
        return probability;
    }

    public DeviationResult getDeviation() {
        return deviation;
    }

    public DecisionRasters getDecisions() {
        return decisions;
    }

    public BooleanRaster getCandidates() {
        return candidates;
    }

    /**
     * Null when the run did not export.
     */
    public ExportOutcome getExport() {
        return export;
    }
}
