package com.tundrafire.server.fusion;

import com.tundrafire.server.classifier.ClassifierAdapter;
import com.tundrafire.server.deviation.DeviationResult;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Four-rule AND gate producing the candidate fire mask.
 */
public class RuleFusion {

    private static final Logger logger = LoggerFactory.getLogger(RuleFusion.class);

    private final DecisionThresholds thresholds;

    public RuleFusion(DecisionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public DecisionRasters decide(Raster<ClassifierAdapter.Output> probability, DeviationResult deviation) {
        return new DecisionRasters(
                BooleanRaster.where(probability, ClassifierAdapter.Output.PROBABILITY,
                        p -> p > thresholds.probabilityMin),
                BooleanRaster.where(deviation.getRatio(), IndexBand.NBR2, v -> v < thresholds.nbr2RatioMax),
                BooleanRaster.where(deviation.getDifference(), IndexBand.NBR2,
                        v -> v < thresholds.nbr2DifferenceMax),
                BooleanRaster.where(deviation.getMinimum(), IndexBand.NBR, v -> v < thresholds.nbrMinimumMax));
    }

    /**
     * True where all four rules hold on land outside permanent water.
     */
    public BooleanRaster fuse(DecisionRasters decisions, BooleanRaster land, BooleanRaster dryLand) {
        BooleanRaster candidate = land.and(dryLand);
        for (BooleanRaster rule : decisions.all()) {
            candidate = candidate.and(rule);
        }
        logger.info("Candidate fire mask: {} pixels", candidate.count());
        return candidate;
    }
}
