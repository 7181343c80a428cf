package com.tundrafire.server.classifier;

import com.tundrafire.server.burn.BurnMetric;
import com.tundrafire.server.raster.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies a pretrained classifier pixel by pixel to the predictor raster.
 */
public class ClassifierAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ClassifierAdapter.class);

    public enum Output {
        PROBABILITY
    }

    private final ProbabilityClassifier classifier;
    private final BurnMetric[] inputs;

    public ClassifierAdapter(ProbabilityClassifier classifier) {
        this.classifier = classifier;
        List<String> names = classifier.getFeatureNames();
        this.inputs = new BurnMetric[names.size()];
        for (int k = 0; k < inputs.length; k++) {
            inputs[k] = BurnMetric.fromModelName(names.get(k));
        }
    }

    /**
     * Returns a single-band probability raster clamped to [0, 1]. Pixels with any missing predictor are no data.
     */
    public Raster<Output> apply(Raster<BurnMetric> predictors) {
        int n = predictors.getGrid().pixelCount();
        float[][] columns = new float[inputs.length][];
        for (int k = 0; k < inputs.length; k++) {
            columns[k] = predictors.band(inputs[k]);
        }
        float[] probability = new float[n];
        double[] features = new double[inputs.length];
        int classified = 0;
        for (int i = 0; i < n; i++) {
            boolean complete = true;
            for (int k = 0; k < inputs.length; k++) {
                features[k] = columns[k][i];
                if (Float.isNaN(columns[k][i])) {
                    complete = false;
                    break;
                }
            }
            if (!complete) {
                probability[i] = Float.NaN;
                continue;
            }
            double p = classifier.probability(features);
            probability[i] = (float) Math.max(0.0, Math.min(1.0, p));
            classified++;
        }
        logger.debug("Classified {} of {} pixels", classified, n);
        return Raster.builder(predictors.getGrid(), Output.class)
                .band(Output.PROBABILITY, probability)
                .build();
    }
}
