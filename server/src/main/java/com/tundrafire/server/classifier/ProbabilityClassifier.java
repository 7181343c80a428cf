package com.tundrafire.server.classifier;

import java.util.List;

/**
 * Pretrained model mapping a fixed-length feature vector to a burn probability in [0, 1].
 */
public interface ProbabilityClassifier {

    /**
     * Names of the features expected by {@link #probability(double[])}, in order.
     */
    List<String> getFeatureNames();

    double probability(double[] features);
}
