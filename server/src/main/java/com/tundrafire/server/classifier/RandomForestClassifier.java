package com.tundrafire.server.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * Read-only random forest in probability mode: the burn probability is the mean of the leaf probabilities reached
 * in each tree.
 */
public class RandomForestClassifier implements ProbabilityClassifier {

    private static final Logger logger = LoggerFactory.getLogger(RandomForestClassifier.class);

    public static class ModelDocument {
        public ForestSettings settings;
        public List<String> features;
        public List<DecisionTree> trees;
    }

    private final ForestSettings settings;
    private final List<String> featureNames;
    private final List<DecisionTree> trees;

    public RandomForestClassifier(ForestSettings settings, List<String> featureNames, List<DecisionTree> trees) {
        if (featureNames == null || featureNames.isEmpty()) {
            throw new IllegalArgumentException("Forest declares no features");
        }
        if (trees == null || trees.size() != settings.numberOfTrees) {
            throw new IllegalArgumentException("Expected " + settings.numberOfTrees + " trees, got "
                    + (trees == null ? 0 : trees.size()));
        }
        for (DecisionTree tree : trees) {
            tree.validate(featureNames.size());
            if (tree.nodes.size() > settings.maxNodes) {
                throw new IllegalArgumentException("Tree has " + tree.nodes.size() + " nodes, limit is "
                        + settings.maxNodes);
            }
        }
        this.settings = settings;
        this.featureNames = Collections.unmodifiableList(featureNames);
        this.trees = Collections.unmodifiableList(trees);
    }

    public static RandomForestClassifier load(InputStream json) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ModelDocument doc = mapper.readValue(json, ModelDocument.class);
        ForestSettings settings = doc.settings != null ? doc.settings : ForestSettings.defaults();
        RandomForestClassifier forest = new RandomForestClassifier(settings, doc.features, doc.trees);
        logger.info("Loaded random forest: {} trees, features={}, seed={}", settings.numberOfTrees, doc.features,
                settings.seed);
        return forest;
    }

    public ForestSettings getSettings() {
        return settings;
    }

    @Override
    public List<String> getFeatureNames() {
        return featureNames;
    }

    @Override
    public double probability(double[] features) {
        if (features.length != featureNames.size()) {
            throw new IllegalArgumentException("Expected " + featureNames.size() + " features, got "
                    + features.length);
        }
        double sum = 0.0;
        for (DecisionTree tree : trees) {
            sum += tree.predict(features);
        }
        return sum / trees.size();
    }
}
