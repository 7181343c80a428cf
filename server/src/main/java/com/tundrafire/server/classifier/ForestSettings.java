package com.tundrafire.server.classifier;

/**
 * Hyperparameters the forest was trained with. Selected by random search over accuracy.
 */
public class ForestSettings {
    public int numberOfTrees = 100;
    // null: unrestricted (square root of the feature count)
    public Integer variablesPerSplit = null;
    public int minLeafPopulation = 1;
    public double bagFraction = 0.7;
    public int maxNodes = 560;
    public long seed = 1;

    public ForestSettings() {
    }

    public ForestSettings(int numberOfTrees, Integer variablesPerSplit, int minLeafPopulation, double bagFraction,
            int maxNodes, long seed) {
        this.numberOfTrees = numberOfTrees;
        this.variablesPerSplit = variablesPerSplit;
        this.minLeafPopulation = minLeafPopulation;
        this.bagFraction = bagFraction;
        this.maxNodes = maxNodes;
        this.seed = seed;
    }

    public static ForestSettings defaults() {
        return new ForestSettings(100, null, 1, 0.7, 560, 1);
    }
}
