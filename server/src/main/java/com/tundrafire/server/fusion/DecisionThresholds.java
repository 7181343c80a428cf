package com.tundrafire.server.fusion;

/**
 * Thresholds of the four detection rules.
 */
public class DecisionThresholds {
    // burn probability must exceed
    public double probabilityMin = 0.9;
    // NBR2 ratio to the historical median must fall below (a drop of more than 50%)
    public double nbr2RatioMax = 0.5;
    // NBR2 difference from the historical median must fall below
    public double nbr2DifferenceMax = -0.1;
    // minimum observed NBR must fall below
    public double nbrMinimumMax = 0.0;

    public static DecisionThresholds defaults() {
        return new DecisionThresholds();
    }
}
