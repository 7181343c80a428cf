package com.tundrafire.server.harmonize;

/**
 * Decodes the QA_PIXEL band into a defect flag.
 */
public enum QualityMaskPolicy {
    STANDARD,
    /**
     * Landsat 7 after the scan line corrector failure: also rejects medium and high cloud confidence.
     */
    DEGRADED;

    public static final int FILL = 1;
    public static final int DILATED_CLOUD = 1 << 1;
    public static final int CLOUD = 1 << 3;
    public static final int CLOUD_SHADOW = 1 << 4;
    public static final int SNOW = 1 << 5;
    public static final int WATER = 1 << 7;

    static final int STANDARD_DEFECTS = FILL | DILATED_CLOUD | CLOUD | CLOUD_SHADOW | SNOW | WATER;

    private static final int CONFIDENCE_LOW_BIT = 1 << 8;
    private static final int CONFIDENCE_HIGH_BIT = 1 << 9;
    // summed confidence bits -> confidence level
    private static final double[] CONFIDENCE_BREAKS = {0, 257, 513, 768};
    private static final double[] CONFIDENCE_LEVELS = {0, 1, 2, 3};

    public boolean isDefective(int qa) {
        if ((qa & STANDARD_DEFECTS) != 0) {
            return true;
        }
        return this == DEGRADED && cloudConfidence(qa) >= 2;
    }

    /**
     * Cloud confidence 0 (none) to 3 (high), from the two confidence bits summed and linearly interpolated over fixed
     * breakpoints, clamped at both ends and truncated.
     */
    public static int cloudConfidence(int qa) {
        double sum = (qa & CONFIDENCE_LOW_BIT) + (qa & CONFIDENCE_HIGH_BIT);
        return (int) interpolateClamped(sum, CONFIDENCE_BREAKS, CONFIDENCE_LEVELS);
    }

    static double interpolateClamped(double x, double[] xs, double[] ys) {
        if (x <= xs[0]) {
            return ys[0];
        }
        int last = xs.length - 1;
        if (x >= xs[last]) {
            return ys[last];
        }
        int i = 1;
        while (x > xs[i]) {
            i++;
        }
        double t = (x - xs[i - 1]) / (xs[i] - xs[i - 1]);
        return ys[i - 1] + t * (ys[i] - ys[i - 1]);
    }
}
