package com.tundrafire.server.raster;

import java.util.Arrays;

/**
 * Pixelwise reduction operators. No-data inputs are ignored; a pixel with no valid input reduces to no data.
 */
public enum Reducer {
    MEDIAN {
        @Override
        double reduceValid(double[] values, int n) {
            Arrays.sort(values, 0, n);
            int mid = n / 2;
            return n % 2 == 1 ? values[mid] : (values[mid - 1] + values[mid]) / 2.0;
        }
    },
    MIN {
        @Override
        double reduceValid(double[] values, int n) {
            double min = values[0];
            for (int i = 1; i < n; i++) {
                min = Math.min(min, values[i]);
            }
            return min;
        }
    },
    MEAN {
        @Override
        double reduceValid(double[] values, int n) {
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                sum += values[i];
            }
            return sum / n;
        }
    };

    // values[0..n) are all valid and n > 0; implementations may reorder them
    abstract double reduceValid(double[] values, int n);

    /**
     * Reduces the first {@code n} entries of {@code scratch}, skipping NaN. The array is reordered.
     */
    public double reduce(double[] scratch, int n) {
        int valid = 0;
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(scratch[i])) {
                scratch[valid++] = scratch[i];
            }
        }
        return valid == 0 ? Double.NaN : reduceValid(scratch, valid);
    }
}
