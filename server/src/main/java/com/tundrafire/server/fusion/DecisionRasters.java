package com.tundrafire.server.fusion;

import com.tundrafire.server.raster.BooleanRaster;

import java.util.List;

public class DecisionRasters {
    private final BooleanRaster highProbability;
    private final BooleanRaster ratioDrop;
    private final BooleanRaster differenceDrop;
    private final BooleanRaster lowMinimum;

    public DecisionRasters(BooleanRaster highProbability, BooleanRaster ratioDrop, BooleanRaster differenceDrop,
            BooleanRaster lowMinimum) {
        this.highProbability = highProbability;
        this.ratioDrop = ratioDrop;
        this.differenceDrop = differenceDrop;
        this.lowMinimum = lowMinimum;
    }

    public BooleanRaster getHighProbability() {
        return highProbability;
    }

    public BooleanRaster getRatioDrop() {
        return ratioDrop;
    }

    public BooleanRaster getDifferenceDrop() {
        return differenceDrop;
    }

    public BooleanRaster getLowMinimum() {
        return lowMinimum;
    }

    public List<BooleanRaster> all() {
        return List.of(highProbability, ratioDrop, differenceDrop, lowMinimum);
    }
}
