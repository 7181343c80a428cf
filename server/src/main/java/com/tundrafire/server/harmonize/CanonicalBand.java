package com.tundrafire.server.harmonize;

import java.util.EnumSet;
import java.util.Set;

/**
 * Band set shared by every harmonized scene, regardless of sensor.
 */
public enum CanonicalBand {
    BLUE("blue"),
    GREEN("green"),
    RED("red"),
    NIR("nir"),
    SSWIR("sswir"),
    LSWIR("lswir"),
    QA("qa_pixel");

    public static final Set<CanonicalBand> ALL = EnumSet.allOf(CanonicalBand.class);
    public static final Set<CanonicalBand> REFLECTIVE = EnumSet.range(BLUE, LSWIR);

    private final String bandName;

    CanonicalBand(String bandName) {
        this.bandName = bandName;
    }

    public String getBandName() {
        return bandName;
    }
}
