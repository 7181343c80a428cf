package com.tundrafire.server.harmonize;

import java.util.EnumMap;
import java.util.Map;

/**
 * Source band identifiers of the Collection 2 surface reflectance products.
 */
public enum BandLayout {
    // TM / ETM+
    LEGACY("SR_B1", "SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B7"),
    // OLI
    NEW("SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B6", "SR_B7");

    public static final String QA_BAND = "QA_PIXEL";

    private final Map<CanonicalBand, String> sourceBands = new EnumMap<>(CanonicalBand.class);

    BandLayout(String blue, String green, String red, String nir, String sswir, String lswir) {
        sourceBands.put(CanonicalBand.BLUE, blue);
        sourceBands.put(CanonicalBand.GREEN, green);
        sourceBands.put(CanonicalBand.RED, red);
        sourceBands.put(CanonicalBand.NIR, nir);
        sourceBands.put(CanonicalBand.SSWIR, sswir);
        sourceBands.put(CanonicalBand.LSWIR, lswir);
        sourceBands.put(CanonicalBand.QA, QA_BAND);
    }

    public String sourceBand(CanonicalBand band) {
        return sourceBands.get(band);
    }
}
