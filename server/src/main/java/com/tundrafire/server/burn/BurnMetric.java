package com.tundrafire.server.burn;

import java.util.List;
import java.util.Locale;

/**
 * Pre-/post-fire change metrics, in computation order.
 */
public enum BurnMetric {
    DNBR("dNBR", true),
    RBR("RBR", true),
    PRE_NBR3("pre_nbr3", false),
    RDNBR("RdNBR", true),
    DNDVI("dNDVI", true),
    DEVI("dEVI", true),
    DNDMI("dNDMI", true),
    DMIRBI("dMIRBI", true),
    DNBR2("dNBR2", true),
    DNDWI("dNDWI", true),
    DBAI("dBAI", true),
    DBAIMS("dBAIMs", true),
    DCSI("dCSI", true),
    DBSI("dBSI", true),
    DTCB("dTCB", true),
    DTCG("dTCG", true),
    DTCW("dTCW", true),
    DMSAVI("dMSAVI", true);

    /**
     * Predictor subset fed to the probability classifier, in model column order.
     */
    public static final List<BurnMetric> PREDICTORS = List.of(DNBR2, DTCG, DTCB);

    private final String modelName;
    private final boolean integer;

    BurnMetric(String modelName, boolean integer) {
        this.modelName = modelName;
        this.integer = integer;
    }

    public String getModelName() {
        return modelName;
    }

    public String getBandName() {
        return modelName.toLowerCase(Locale.ROOT);
    }

    /**
     * Whether values are truncated to integers.
     */
    public boolean isInteger() {
        return integer;
    }

    public static BurnMetric fromModelName(String name) {
        for (BurnMetric m : values()) {
            if (m.modelName.equals(name)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown burn metric: " + name);
    }
}
