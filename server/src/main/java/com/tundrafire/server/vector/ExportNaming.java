package com.tundrafire.server.vector;

import java.util.Locale;

public final class ExportNaming {

    public static final String DRAWN_ROI_ID = "drawROI";

    private ExportNaming() {
    }

    public static String tileId(int index) {
        return String.format(Locale.ROOT, "ROIsub_%02d", index);
    }

    /**
     * e.g. {@code candidateFires__2019__ROIsub_03_0px60m}
     */
    public static String exportName(int year, String regionId, int pixelFilter, double resolution) {
        return "candidateFires__" + year + "__" + regionId + "_" + pixelFilter + "px" + formatResolution(resolution)
                + "m";
    }

    private static String formatResolution(double resolution) {
        if (resolution == Math.rint(resolution)) {
            return Long.toString((long) resolution);
        }
        return Double.toString(resolution);
    }
}
