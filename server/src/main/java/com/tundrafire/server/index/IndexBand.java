package com.tundrafire.server.index;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Bands of the per-observation feature raster: fifteen spectral indices followed by the QA band.
 * <p>
 * Tasseled cap coefficients are the surface reflectance set applied uniformly to all Landsat sensors.
 */
public enum IndexBand {
    NBR(r -> normalizedDifference(r.nir, r.lswir)),
    NBR2(r -> normalizedDifference(r.sswir, r.lswir)),
    NDVI(r -> normalizedDifference(r.nir, r.red)),
    NDMI(r -> normalizedDifference(r.nir, r.sswir)),
    NDWI(r -> normalizedDifference(r.green, r.nir)),
    EVI(r -> 2.5 * ((r.nir - r.red) / (r.nir + 6 * r.red - 7.5 * r.blue + 1))),
    MIRBI(r -> 10 * r.lswir - 9.8 * r.sswir + 2),
    BAI(r -> 1 / (square(0.1 - r.red) + square(0.06 - r.nir))),
    BAIMS(r -> 1 / (square(r.nir - 0.05 * r.nir) + square(r.sswir - 0.2 * r.sswir))),
    CSI(r -> r.nir / r.sswir),
    BSI(r -> ((r.red + r.sswir) - (r.nir + r.blue)) / ((r.red + r.sswir) + (r.nir + r.blue))),
    MSAVI(r -> (2 * r.nir + 1 - Math.sqrt(square(2 * r.nir + 1) - 8 * (r.nir - r.red))) / 2),
    TCB(r -> 0.2043 * r.blue + 0.4158 * r.green + 0.5524 * r.red + 0.5741 * r.nir
            + 0.3124 * r.sswir + 0.2303 * r.lswir),
    TCG(r -> -0.1603 * r.blue - 0.2819 * r.green - 0.4934 * r.red + 0.7940 * r.nir
            - 0.0002 * r.sswir - 0.1446 * r.lswir),
    TCW(r -> 0.0315 * r.blue + 0.2021 * r.green + 0.3102 * r.red + 0.1594 * r.nir
            - 0.6806 * r.sswir - 0.6109 * r.lswir),
    QA(null);

    public static final Set<IndexBand> INDICES = EnumSet.range(NBR, TCW);
    public static final Set<IndexBand> ALL = EnumSet.allOf(IndexBand.class);

    private final ToDoubleFunction<Reflectance> formula;

    IndexBand(ToDoubleFunction<Reflectance> formula) {
        this.formula = formula;
    }

    public boolean isIndex() {
        return formula != null;
    }

    public double compute(Reflectance r) {
        if (formula == null) {
            throw new UnsupportedOperationException(name() + " is not a spectral index");
        }
        return formula.applyAsDouble(r);
    }

    public String getBandName() {
        return this == QA ? "qa_pixel" : name().toLowerCase(Locale.ROOT);
    }

    public static double normalizedDifference(double a, double b) {
        return (a - b) / (a + b);
    }

    private static double square(double v) {
        return v * v;
    }
}
