package com.tundrafire.server.burn;

import com.tundrafire.server.composite.FireComposites;
import com.tundrafire.server.composite.FirePeriod;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Derives change metrics from pre- and post-fire composites. Integer metrics are truncated toward zero and later
 * metrics read the truncated values of earlier ones. No data propagates.
 */
public class BurnMetricCalculator {

    private static final Logger logger = LoggerFactory.getLogger(BurnMetricCalculator.class);

    static final double RBR_OFFSET = 1.001;
    static final double MIN_PRE_NBR = 0.001;

    public Raster<BurnMetric> calculate(FireComposites composites) {
        RasterGrid grid = composites.get(FirePeriod.PRE).getGrid();
        int n = grid.pixelCount();
        Map<BurnMetric, float[]> out = new EnumMap<>(BurnMetric.class);
        for (BurnMetric m : BurnMetric.values()) {
            out.put(m, new float[n]);
        }

        for (int i = 0; i < n; i++) {
            double preNbr = composites.value(FirePeriod.PRE, IndexBand.NBR, i);
            double dnbr = store(out, BurnMetric.DNBR, i, (preNbr - post(composites, IndexBand.NBR, i)) * 1000);
            store(out, BurnMetric.RBR, i, dnbr / (preNbr + RBR_OFFSET));
            double preNbr3 = store(out, BurnMetric.PRE_NBR3, i, preNbr3(preNbr));
            store(out, BurnMetric.RDNBR, i, dnbr / preNbr3);
            store(out, BurnMetric.DNDVI, i, difference(composites, IndexBand.NDVI, i) * 1000);
            store(out, BurnMetric.DEVI, i, difference(composites, IndexBand.EVI, i) * 1000);
            store(out, BurnMetric.DNDMI, i, difference(composites, IndexBand.NDMI, i) * 1000);
            store(out, BurnMetric.DMIRBI, i, difference(composites, IndexBand.MIRBI, i) * 1000);
            store(out, BurnMetric.DNBR2, i, difference(composites, IndexBand.NBR2, i) * 1000);
            store(out, BurnMetric.DNDWI, i, difference(composites, IndexBand.NDWI, i) * 1000);
            store(out, BurnMetric.DBAI, i, difference(composites, IndexBand.BAI, i));
            store(out, BurnMetric.DBAIMS, i, difference(composites, IndexBand.BAIMS, i) * 10);
            store(out, BurnMetric.DCSI, i, difference(composites, IndexBand.CSI, i) * 1000);
            store(out, BurnMetric.DBSI, i, difference(composites, IndexBand.BSI, i) * 1000);
            store(out, BurnMetric.DTCB, i, difference(composites, IndexBand.TCB, i) * 100);
            store(out, BurnMetric.DTCG, i, difference(composites, IndexBand.TCG, i) * 100);
            store(out, BurnMetric.DTCW, i, difference(composites, IndexBand.TCW, i) * 100);
            store(out, BurnMetric.DMSAVI, i, difference(composites, IndexBand.MSAVI, i) * 1000);
        }

        Raster.Builder<BurnMetric> builder = Raster.builder(grid, BurnMetric.class);
        for (Map.Entry<BurnMetric, float[]> e : out.entrySet()) {
            builder.band(e.getKey(), e.getValue());
        }
        logger.debug("Computed {} burn metrics for {}", out.size(), composites.getYear());
        return builder.build();
    }

    /**
     * Keeps the classifier predictors on dry land only.
     */
    public Raster<BurnMetric> predictors(Raster<BurnMetric> metrics, BooleanRaster dryLand) {
        return metrics.updateMask(dryLand).select(BurnMetric.PREDICTORS);
    }

    /**
     * RdNBR denominator: pre-fire NBR whose magnitude is below 0.001 is replaced by +0.001, then the square root of
     * the absolute value is taken.
     */
    public static double preNbr3(double preNbr) {
        double guarded = Math.abs(preNbr) < MIN_PRE_NBR ? MIN_PRE_NBR : preNbr;
        return Math.sqrt(Math.abs(guarded));
    }

    /**
     * Truncates toward zero, leaving no data and infinities untouched.
     */
    public static double truncate(double v) {
        if (!Double.isFinite(v)) {
            return v;
        }
        return v < 0 ? Math.ceil(v) : Math.floor(v);
    }

    private static double post(FireComposites c, IndexBand band, int i) {
        return c.value(FirePeriod.POST, band, i);
    }

    private static double difference(FireComposites c, IndexBand band, int i) {
        return c.value(FirePeriod.PRE, band, i) - c.value(FirePeriod.POST, band, i);
    }

    private static double store(Map<BurnMetric, float[]> out, BurnMetric metric, int i, double value) {
        double v = metric.isInteger() ? truncate(value) : value;
        float f = Double.isFinite(v) ? (float) v : Float.NaN;
        out.get(metric)[i] = f;
        return f;
    }
}
