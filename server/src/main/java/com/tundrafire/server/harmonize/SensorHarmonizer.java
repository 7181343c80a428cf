package com.tundrafire.server.harmonize;

import com.tundrafire.server.raster.BandSchemaException;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw scenes of any supported sensor into canonical surface reflectance with defective pixels set to no
 * data.
 */
public class SensorHarmonizer {

    private static final Logger logger = LoggerFactory.getLogger(SensorHarmonizer.class);

    // Collection 2 Level-2 surface reflectance scaling
    public static final double SCALE = 0.0000275;
    public static final double OFFSET = -0.2;

    public Raster<CanonicalBand> harmonize(RawScene scene, QualityMaskPolicy policy) {
        Raster<CanonicalBand> renamed = rescale(scene);
        BooleanRaster clear = qualityMask(renamed, policy).not();
        if (logger.isDebugEnabled()) {
            logger.debug("{} {}: {} of {} pixels clear ({})", scene.getSensor(), scene.getAcquired(), clear.count(),
                    scene.getGrid().pixelCount(), policy);
        }
        return renamed.updateMask(clear);
    }

    /**
     * Renames sensor bands to canonical names and applies {@code dn * SCALE + OFFSET} to every reflective band. The QA
     * band is copied unscaled.
     */
    public Raster<CanonicalBand> rescale(RawScene scene) {
        BandLayout layout = scene.getSensor().getLayout();
        Raster.Builder<CanonicalBand> builder = Raster.builder(scene.getGrid(), CanonicalBand.class)
                .acquired(scene.getAcquired());
        for (CanonicalBand band : CanonicalBand.ALL) {
            String source = layout.sourceBand(band);
            int[] dn = scene.getBands().get(source);
            if (dn == null) {
                throw new BandSchemaException(scene + " is missing band " + source + " for " + band.getBandName());
            }
            float[] out = new float[dn.length];
            if (band == CanonicalBand.QA) {
                for (int i = 0; i < dn.length; i++) {
                    out[i] = dn[i];
                }
            } else {
                for (int i = 0; i < dn.length; i++) {
                    out[i] = (float) (dn[i] * SCALE + OFFSET);
                }
            }
            builder.band(band, out);
        }
        return builder.build();
    }

    /**
     * True where the QA band flags a defect under the given policy. Pixels whose QA is already no data are defective.
     */
    public BooleanRaster qualityMask(Raster<CanonicalBand> raster, QualityMaskPolicy policy) {
        float[] qa = raster.band(CanonicalBand.QA);
        boolean[] defective = new boolean[qa.length];
        for (int i = 0; i < qa.length; i++) {
            defective[i] = Float.isNaN(qa[i]) || policy.isDefective((int) qa[i]);
        }
        return new BooleanRaster(raster.getGrid(), defective);
    }
}
