package com.tundrafire.server.index;

import com.tundrafire.server.harmonize.CanonicalBand;
import com.tundrafire.server.raster.BandSchemaException;
import com.tundrafire.server.raster.Raster;

import java.util.EnumMap;
import java.util.Map;

/**
 * Computes the feature raster of one harmonized observation.
 */
public class IndexEngine {

    /**
     * Returns the fifteen indices plus the QA band as single-precision floats. Non-finite results become no data.
     *
     * @throws BandSchemaException if the input lacks any canonical band
     */
    public Raster<IndexBand> compute(Raster<CanonicalBand> canonical) {
        if (!canonical.hasBands(CanonicalBand.ALL)) {
            throw new BandSchemaException("Index computation requires bands " + CanonicalBand.ALL + " but got "
                    + canonical.bandSet());
        }
        float[] blue = canonical.band(CanonicalBand.BLUE);
        float[] green = canonical.band(CanonicalBand.GREEN);
        float[] red = canonical.band(CanonicalBand.RED);
        float[] nir = canonical.band(CanonicalBand.NIR);
        float[] sswir = canonical.band(CanonicalBand.SSWIR);
        float[] lswir = canonical.band(CanonicalBand.LSWIR);
        int n = blue.length;

        Map<IndexBand, float[]> out = new EnumMap<>(IndexBand.class);
        for (IndexBand band : IndexBand.INDICES) {
            out.put(band, new float[n]);
        }

        Reflectance r = new Reflectance();
        for (int i = 0; i < n; i++) {
            r.blue = blue[i];
            r.green = green[i];
            r.red = red[i];
            r.nir = nir[i];
            r.sswir = sswir[i];
            r.lswir = lswir[i];
            for (IndexBand band : IndexBand.INDICES) {
                double v = band.compute(r);
                out.get(band)[i] = Double.isFinite(v) ? (float) v : Float.NaN;
            }
        }

        Raster.Builder<IndexBand> builder = Raster.builder(canonical.getGrid(), IndexBand.class)
                .acquired(canonical.getAcquired());
        for (Map.Entry<IndexBand, float[]> e : out.entrySet()) {
            builder.band(e.getKey(), e.getValue());
        }
        builder.band(IndexBand.QA, canonical.band(CanonicalBand.QA));
        return builder.build();
    }
}
