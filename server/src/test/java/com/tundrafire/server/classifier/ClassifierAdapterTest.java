package com.tundrafire.server.classifier;

import com.tundrafire.server.SceneFixtures;
import com.tundrafire.server.burn.BurnMetric;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierAdapterTest {

    /** Probability proportional to dNBR2; unclamped so the adapter has to clamp. */
    static class LinearClassifier implements ProbabilityClassifier {
        @Override
        public List<String> getFeatureNames() {
            return List.of("dNBR2", "dTCG", "dTCB");
        }

        @Override
        public double probability(double[] features) {
            return features[0] / 500.0;
        }
    }

    @Test
    void testPerPixelProbability() {
        RasterGrid grid = SceneFixtures.grid(4, 1);
        Raster<BurnMetric> predictors = Raster.builder(grid, BurnMetric.class)
                .band(BurnMetric.DNBR2, new float[] { 250, 900, -100, 250 })
                .band(BurnMetric.DTCG, new float[] { 0, 0, 0, Float.NaN })
                .band(BurnMetric.DTCB, new float[] { 0, 0, 0, 0 })
                .build();

        Raster<ClassifierAdapter.Output> p = new ClassifierAdapter(new LinearClassifier()).apply(predictors);

        assertEquals(0.5f, p.value(ClassifierAdapter.Output.PROBABILITY, 0), 1e-6);
        assertEquals(1f, p.value(ClassifierAdapter.Output.PROBABILITY, 1));
        assertEquals(0f, p.value(ClassifierAdapter.Output.PROBABILITY, 2));
        assertTrue(Float.isNaN(p.value(ClassifierAdapter.Output.PROBABILITY, 3)));
    }

    @Test
    void testUnknownFeatureRejected() {
        ProbabilityClassifier odd = new ProbabilityClassifier() {
            @Override
            public List<String> getFeatureNames() {
                return List.of("elevation");
            }

            @Override
            public double probability(double[] features) {
                return 0;
            }
        };
        assertThrows(IllegalArgumentException.class, () -> new ClassifierAdapter(odd));
    }
}
