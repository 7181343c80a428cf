package com.tundrafire.server.pipeline;

import com.tundrafire.server.classifier.ClassifierAdapter;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Burn probability palette over [0, 1], light orange to red.
 */
public final class ProbabilityColorRamp {

    public static final List<String> PALETTE = List.of(
            "#fee8c8", "#fce1bd", "#fadab2", "#f8d3a8", "#f7cc9e", "#f5c594",
            "#f4bd8a", "#f3b681", "#f2ae78", "#f0a66f", "#e55637", "#e34a33");

    private static final int[] STOPS = new int[PALETTE.size()];

    static {
        for (int i = 0; i < STOPS.length; i++) {
            STOPS[i] = Integer.parseInt(PALETTE.get(i).substring(1), 16);
        }
    }

    private ProbabilityColorRamp() {
    }

    /**
     * Opaque ARGB colour for a probability, linearly interpolated between stops; fully transparent for no data.
     */
    public static int argb(double probability) {
        if (Double.isNaN(probability)) {
            return 0;
        }
        double t = Math.max(0.0, Math.min(1.0, probability)) * (STOPS.length - 1);
        int lo = (int) Math.floor(t);
        int hi = Math.min(lo + 1, STOPS.length - 1);
        double f = t - lo;
        int rgb = 0;
        for (int shift = 16; shift >= 0; shift -= 8) {
            int a = (STOPS[lo] >> shift) & 0xff;
            int b = (STOPS[hi] >> shift) & 0xff;
            rgb |= ((int) Math.round(a + (b - a) * f)) << shift;
        }
        return 0xff000000 | rgb;
    }

    public static BufferedImage render(Raster<ClassifierAdapter.Output> probability) {
        RasterGrid grid = probability.getGrid();
        float[] p = probability.band(ClassifierAdapter.Output.PROBABILITY);
        BufferedImage image = new BufferedImage(grid.getWidth(), grid.getHeight(), BufferedImage.TYPE_INT_ARGB);
        for (int row = 0; row < grid.getHeight(); row++) {
            for (int col = 0; col < grid.getWidth(); col++) {
                image.setRGB(col, row, argb(p[grid.index(col, row)]));
            }
        }
        return image;
    }

    public static void writePng(Raster<ClassifierAdapter.Output> probability, OutputStream out) throws IOException {
        if (!ImageIO.write(render(probability), "png", out)) {
            throw new IOException("No PNG writer available");
        }
    }
}
