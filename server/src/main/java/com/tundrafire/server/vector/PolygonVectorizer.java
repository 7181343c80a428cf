package com.tundrafire.server.vector;

import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.RasterGrid;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns connected regions of a candidate mask into polygons, one feature per region.
 */
public class PolygonVectorizer {

    private static final Logger logger = LoggerFactory.getLogger(PolygonVectorizer.class);

    private static final int[][] FOUR = { { 1, 0 }, { -1, 0 }, { 0, 1 }, { 0, -1 } };
    private static final int[][] EIGHT = { { 1, 0 }, { -1, 0 }, { 0, 1 }, { 0, -1 },
            { 1, 1 }, { 1, -1 }, { -1, 1 }, { -1, -1 } };

    private final double scale;
    private final boolean eightConnected;
    private final int pixelFilter;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public PolygonVectorizer(double scale, boolean eightConnected, int pixelFilter) {
        if (scale <= 0) {
            throw new IllegalArgumentException("Vectorization scale must be positive, got " + scale);
        }
        if (pixelFilter < 0) {
            throw new IllegalArgumentException("Pixel filter must not be negative, got " + pixelFilter);
        }
        this.scale = scale;
        this.eightConnected = eightConnected;
        this.pixelFilter = pixelFilter;
    }

    public double getScale() {
        return scale;
    }

    public int getPixelFilter() {
        return pixelFilter;
    }

    /**
     * Vectorizes the true pixels of the mask lying inside the region, after resampling the mask to the
     * vectorization scale. A null region means the whole grid. Only the window of the mask under the region's
     * envelope is read. Pixel counts refer to the resampled grid.
     */
    public List<VectorFeature> vectorize(BooleanRaster mask, Geometry region) {
        BooleanRaster source = mask;
        if (region != null) {
            RasterGrid window = mask.getGrid().window(region.getEnvelopeInternal());
            if (window == null) {
                return new ArrayList<>();
            }
            source = mask.crop(window);
        }
        RasterGrid grid = source.getGrid().resample(scale);
        BooleanRaster coarse = source.resampleTo(grid);
        if (region != null) {
            coarse = coarse.and(grid.rasterize(region));
        }
        return label(grid, coarse);
    }

    /**
     * Vectorizes the true pixels of the mask inside one tile cell. Only the window of the mask under the cell is
     * read, and a pixel centred on the cell's east or north edge is left to the neighbouring cell.
     */
    public List<VectorFeature> vectorizeCell(BooleanRaster mask, Envelope cell) {
        RasterGrid window = mask.getGrid().window(cell);
        if (window == null) {
            return new ArrayList<>();
        }
        BooleanRaster source = mask.crop(window);
        RasterGrid grid = window.resample(scale);
        BooleanRaster coarse = source.resampleTo(grid).and(grid.rasterizeCell(cell));
        return label(grid, coarse);
    }

    private List<VectorFeature> label(RasterGrid grid, BooleanRaster coarse) {
        int width = grid.getWidth();
        int height = grid.getHeight();
        int[][] neighbours = eightConnected ? EIGHT : FOUR;
        boolean[] visited = new boolean[grid.pixelCount()];
        List<VectorFeature> features = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int start = grid.index(col, row);
                if (visited[start] || !coarse.get(start)) {
                    continue;
                }
                List<Polygon> squares = new ArrayList<>();
                visited[start] = true;
                queue.add(new int[] { col, row });
                while (!queue.isEmpty()) {
                    int[] px = queue.poll();
                    squares.add(grid.pixelPolygon(px[0], px[1], geometryFactory));
                    for (int[] d : neighbours) {
                        int c = px[0] + d[0];
                        int r = px[1] + d[1];
                        if (c < 0 || r < 0 || c >= width || r >= height) {
                            continue;
                        }
                        int idx = grid.index(c, r);
                        if (!visited[idx] && coarse.get(idx)) {
                            visited[idx] = true;
                            queue.add(new int[] { c, r });
                        }
                    }
                }
                if (pixelFilter > 0 && squares.size() <= pixelFilter) {
                    continue;
                }
                Geometry outline = UnaryUnionOp.union(squares);
                features.add(new VectorFeature(outline, squares.size()));
            }
        }
        logger.debug("Vectorized {} regions at {}m", features.size(), scale);
        return features;
    }
}
