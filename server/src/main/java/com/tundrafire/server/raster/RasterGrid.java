package com.tundrafire.server.raster;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.Objects;

/**
 * North-up pixel grid. Origin is the north-west corner; rows grow southwards.
 */
public final class RasterGrid {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    /**
     * Largest pixel count a single grid may hold; per-pixel bands are flat arrays.
     */
    public static final int MAX_PIXELS = Integer.MAX_VALUE - 8;

    private final double originX;
    private final double originY;
    private final double pixelSize;
    private final int width;
    private final int height;

    public RasterGrid(double originX, double originY, double pixelSize, int width, int height) {
        if (pixelSize <= 0) {
            throw new IllegalArgumentException("Pixel size must be positive");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid must have at least one pixel, got " + width + "x" + height);
        }
        if ((long) width * height > MAX_PIXELS) {
            throw new IllegalArgumentException("Grid of " + width + "x" + height + " pixels exceeds the limit of "
                    + MAX_PIXELS + "; split the region into tiles");
        }
        this.originX = originX;
        this.originY = originY;
        this.pixelSize = pixelSize;
        this.width = width;
        this.height = height;
    }

    /**
     * Smallest grid of the given pixel size, anchored at the envelope's north-west corner, that covers the envelope.
     */
    public static RasterGrid covering(Envelope envelope, double pixelSize) {
        if (pixelSize <= 0) {
            throw new IllegalArgumentException("Pixel size must be positive");
        }
        return new RasterGrid(envelope.getMinX(), envelope.getMaxY(), pixelSize,
                pixels(envelope.getWidth(), pixelSize), pixels(envelope.getHeight(), pixelSize));
    }

    private static int pixels(double extent, double pixelSize) {
        double n = Math.max(1, Math.ceil(extent / pixelSize));
        if (n > MAX_PIXELS) {
            throw new IllegalArgumentException("Extent of " + extent + " needs " + (long) n
                    + " pixels of " + pixelSize + " along one axis");
        }
        return (int) n;
    }

    public double getOriginX() {
        return originX;
    }

    public double getOriginY() {
        return originY;
    }

    public double getPixelSize() {
        return pixelSize;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int pixelCount() {
        return Math.multiplyExact(width, height);
    }

    public int index(int col, int row) {
        return row * width + col;
    }

    public double centerX(int col) {
        return originX + (col + 0.5) * pixelSize;
    }

    public double centerY(int row) {
        return originY - (row + 0.5) * pixelSize;
    }

    public Envelope envelope() {
        return new Envelope(originX, originX + width * pixelSize, originY - height * pixelSize, originY);
    }

    public Polygon footprint() {
        return (Polygon) GEOMETRY_FACTORY.toGeometry(envelope());
    }

    public Polygon pixelPolygon(int col, int row, GeometryFactory factory) {
        double x0 = originX + col * pixelSize;
        double y0 = originY - row * pixelSize;
        double x1 = x0 + pixelSize;
        double y1 = y0 - pixelSize;
        Coordinate[] ring = {
                new Coordinate(x0, y0),
                new Coordinate(x1, y0),
                new Coordinate(x1, y1),
                new Coordinate(x0, y1),
                new Coordinate(x0, y0)
        };
        return factory.createPolygon(ring);
    }

    /**
     * Returns the column containing x, or -1 when x lies outside the grid.
     */
    public int colOf(double x) {
        double c = Math.floor((x - originX) / pixelSize);
        return c < 0 || c >= width ? -1 : (int) c;
    }

    /**
     * Returns the row containing y, or -1 when y lies outside the grid.
     */
    public int rowOf(double y) {
        double r = Math.floor((originY - y) / pixelSize);
        return r < 0 || r >= height ? -1 : (int) r;
    }

    /**
     * Marks every pixel whose centre lies inside the geometry.
     */
    public BooleanRaster rasterize(Geometry geometry) {
        boolean[] inside = new boolean[pixelCount()];
        if (geometry != null && !geometry.isEmpty()) {
            PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
            Envelope bounds = geometry.getEnvelopeInternal();
            for (int row = 0; row < height; row++) {
                double y = centerY(row);
                if (y < bounds.getMinY() || y > bounds.getMaxY()) {
                    continue;
                }
                for (int col = 0; col < width; col++) {
                    double x = centerX(col);
                    if (x < bounds.getMinX() || x > bounds.getMaxX()) {
                        continue;
                    }
                    inside[index(col, row)] = prepared.covers(GEOMETRY_FACTORY.createPoint(new Coordinate(x, y)));
                }
            }
        }
        return new BooleanRaster(this, inside);
    }

    /**
     * Marks every pixel whose centre lies in the half-open cell [minX, maxX) x [minY, maxY), so a centre on an edge
     * shared by two adjacent cells belongs to exactly one of them.
     */
    public BooleanRaster rasterizeCell(Envelope cell) {
        boolean[] inside = new boolean[pixelCount()];
        for (int row = 0; row < height; row++) {
            double y = centerY(row);
            if (y < cell.getMinY() || y >= cell.getMaxY()) {
                continue;
            }
            for (int col = 0; col < width; col++) {
                double x = centerX(col);
                inside[index(col, row)] = x >= cell.getMinX() && x < cell.getMaxX();
            }
        }
        return new BooleanRaster(this, inside);
    }

    /**
     * Sub-grid on this grid's pixel lattice covering the part of the envelope that overlaps this grid, or null when
     * they do not overlap.
     */
    public RasterGrid window(Envelope envelope) {
        Envelope overlap = envelope.intersection(envelope());
        if (overlap.isNull() || overlap.getWidth() == 0 || overlap.getHeight() == 0) {
            return null;
        }
        int firstCol = (int) Math.max(0, Math.floor((overlap.getMinX() - originX) / pixelSize));
        int lastCol = (int) Math.min(width - 1, Math.ceil((overlap.getMaxX() - originX) / pixelSize) - 1);
        int firstRow = (int) Math.max(0, Math.floor((originY - overlap.getMaxY()) / pixelSize));
        int lastRow = (int) Math.min(height - 1, Math.ceil((originY - overlap.getMinY()) / pixelSize) - 1);
        return new RasterGrid(originX + firstCol * pixelSize, originY - firstRow * pixelSize, pixelSize,
                lastCol - firstCol + 1, lastRow - firstRow + 1);
    }

    /**
     * Column and row of this grid's north-west pixel within {@code parent}, which must share the pixel lattice.
     */
    int[] offsetIn(RasterGrid parent) {
        if (Double.compare(pixelSize, parent.pixelSize) != 0) {
            throw new IllegalArgumentException("Pixel size mismatch: " + this + " vs " + parent);
        }
        int col = (int) Math.round((originX - parent.originX) / pixelSize);
        int row = (int) Math.round((parent.originY - originY) / pixelSize);
        if (col < 0 || row < 0 || col + width > parent.width || row + height > parent.height) {
            throw new IllegalArgumentException(this + " is not a window of " + parent);
        }
        return new int[] { col, row };
    }

    /**
     * Grid over the same origin with a different pixel size, covering at least the same extent.
     */
    public RasterGrid resample(double newPixelSize) {
        if (newPixelSize == pixelSize) {
            return this;
        }
        int w = Math.max(1, (int) Math.ceil(width * pixelSize / newPixelSize));
        int h = Math.max(1, (int) Math.ceil(height * pixelSize / newPixelSize));
        return new RasterGrid(originX, originY, newPixelSize, w, h);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RasterGrid)) {
            return false;
        }
        RasterGrid other = (RasterGrid) o;
        return Double.compare(originX, other.originX) == 0
                && Double.compare(originY, other.originY) == 0
                && Double.compare(pixelSize, other.pixelSize) == 0
                && width == other.width
                && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originX, originY, pixelSize, width, height);
    }

    @Override
    public String toString() {
        return "RasterGrid{origin=(" + originX + ", " + originY + "), pixelSize=" + pixelSize
                + ", size=" + width + "x" + height + '}';
    }
}
