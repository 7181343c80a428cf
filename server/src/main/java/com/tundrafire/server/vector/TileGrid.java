package com.tundrafire.server.vector;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Regular square cells aligned to multiples of the cell size.
 */
public final class TileGrid {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private TileGrid() {
    }

    /**
     * Cells intersecting the region, numbered row-major from the north-west corner.
     */
    public static List<Tile> cover(Geometry region, double cellSize) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive, got " + cellSize);
        }
        if (region == null || region.isEmpty()) {
            throw new IllegalArgumentException("Cannot tile an empty region");
        }
        Envelope env = region.getEnvelopeInternal();
        long firstCol = (long) Math.floor(env.getMinX() / cellSize);
        long lastCol = Math.max(firstCol, (long) Math.ceil(env.getMaxX() / cellSize) - 1);
        long topRow = Math.max((long) Math.floor(env.getMinY() / cellSize),
                (long) Math.ceil(env.getMaxY() / cellSize) - 1);
        long bottomRow = (long) Math.floor(env.getMinY() / cellSize);

        PreparedGeometry prepared = PreparedGeometryFactory.prepare(region);
        List<Tile> tiles = new ArrayList<>();
        for (long row = topRow; row >= bottomRow; row--) {
            for (long col = firstCol; col <= lastCol; col++) {
                Envelope cellEnv = new Envelope(col * cellSize, (col + 1) * cellSize,
                        row * cellSize, (row + 1) * cellSize);
                Polygon cell = (Polygon) GEOMETRY_FACTORY.toGeometry(cellEnv);
                if (prepared.intersects(cell)) {
                    tiles.add(new Tile(tiles.size(), cell));
                }
            }
        }
        return tiles;
    }
}
