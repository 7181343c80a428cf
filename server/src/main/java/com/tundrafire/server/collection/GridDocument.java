package com.tundrafire.server.collection;

import com.tundrafire.server.raster.RasterGrid;

/**
 * JSON form of a {@link RasterGrid}.
 */
public class GridDocument {
    public double originX;
    public double originY;
    public double pixelSize;
    public int width;
    public int height;

    public RasterGrid toGrid() {
        return new RasterGrid(originX, originY, pixelSize, width, height);
    }
}
