package com.tundrafire.server.landwater;

import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.RasterGrid;
import org.locationtech.jts.geom.Geometry;

/**
 * In-memory reference: a water max-extent raster on its own grid plus land polygons.
 * Pixels outside the water raster's coverage count as dry land.
 */
public class StaticLandWaterReference implements LandWaterReference {

    private final BooleanRaster waterMaxExtent;
    private final Geometry land;

    public StaticLandWaterReference(BooleanRaster waterMaxExtent, Geometry land) {
        this.waterMaxExtent = waterMaxExtent;
        this.land = land;
    }

    @Override
    public BooleanRaster dryLand(RasterGrid grid) {
        return waterMaxExtent.resampleTo(grid).not();
    }

    @Override
    public BooleanRaster land(RasterGrid grid) {
        return grid.rasterize(land);
    }
}
