package com.tundrafire.server.landwater;

import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.RasterGrid;

/**
 * Static land and surface water layers, sampled onto an analysis grid.
 */
public interface LandWaterReference {

    /**
     * True where the maximum historical water extent is zero, i.e. outside permanent or seasonal water.
     */
    BooleanRaster dryLand(RasterGrid grid);

    /**
     * True inside the shoreline land polygons.
     */
    BooleanRaster land(RasterGrid grid);
}
