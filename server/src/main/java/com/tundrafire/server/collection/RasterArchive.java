package com.tundrafire.server.collection;

import com.tundrafire.server.harmonize.RawScene;
import com.tundrafire.server.harmonize.Sensor;
import com.tundrafire.server.raster.DateWindow;
import org.locationtech.jts.geom.Geometry;

import java.io.IOException;
import java.util.List;

/**
 * Source of raw scenes for one sensor, filtered by footprint and acquisition date.
 */
public interface RasterArchive {

    List<RawScene> scenes(Sensor sensor, Geometry roi, DateWindow window) throws IOException;
}
