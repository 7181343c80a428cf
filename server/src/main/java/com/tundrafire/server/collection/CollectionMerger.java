package com.tundrafire.server.collection;

import com.tundrafire.server.harmonize.ArchiveSource;
import com.tundrafire.server.harmonize.CanonicalBand;
import com.tundrafire.server.harmonize.RawScene;
import com.tundrafire.server.harmonize.SensorHarmonizer;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.index.IndexEngine;
import com.tundrafire.server.raster.DateWindow;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the multi-sensor observation set: every archive generation harmonized with its own mask policy, turned into
 * feature rasters aligned to the analysis grid, and concatenated without deduplication. Scenes whose footprint misses
 * the ROI are dropped before processing.
 */
public class CollectionMerger {

    private static final Logger logger = LoggerFactory.getLogger(CollectionMerger.class);

    private final SensorHarmonizer harmonizer;
    private final IndexEngine indexEngine;

    public CollectionMerger(SensorHarmonizer harmonizer, IndexEngine indexEngine) {
        this.harmonizer = harmonizer;
        this.indexEngine = indexEngine;
    }

    public ObservationSet<IndexBand> collect(RasterArchive archive, Geometry roi, DateWindow span, RasterGrid grid)
            throws IOException {
        List<ObservationSet<IndexBand>> perSource = new ArrayList<>();
        for (ArchiveSource source : ArchiveSource.values()) {
            DateWindow window = source.restrict(span);
            if (window == null) {
                logger.debug("{} not queried for {}", source, span);
                continue;
            }
            List<RawScene> scenes = archive.scenes(source.getSensor(), roi, window);
            List<Raster<IndexBand>> features = new ArrayList<>(scenes.size());
            for (RawScene scene : scenes) {
                if (!scene.getGrid().footprint().intersects(roi)) {
                    continue;
                }
                Raster<CanonicalBand> canonical = harmonizer.harmonize(scene, source.getMaskPolicy());
                features.add(indexEngine.compute(canonical).resampleTo(grid));
            }
            logger.debug("{}: {} observations", source, features.size());
            perSource.add(ObservationSet.of(IndexBand.class, IndexBand.ALL, features));
        }
        ObservationSet<IndexBand> merged = merge(perSource);
        logger.info("Merged {} observations from {} archive sources for {}", merged.size(), perSource.size(), span);
        return merged;
    }

    public static ObservationSet<IndexBand> merge(List<ObservationSet<IndexBand>> sets) {
        ObservationSet<IndexBand> merged = ObservationSet.empty(IndexBand.class, IndexBand.ALL);
        for (ObservationSet<IndexBand> s : sets) {
            merged = merged.merge(s);
        }
        return merged;
    }
}
