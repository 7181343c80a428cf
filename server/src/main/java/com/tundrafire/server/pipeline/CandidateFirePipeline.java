package com.tundrafire.server.pipeline;

import com.tundrafire.server.burn.BurnMetric;
import com.tundrafire.server.burn.BurnMetricCalculator;
import com.tundrafire.server.classifier.ClassifierAdapter;
import com.tundrafire.server.classifier.ProbabilityClassifier;
import com.tundrafire.server.collection.CollectionMerger;
import com.tundrafire.server.collection.RasterArchive;
import com.tundrafire.server.composite.FireComposites;
import com.tundrafire.server.composite.SeasonWindow;
import com.tundrafire.server.composite.TemporalCompositor;
import com.tundrafire.server.deviation.DeviationDetector;
import com.tundrafire.server.deviation.DeviationResult;
import com.tundrafire.server.fusion.DecisionRasters;
import com.tundrafire.server.fusion.RuleFusion;
import com.tundrafire.server.harmonize.SensorHarmonizer;
import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.index.IndexEngine;
import com.tundrafire.server.landwater.LandWaterReference;
import com.tundrafire.server.raster.BooleanRaster;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.RasterGrid;
import com.tundrafire.server.vector.ExportNaming;
import com.tundrafire.server.vector.ExportSink;
import com.tundrafire.server.vector.PolygonVectorizer;
import com.tundrafire.server.vector.Tile;
import com.tundrafire.server.vector.TileGrid;
import com.tundrafire.server.vector.TiledExporter;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs one analysis year end to end: collection, composites, burn metrics, burn probability, deviation rules,
 * fusion and optional export.
 */
public class CandidateFirePipeline {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFirePipeline.class);

    private final RasterArchive archive;
    private final ClassifierAdapter classifier;
    private final LandWaterReference landWater;
    private final PipelineConfig config;
    private final ExportSink sink;
    private final ComputeBackend backend;

    private final CollectionMerger merger = new CollectionMerger(new SensorHarmonizer(), new IndexEngine());
    private final BurnMetricCalculator burnCalculator = new BurnMetricCalculator();
    private final RuleFusion fusion;
    private final SeasonWindow season;

    public CandidateFirePipeline(RasterArchive archive, ProbabilityClassifier classifier,
            LandWaterReference landWater, PipelineConfig config, ExportSink sink) {
        this(archive, classifier, landWater, config, sink, new ExecutorComputeBackend(config.vector.tileThreads));
    }

    public CandidateFirePipeline(RasterArchive archive, ProbabilityClassifier classifier,
            LandWaterReference landWater, PipelineConfig config, ExportSink sink, ComputeBackend backend) {
        this.archive = archive;
        this.classifier = new ClassifierAdapter(classifier);
        this.landWater = landWater;
        this.config = config;
        this.sink = sink;
        this.backend = backend;
        this.fusion = new RuleFusion(config.thresholds);
        this.season = config.season.toWindow();
    }

    /**
     * A drawn ROI is analysed and exported as one area. The default region is split into tiles and each tile is
     * analysed and exported on its own grid, so no single grid spans the whole region.
     */
    public PipelineResult run(RunConfiguration run) throws IOException {
        int year = run.getYear();
        logger.info("Starting candidate fire run {}", run);
        PipelineConfig.VectorConfig vc = config.vector;
        TiledExporter exporter = new TiledExporter(
                new PolygonVectorizer(vc.scale, vc.eightConnected, vc.pixelFilter), sink);

        List<AreaResult> areas;
        if (run.getMode() == RoiMode.DRAWN_POLYGON) {
            AreaResult area = analyse(year, ExportNaming.DRAWN_ROI_ID, run.getRoi());
            if (run.isExportEnabled()) {
                area = area.withExport(exporter.exportRegion(year, area.getCandidates(), run.getRoi(),
                        ExportNaming.DRAWN_ROI_ID));
            }
            areas = List.of(area);
        } else {
            List<Tile> tiles = TileGrid.cover(run.getRoi(), vc.tileSize);
            logger.info("Default region split into {} tiles of {}", tiles.size(), vc.tileSize);
            areas = backend.evaluate(tiles, tile -> {
                AreaResult area = analyse(year, tile.getId(), tile.getCell().intersection(run.getRoi()));
                if (run.isExportEnabled()) {
                    area = area.withExport(exporter.exportTile(year, area.getCandidates(), tile));
                }
                return area;
            });
        }

        PipelineResult result = new PipelineResult(run, areas);
        logger.info("Run {} finished: {} candidate pixels in {} areas, {} exports", year,
                result.getCandidatePixelCount(), areas.size(), result.getExports().size());
        return result;
    }

    AreaResult analyse(int year, String regionId, Geometry region) throws IOException {
        RasterGrid grid = RasterGrid.covering(region.getEnvelopeInternal(), config.grid.pixelSize);
        logger.debug("Analysing {} on {}", regionId, grid);

        BooleanRaster roiMask = grid.rasterize(region);
        BooleanRaster dryLand = landWater.dryLand(grid);
        BooleanRaster land = landWater.land(grid);
        TemporalCompositor compositor = new TemporalCompositor(grid, roiMask);

        ObservationSet<IndexBand> observations = merger.collect(archive, region,
                season.span(year - 3, year + 1), grid);
        logger.info("Collected {} observations for {} in {}", observations.size(), regionId, year);

        FireComposites composites = FireComposites.forYear(year, observations, season, compositor);
        Raster<BurnMetric> metrics = burnCalculator.calculate(composites);
        Raster<ClassifierAdapter.Output> probability = classifier.apply(
                burnCalculator.predictors(metrics, dryLand)).updateMask(land);

        DeviationDetector detector = new DeviationDetector(compositor, season);
        DeviationResult deviation = detector.detect(observations, year, land.and(dryLand));

        DecisionRasters decisions = fusion.decide(probability, deviation);
        BooleanRaster candidates = fusion.fuse(decisions, land, dryLand);
        return new AreaResult(regionId, grid, observations.size(), metrics, probability, deviation, decisions,
                candidates, null);
    }
}
