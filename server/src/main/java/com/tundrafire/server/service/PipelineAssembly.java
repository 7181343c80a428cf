package com.tundrafire.server.service;

import com.tundrafire.db.ExportRecordDao;
import com.tundrafire.db.SqliteInitializer;
import com.tundrafire.server.classifier.RandomForestClassifier;
import com.tundrafire.server.collection.JsonSceneArchive;
import com.tundrafire.server.landwater.LandWaterLoader;
import com.tundrafire.server.landwater.LandWaterReference;
import com.tundrafire.server.pipeline.CandidateFirePipeline;
import com.tundrafire.server.pipeline.PipelineConfig;
import com.tundrafire.server.vector.ExportSink;
import com.tundrafire.server.vector.GeoJsonExportSink;
import com.tundrafire.server.vector.RecordingExportSink;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;

/**
 * Builds a pipeline from the files in a data directory.
 */
public class PipelineAssembly {

    private static final Logger logger = LoggerFactory.getLogger(PipelineAssembly.class);

    private final CandidateFirePipeline pipeline;
    private final Geometry defaultRegion;
    private final ExportRecordDao recordDao;

    private PipelineAssembly(CandidateFirePipeline pipeline, Geometry defaultRegion, ExportRecordDao recordDao) {
        this.pipeline = pipeline;
        this.defaultRegion = defaultRegion;
        this.recordDao = recordDao;
    }

    public static PipelineAssembly fromDataDirectory(String dataDir, PipelineConfig config) throws IOException {
        Path root = Paths.get(dataDir);
        logger.info("Assembling pipeline from data directory {}", root.toAbsolutePath());

        RandomForestClassifier forest;
        try (InputStream in = Files.newInputStream(root.resolve(config.data.model))) {
            forest = RandomForestClassifier.load(in);
        }
        LandWaterReference landWater;
        try (InputStream in = Files.newInputStream(root.resolve(config.data.landWater))) {
            landWater = new LandWaterLoader().load(in);
        }
        Geometry region = readWkt(root.resolve(config.data.defaultRoi));
        JsonSceneArchive archive = new JsonSceneArchive(root.resolve(config.data.scenes));

        String dbPath = root.resolve("tundrafire_exports.db").toString();
        try {
            SqliteInitializer.initialize(dbPath);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize export ledger at " + dbPath, e);
        }
        ExportRecordDao dao = new ExportRecordDao(dbPath);
        ExportSink sink = new RecordingExportSink(
                new GeoJsonExportSink(root.resolve(config.vector.exportFolder)), dao);

        return new PipelineAssembly(new CandidateFirePipeline(archive, forest, landWater, config, sink), region,
                dao);
    }

    static Geometry readWkt(Path file) throws IOException {
        String wkt = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
        try {
            return new WKTReader().read(wkt);
        } catch (ParseException e) {
            throw new IOException("Invalid WKT in " + file + ": " + e.getMessage(), e);
        }
    }

    public CandidateFirePipeline getPipeline() {
        return pipeline;
    }

    public Geometry getDefaultRegion() {
        return defaultRegion;
    }

    public ExportRecordDao getRecordDao() {
        return recordDao;
    }
}
