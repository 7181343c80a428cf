package com.tundrafire.server.service;

import com.tundrafire.db.ExportRecord;
import com.tundrafire.server.pipeline.PipelineConfig;
import com.tundrafire.server.pipeline.PipelineResult;
import com.tundrafire.server.pipeline.RunConfiguration;
import com.tundrafire.server.util.DataPathResolver;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

@Service
public class CandidateFireService {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFireService.class);

    private volatile PipelineAssembly assembly;
    private volatile boolean isReady = false;

    public boolean isReady() {
        return isReady;
    }

    @PostConstruct
    public void init() {
        new Thread(() -> {
            try {
                logger.info("Initializing Candidate Fire Service...");
                PipelineConfig config = PipelineConfig.load();
                assembly = PipelineAssembly.fromDataDirectory(DataPathResolver.resolveDataDirectory(), config);
                isReady = true;
                logger.info("Candidate Fire Service ready.");
            } catch (Exception e) {
                logger.error("Failed to initialize candidate fire pipeline", e);
            }
        }, "candidate-fire-init").start();
    }

    public Geometry getDefaultRegion() {
        requireReady();
        return assembly.getDefaultRegion();
    }

    public PipelineResult run(RunConfiguration run) {
        requireReady();
        try {
            return assembly.getPipeline().run(run);
        } catch (IOException e) {
            throw new RuntimeException("Candidate fire run failed for " + run, e);
        }
    }

    public List<ExportRecord> exportsForYear(int year) {
        requireReady();
        try {
            return assembly.getRecordDao().listByYear(year);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read export ledger for " + year, e);
        }
    }

    private void requireReady() {
        if (!isReady) {
            throw new IllegalStateException("Candidate fire service is still initializing");
        }
    }
}
