package com.tundrafire.server.pipeline;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tundrafire.server.composite.SeasonWindow;
import com.tundrafire.server.fusion.DecisionThresholds;

import java.io.IOException;
import java.io.InputStream;

/**
 * Contents of {@code fire_config.json}. Missing sections keep their defaults.
 */
public class PipelineConfig {

    public static final String RESOURCE = "/fire_config.json";

    public String tundrafire_data_directory;
    public SeasonConfig season = new SeasonConfig();
    public DecisionThresholds thresholds = new DecisionThresholds();
    public VectorConfig vector = new VectorConfig();
    public GridConfig grid = new GridConfig();
    public DataFiles data = new DataFiles();

    public static class SeasonConfig {
        public String start = "06-15";
        public String end = "09-01";

        public SeasonWindow toWindow() {
            return SeasonWindow.parse(start, end);
        }
    }

    public static class VectorConfig {
        public double scale = 60;
        public int pixelFilter = 0;
        public double tileSize = 1_000_000;
        public boolean eightConnected = true;
        public String exportFolder = "tundraFire_exports";
        public int tileThreads = 4;
    }

    public static class GridConfig {
        public double pixelSize = 30;
    }

    public static class DataFiles {
        public String model = "rf_model.json";
        public String landWater = "land_water.json";
        public String defaultRoi = "default_roi.wkt";
        public String scenes = "scenes";
    }

    public static PipelineConfig load() throws IOException {
        try (InputStream is = PipelineConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                return new PipelineConfig();
            }
            return load(is);
        }
    }

    public static PipelineConfig load(InputStream json) throws IOException {
        ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        PipelineConfig config = mapper.readValue(json, PipelineConfig.class);
        if (config.season == null) {
            config.season = new SeasonConfig();
        }
        if (config.thresholds == null) {
            config.thresholds = new DecisionThresholds();
        }
        if (config.vector == null) {
            config.vector = new VectorConfig();
        }
        if (config.grid == null) {
            config.grid = new GridConfig();
        }
        if (config.data == null) {
            config.data = new DataFiles();
        }
        return config;
    }
}
