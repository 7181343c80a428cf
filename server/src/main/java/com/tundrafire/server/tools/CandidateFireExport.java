package com.tundrafire.server.tools;

import com.tundrafire.server.pipeline.PipelineConfig;
import com.tundrafire.server.pipeline.PipelineResult;
import com.tundrafire.server.pipeline.RunConfiguration;
import com.tundrafire.server.service.PipelineAssembly;
import com.tundrafire.server.util.DataPathResolver;
import com.tundrafire.server.vector.ExportOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline tool running one analysis year over the default study region and exporting every tile.
 * Usage: CandidateFireExport <year> [dataDir]
 */
public class CandidateFireExport {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFireExport.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: CandidateFireExport <year> [dataDir]");
            System.exit(1);
        }

        int year;
        try {
            year = Integer.parseInt(args[0]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid year: " + args[0]);
            System.exit(1);
            return;
        }
        String dataDir = args.length > 1 ? args[1] : DataPathResolver.resolveDataDirectory();

        try {
            PipelineConfig config = PipelineConfig.load();
            PipelineAssembly assembly = PipelineAssembly.fromDataDirectory(dataDir, config);
            RunConfiguration run = RunConfiguration.defaultRegion(year, assembly.getDefaultRegion(), true);
            PipelineResult result = assembly.getPipeline().run(run);
            for (ExportOutcome outcome : result.getExports()) {
                logger.info("{}", outcome);
            }
            logger.info("Export for {} complete: {} candidate pixels in {} exports", year,
                    result.getCandidatePixelCount(), result.getExports().size());
        } catch (Exception e) {
            logger.error("Export failed", e);
            System.exit(1);
        }
    }
}
