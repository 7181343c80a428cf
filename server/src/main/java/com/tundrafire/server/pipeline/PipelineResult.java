package com.tundrafire.server.pipeline;

import com.tundrafire.server.vector.ExportOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one run: a single area for a drawn ROI, one area per tile for the default region.
 */
public class PipelineResult {
    private final RunConfiguration run;
    private final List<AreaResult> areas;

    public PipelineResult(RunConfiguration run, List<AreaResult> areas) {
        this.run = run;
        this.areas = List.copyOf(areas);
    }

    public RunConfiguration getRun() {
        return run;
    }

    public List<AreaResult> getAreas() {
        return areas;
    }

    /**
     * The only analysed area, for runs that were not split into tiles.
     */
    public AreaResult getArea() {
        if (areas.size() != 1) {
            throw new IllegalStateException("Run covers " + areas.size() + " areas");
        }
        return areas.get(0);
    }

    public int getObservationCount() {
        int n = 0;
        for (AreaResult area : areas) {
            n += area.getObservationCount();
        }
        return n;
    }

    public int getCandidatePixelCount() {
        int n = 0;
        for (AreaResult area : areas) {
            n += area.getCandidates().count();
        }
        return n;
    }

    public List<ExportOutcome> getExports() {
        List<ExportOutcome> exports = new ArrayList<>();
        for (AreaResult area : areas) {
            if (area.getExport() != null) {
                exports.add(area.getExport());
            }
        }
        return exports;
    }
}
