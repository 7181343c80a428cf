package com.tundrafire.db;

public class ExportRecord {
    private final long id;
    private final String exportName;
    private final int analysisYear;
    private final int featureCount;
    private final int pixelCount;
    private final String location;
    private final long createdTs;

    public ExportRecord(long id, String exportName, int analysisYear, int featureCount, int pixelCount,
            String location, long createdTs) {
        this.id = id;
        this.exportName = exportName;
        this.analysisYear = analysisYear;
        this.featureCount = featureCount;
        this.pixelCount = pixelCount;
        this.location = location;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getExportName() {
        return exportName;
    }

    public int getAnalysisYear() {
        return analysisYear;
    }

    public int getFeatureCount() {
        return featureCount;
    }

    public int getPixelCount() {
        return pixelCount;
    }

    public String getLocation() {
        return location;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "ExportRecord{id=" + id + ", name='" + exportName + "', features=" + featureCount + "}";
    }
}
