package com.tundrafire.server.vector;

public class ExportOutcome {
    private final String name;
    private final int featureCount;
    private final int pixelCount;
    private final String location;

    public ExportOutcome(String name, int featureCount, int pixelCount, String location) {
        this.name = name;
        this.featureCount = featureCount;
        this.pixelCount = pixelCount;
        this.location = location;
    }

    public String getName() {
        return name;
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

    @Override
    public String toString() {
        return "ExportOutcome{name='" + name + "', features=" + featureCount + ", location='" + location + "'}";
    }
}
