package com.tundrafire.server.harmonize;

public enum Sensor {
    LANDSAT_4("LANDSAT/LT04/C02/T1_L2", BandLayout.LEGACY),
    LANDSAT_5("LANDSAT/LT05/C02/T1_L2", BandLayout.LEGACY),
    LANDSAT_7("LANDSAT/LE07/C02/T1_L2", BandLayout.LEGACY),
    LANDSAT_8("LANDSAT/LC08/C02/T1_L2", BandLayout.NEW),
    LANDSAT_9("LANDSAT/LC09/C02/T1_L2", BandLayout.NEW);

    private final String collectionId;
    private final BandLayout layout;

    Sensor(String collectionId, BandLayout layout) {
        this.collectionId = collectionId;
        this.layout = layout;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public BandLayout getLayout() {
        return layout;
    }
}
