package com.tundrafire.server.harmonize;

import com.tundrafire.server.raster.DateWindow;

import java.time.LocalDate;

/**
 * The archive generations merged into one observation set, in merge order. Landsat 7 is split at the scan line
 * corrector failure of 2003-06-01.
 */
public enum ArchiveSource {
    LANDSAT_9(Sensor.LANDSAT_9, null, QualityMaskPolicy.STANDARD),
    LANDSAT_8(Sensor.LANDSAT_8, null, QualityMaskPolicy.STANDARD),
    LANDSAT_7_SLC_OFF(Sensor.LANDSAT_7,
            new DateWindow(LocalDate.of(2003, 6, 1), LocalDate.of(2033, 1, 1)), QualityMaskPolicy.DEGRADED),
    LANDSAT_7_SLC_ON(Sensor.LANDSAT_7,
            new DateWindow(LocalDate.of(1999, 1, 1), LocalDate.of(2003, 6, 1)), QualityMaskPolicy.STANDARD),
    LANDSAT_5(Sensor.LANDSAT_5, null, QualityMaskPolicy.STANDARD),
    LANDSAT_4(Sensor.LANDSAT_4, null, QualityMaskPolicy.STANDARD);

    private final Sensor sensor;
    private final DateWindow availability;
    private final QualityMaskPolicy maskPolicy;

    ArchiveSource(Sensor sensor, DateWindow availability, QualityMaskPolicy maskPolicy) {
        this.sensor = sensor;
        this.availability = availability;
        this.maskPolicy = maskPolicy;
    }

    public Sensor getSensor() {
        return sensor;
    }

    public QualityMaskPolicy getMaskPolicy() {
        return maskPolicy;
    }

    /**
     * The part of the requested window this source is queried for, or null when it is not queried at all.
     */
    public DateWindow restrict(DateWindow requested) {
        return availability == null ? requested : availability.intersect(requested);
    }
}
