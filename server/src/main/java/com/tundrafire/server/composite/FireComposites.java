package com.tundrafire.server.composite;

import com.tundrafire.server.index.IndexBand;
import com.tundrafire.server.raster.DateWindow;
import com.tundrafire.server.raster.ObservationSet;
import com.tundrafire.server.raster.Raster;
import com.tundrafire.server.raster.Reducer;

/**
 * Median composites of the seasons before and after the analysis year.
 */
public final class FireComposites {

    private final int year;
    private final Raster<IndexBand> pre;
    private final Raster<IndexBand> post;

    public FireComposites(int year, Raster<IndexBand> pre, Raster<IndexBand> post) {
        if (!pre.getGrid().equals(post.getGrid())) {
            throw new IllegalArgumentException("Pre- and post-fire composites must share a grid");
        }
        this.year = year;
        this.pre = pre;
        this.post = post;
    }

    public static FireComposites forYear(int year, ObservationSet<IndexBand> observations, SeasonWindow season,
            TemporalCompositor compositor) {
        Raster<IndexBand> pre = compositor.composite(observations, IndexBand.INDICES,
                window(season, year, FirePeriod.PRE), Reducer.MEDIAN);
        Raster<IndexBand> post = compositor.composite(observations, IndexBand.INDICES,
                window(season, year, FirePeriod.POST), Reducer.MEDIAN);
        return new FireComposites(year, pre, post);
    }

    public static DateWindow window(SeasonWindow season, int year, FirePeriod period) {
        return season.forYear(year + period.getYearOffset());
    }

    public int getYear() {
        return year;
    }

    public Raster<IndexBand> get(FirePeriod period) {
        return period == FirePeriod.PRE ? pre : post;
    }

    public float value(FirePeriod period, IndexBand band, int index) {
        return get(period).value(band, index);
    }
}
