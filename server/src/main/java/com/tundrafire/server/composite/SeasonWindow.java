package com.tundrafire.server.composite;

import com.tundrafire.server.raster.DateWindow;

import java.time.MonthDay;

/**
 * Day-of-year window applied to every year of analysis, e.g. June 15 (inclusive) to September 1 (exclusive).
 */
public final class SeasonWindow {

    public static final SeasonWindow SNOW_FREE = new SeasonWindow(MonthDay.of(6, 15), MonthDay.of(9, 1));

    private final MonthDay start;
    private final MonthDay end;

    public SeasonWindow(MonthDay start, MonthDay end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Season must end after it starts: " + start + " - " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static SeasonWindow parse(String start, String end) {
        return new SeasonWindow(MonthDay.parse("--" + start), MonthDay.parse("--" + end));
    }

    public DateWindow forYear(int year) {
        return new DateWindow(start.atYear(year), end.atYear(year));
    }

    /**
     * From the start of {@code firstYear}'s season to the end of {@code lastYear}'s.
     */
    public DateWindow span(int firstYear, int lastYear) {
        return new DateWindow(start.atYear(firstYear), end.atYear(lastYear));
    }

    public MonthDay getStart() {
        return start;
    }

    public MonthDay getEnd() {
        return end;
    }
}
