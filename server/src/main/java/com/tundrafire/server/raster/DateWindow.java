package com.tundrafire.server.raster;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Half-open date interval [start, end).
 */
public final class DateWindow {

    private final LocalDate start;
    private final LocalDate end;

    public DateWindow(LocalDate start, LocalDate end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end " + end + " must be after start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && date.isBefore(end);
    }

    public boolean overlaps(DateWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public DateWindow shiftYears(int years) {
        return new DateWindow(start.plusYears(years), end.plusYears(years));
    }

    /**
     * Returns the overlap of both windows, or null if they do not overlap.
     */
    public DateWindow intersect(DateWindow other) {
        if (!overlaps(other)) {
            return null;
        }
        LocalDate s = start.isAfter(other.start) ? start : other.start;
        LocalDate e = end.isBefore(other.end) ? end : other.end;
        return new DateWindow(s, e);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DateWindow)) {
            return false;
        }
        DateWindow other = (DateWindow) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
