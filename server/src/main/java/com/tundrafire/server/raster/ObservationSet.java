package com.tundrafire.server.raster;

import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable time-ordered set of rasters sharing one band schema. Every transform returns a new set.
 */
public final class ObservationSet<B extends Enum<B>> {

    private static final Comparator<Raster<?>> BY_DATE = Comparator.comparing(Raster::getAcquired,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Class<B> bandType;
    private final EnumSet<B> schema;
    private final List<Raster<B>> observations;

    private ObservationSet(Class<B> bandType, EnumSet<B> schema, List<Raster<B>> observations) {
        this.bandType = bandType;
        this.schema = schema;
        this.observations = observations;
    }

    public static <B extends Enum<B>> ObservationSet<B> of(Class<B> bandType, Set<B> schema,
            List<Raster<B>> observations) {
        EnumSet<B> s = schema.isEmpty() ? EnumSet.noneOf(bandType) : EnumSet.copyOf(schema);
        for (Raster<B> r : observations) {
            if (!r.hasBands(s)) {
                throw new BandSchemaException("Observation " + r + " lacks schema bands " + s);
            }
        }
        List<Raster<B>> sorted = new ArrayList<>(observations);
        sorted.sort(BY_DATE);
        return new ObservationSet<>(bandType, s, Collections.unmodifiableList(sorted));
    }

    public static <B extends Enum<B>> ObservationSet<B> empty(Class<B> bandType, Set<B> schema) {
        return of(bandType, schema, List.of());
    }

    public Class<B> getBandType() {
        return bandType;
    }

    public Set<B> getSchema() {
        return EnumSet.copyOf(schema);
    }

    public List<Raster<B>> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public ObservationSet<B> filter(Predicate<Raster<B>> predicate) {
        List<Raster<B>> kept = new ArrayList<>();
        for (Raster<B> r : observations) {
            if (predicate.test(r)) {
                kept.add(r);
            }
        }
        return new ObservationSet<>(bandType, schema, Collections.unmodifiableList(kept));
    }

    public ObservationSet<B> filterDate(DateWindow window) {
        return filter(r -> window.contains(r.getAcquired()));
    }

    /**
     * Keeps observations whose footprint intersects the geometry.
     */
    public ObservationSet<B> filterBounds(Geometry roi) {
        return filter(r -> r.getGrid().footprint().intersects(roi));
    }

    /**
     * Concatenation without deduplication.
     */
    public ObservationSet<B> merge(ObservationSet<B> other) {
        if (!schema.equals(other.schema)) {
            throw new BandSchemaException("Cannot merge schema " + schema + " with " + other.schema);
        }
        List<Raster<B>> all = new ArrayList<>(observations);
        all.addAll(other.observations);
        all.sort(BY_DATE);
        return new ObservationSet<>(bandType, schema, Collections.unmodifiableList(all));
    }

    public <C extends Enum<C>> ObservationSet<C> map(Class<C> targetType, Set<C> targetSchema,
            Function<Raster<B>, Raster<C>> fn) {
        List<Raster<C>> mapped = new ArrayList<>(observations.size());
        for (Raster<B> r : observations) {
            mapped.add(fn.apply(r));
        }
        return of(targetType, targetSchema, mapped);
    }

    public ObservationSet<B> map(Function<Raster<B>, Raster<B>> fn) {
        return map(bandType, schema, fn);
    }

    @Override
    public String toString() {
        return "ObservationSet{size=" + observations.size() + ", schema=" + schema + '}';
    }
}
