package com.tundrafire.server.vector;

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class VectorFeature {
    public static final String LABEL = "label";
    public static final String COUNT = "count";

    private final Geometry geometry;
    private final Map<String, Object> properties;

    public VectorFeature(Geometry geometry, int pixelCount) {
        this.geometry = geometry;
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(LABEL, 1);
        props.put(COUNT, pixelCount);
        this.properties = Collections.unmodifiableMap(props);
    }

    public Geometry getGeometry() {
        return geometry;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public int getCount() {
        return (Integer) properties.get(COUNT);
    }

    @Override
    public String toString() {
        return "VectorFeature{count=" + getCount() + ", area=" + geometry.getArea() + "}";
    }
}
