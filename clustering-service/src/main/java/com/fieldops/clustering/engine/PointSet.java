package com.fieldops.clustering.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Canonical store of the points of one clustering run. Working clusters refer to
 * points by index into this set, so splitting and moving never copies or aliases
 * the caller's list.
 */
public final class PointSet {

    private final List<GeoPoint> points;

    private PointSet(List<GeoPoint> points) {
        this.points = List.copyOf(points);
    }

    public static PointSet of(List<GeoPoint> points) {
        return new PointSet(points);
    }

    public GeoPoint get(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }

    /** One group holding every point, in input order. */
    public PointGroup all() {
        List<Integer> indices = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            indices.add(i);
        }
        return PointGroup.of(this, indices);
    }

    public PointGroup group(Collection<Integer> indices) {
        return PointGroup.of(this, new ArrayList<>(indices));
    }
}
