package com.fieldops.clustering.engine;

import lombok.Value;

import java.util.List;

/**
 * One group of facilities handed to route sequencing. Ids are dense per result
 * ({@code 0..N-1}) and mean nothing across calls.
 */
@Value
public class Cluster {

    int id;
    GeoPoint centroid;
    List<GeoPoint> points;

    public Cluster(int id, GeoPoint centroid, List<GeoPoint> points) {
        this.id = id;
        this.centroid = centroid;
        this.points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }
}
