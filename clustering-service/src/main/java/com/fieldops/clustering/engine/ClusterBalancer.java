package com.fieldops.clustering.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Evens out group sizes by moving boundary points, without letting a group creep
 * past its own footprint.
 *
 * Below {@link #MIN_BALANCE_WEIGHT} geography wins and the groups are returned as
 * they are. Otherwise the groups are ordered by centroid distance from the home base
 * and each adjacent pair (current, next) is evened out: the point of {@code current}
 * nearest to {@code next}'s centroid moves across while
 *
 *   current > average size  AND  next < capacity  AND  current > next + 1
 *
 * and only if it lies within {@link #RADIUS_EXPANSION} × the 95th-percentile radius
 * of {@code next} (measured before the first move). The first point that does not
 * fit ends the pair. Points only ever move outwards, between neighbours.
 */
@Slf4j
public class ClusterBalancer {

    public static final double MIN_BALANCE_WEIGHT = 0.6;
    static final double RADIUS_EXPANSION = 1.5;
    static final double RADIUS_PERCENTILE = 0.95;

    public List<PointGroup> balance(List<PointGroup> groups, int maxPointsPerCluster,
                                    GeoPoint homeBase, double balanceWeight) {
        if (balanceWeight < MIN_BALANCE_WEIGHT || groups.size() < 2) {
            return groups;
        }

        int totalPoints = 0;
        for (PointGroup group : groups) {
            totalPoints += group.size();
        }
        double averageSize = (double) totalPoints / groups.size();

        List<PointGroup> ordered = new ArrayList<>(groups);
        ordered.sort(PointGroup.byDistanceFrom(homeBase));

        int moved = 0;
        for (int i = 0; i < ordered.size() - 1; i++) {
            PointGroup current = ordered.get(i);
            PointGroup next = ordered.get(i + 1);
            double allowedRadius = percentileRadius(next) * RADIUS_EXPANSION;

            while (current.size() > averageSize
                    && next.size() < maxPointsPerCluster
                    && current.size() > next.size() + 1) {
                int candidate = nearestTo(current, next.getCentroid());
                double distance = current.pointAt(candidate).distanceTo(next.getCentroid());
                if (distance > allowedRadius) {
                    break;
                }
                current.moveTo(candidate, next);
                moved++;
            }
        }

        log.debug("Balanced {} groups (weight={}): moved {} points", ordered.size(), balanceWeight, moved);
        return ordered;
    }

    /** 95th-percentile point-to-centroid distance; 0 for an empty group. */
    static double percentileRadius(PointGroup group) {
        if (group.isEmpty()) {
            return 0.0;
        }
        double[] distances = new double[group.size()];
        for (int position = 0; position < group.size(); position++) {
            distances[position] = group.pointAt(position).distanceTo(group.getCentroid());
        }
        Arrays.sort(distances);
        int index = Math.min((int) Math.floor(distances.length * RADIUS_PERCENTILE), distances.length - 1);
        return distances[index];
    }

    private static int nearestTo(PointGroup group, GeoPoint target) {
        int nearest = 0;
        double best = Double.POSITIVE_INFINITY;
        for (int position = 0; position < group.size(); position++) {
            double distance = group.pointAt(position).distanceTo(target);
            if (distance < best) {
                best = distance;
                nearest = position;
            }
        }
        return nearest;
    }
}
