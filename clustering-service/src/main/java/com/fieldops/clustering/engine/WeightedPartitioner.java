package com.fieldops.clustering.engine;

import com.fieldops.clustering.exception.ClusteringException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Tightness-weighted k-means over a group of points.
 *
 * Assignment score:  score = distance(point, centroid) ^ (1 + 4 * tightness)
 *
 *   tightness 0 → exponent 1, plain nearest-centroid
 *   tightness 1 → exponent 5, far points are penalised hard and groups stay compact
 *                 at the price of uneven sizes
 *
 * The loop stops once no centroid moves more than {@link #CONVERGENCE_MILES}, or
 * after {@code maxIterations} rounds, returning whatever state was reached.
 */
@Slf4j
@RequiredArgsConstructor
public class WeightedPartitioner {

    public static final double CONVERGENCE_MILES = 0.001;

    private final SeedSelector seedSelector;

    public Partition partition(PointGroup source, int k, int maxIterations, double tightness) {
        if (k < 1) {
            throw new ClusteringException("INVALID_CLUSTER_COUNT", "k must be at least 1, was " + k);
        }
        if (maxIterations < 1) {
            throw new ClusteringException("INVALID_ITERATIONS",
                    "maxIterations must be at least 1, was " + maxIterations);
        }

        PointSet arena = source.getArena();
        List<Integer> members = source.getMembers();
        if (members.isEmpty()) {
            return new Partition(List.of(), 0, true);
        }
        if (members.size() <= k) {
            List<PointGroup> singletons = new ArrayList<>(members.size());
            for (int index : members) {
                singletons.add(PointGroup.singleton(arena, index));
            }
            return new Partition(singletons, 0, true);
        }

        List<PointGroup> groups = new ArrayList<>(k);
        for (GeoPoint seed : seedSelector.select(source.getPoints(), k)) {
            groups.add(PointGroup.seeded(arena, seed));
        }

        double exponent = 1 + 4 * tightness;
        int iterations = 0;
        boolean converged = false;

        while (iterations < maxIterations && !converged) {
            iterations++;
            groups.forEach(PointGroup::clear);

            for (int index : members) {
                GeoPoint point = arena.get(index);
                int best = 0;
                double bestScore = Double.POSITIVE_INFINITY;
                for (int c = 0; c < groups.size(); c++) {
                    double score = Math.pow(point.distanceTo(groups.get(c).getCentroid()), exponent);
                    if (score < bestScore) {
                        bestScore = score;
                        best = c;
                    }
                }
                groups.get(best).add(index);
            }

            converged = true;
            for (PointGroup group : groups) {
                if (group.isEmpty()) {
                    continue;
                }
                GeoPoint previous = group.getCentroid();
                GeoPoint updated = group.recomputeCentroid();
                if (previous.distanceTo(updated) > CONVERGENCE_MILES) {
                    converged = false;
                }
            }
        }

        List<PointGroup> nonEmpty = new ArrayList<>(groups.size());
        for (PointGroup group : groups) {
            if (!group.isEmpty()) {
                nonEmpty.add(group);
            }
        }

        log.debug("Partitioned {} points into {} of {} groups after {} iterations (converged={})",
                members.size(), nonEmpty.size(), k, iterations, converged);
        return new Partition(nonEmpty, iterations, converged);
    }
}
