package com.fieldops.clustering.engine;

import com.fieldops.clustering.exception.ClusteringException;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * k-means++ seeding.
 *
 * The first seed is drawn uniformly; every further seed is drawn with probability
 * proportional to the squared distance to its nearest already-chosen seed, which
 * keeps two seeds from landing in the same region and starving another one.
 *
 * The random source is supplied by the caller: a fixed-seed {@link Random} gives
 * reproducible clusters.
 */
@RequiredArgsConstructor
public class SeedSelector {

    private final Random random;

    /**
     * @param points candidate points, must hold at least {@code k} entries
     * @param k      number of seeds
     * @return {@code k} seeds, each one of {@code points}
     */
    public List<GeoPoint> select(List<GeoPoint> points, int k) {
        if (k < 1 || k > points.size()) {
            throw new ClusteringException("INVALID_SEED_COUNT",
                    "Cannot pick " + k + " seeds from " + points.size() + " points");
        }

        int n = points.size();
        List<GeoPoint> seeds = new ArrayList<>(k);
        seeds.add(points.get(random.nextInt(n)));

        double[] weights = new double[n];
        for (int i = 1; i < k; i++) {
            double total = 0.0;
            for (int j = 0; j < n; j++) {
                double nearest = Double.POSITIVE_INFINITY;
                for (GeoPoint seed : seeds) {
                    nearest = Math.min(nearest, points.get(j).distanceTo(seed));
                }
                weights[j] = nearest * nearest;
                total += weights[j];
            }

            GeoPoint picked = null;
            double remaining = random.nextDouble() * total;
            for (int j = 0; j < n; j++) {
                remaining -= weights[j];
                if (remaining <= 0) {
                    picked = points.get(j);
                    break;
                }
            }

            // rounding can leave a sliver of weight undrawn
            if (picked == null) {
                picked = points.get((int) Math.floor((double) i * n / k));
            }
            seeds.add(picked);
        }
        return seeds;
    }
}
