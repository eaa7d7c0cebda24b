package com.fieldops.clustering.engine;

import com.fieldops.clustering.exception.ClusteringException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * Turns an unordered set of facility locations into size-bounded, geographically
 * coherent groups, one per visiting day/team.
 *
 * Pipeline:
 *   1. k = ceil(n / capacity), raised with tightness, capped by maxClusters
 *   2. tightness-weighted k-means ({@link WeightedPartitioner}, k-means++ seeds)
 *   3. overload splitting, balancing and cohesion checks ({@link OverloadSplitter})
 *   4. ordering by centroid distance from the home base
 *   5. optional merge of small neighbouring groups ({@link AdjacentClusterMerger})
 *   6. dense ids ({@link ClusterAssembler})
 *
 * Holds no state between calls. Randomness comes only from the {@link Random}
 * passed in, so a fixed seed reproduces a result exactly.
 */
@Slf4j
public class GeoClusteringEngine {

    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private final ClusterBalancer balancer = new ClusterBalancer();
    private final CohesionValidator validator = new CohesionValidator();
    private final AdjacentClusterMerger merger = new AdjacentClusterMerger(validator);

    public ClusteringResult cluster(List<GeoPoint> points, ClusteringOptions options, Random random) {
        int capacity = options.getMaxPointsPerCluster();
        if (capacity < 1) {
            throw new ClusteringException("INVALID_CAPACITY",
                    "maxPointsPerCluster must be at least 1, was " + capacity);
        }
        GeoPoint homeBase = options.getHomeBase();
        if (homeBase == null) {
            throw new ClusteringException("MISSING_HOME_BASE", "A home base is required");
        }

        if (points.isEmpty()) {
            return ClusteringResult.empty();
        }

        PointSet arena = PointSet.of(points);
        if (arena.size() <= capacity) {
            return ClusteringResult.builder()
                    .clusters(ClusterAssembler.assemble(List.of(arena.all())))
                    .requestedK(1)
                    .iterations(0)
                    .converged(true)
                    .build();
        }

        int baseK = optimalClusterCount(arena.size(), capacity, options.getMaxClusters());
        int k = capClusterCount(adjustForTightness(baseK, options.getTightness()), options.getMaxClusters());

        WeightedPartitioner partitioner = new WeightedPartitioner(new SeedSelector(random));
        OverloadSplitter splitter = new OverloadSplitter(partitioner, balancer, validator);

        Partition partition = partitioner.partition(arena.all(), k, options.getMaxIterations(), options.getTightness());
        List<PointGroup> groups = splitter.split(partition.getGroups(), capacity, homeBase, options.getBalanceWeight());

        groups.sort(PointGroup.byDistanceFrom(homeBase));
        if (options.isMergeAdjacent()) {
            groups = merger.merge(groups, capacity, homeBase);
            groups.sort(PointGroup.byDistanceFrom(homeBase));
        }

        List<Cluster> clusters = ClusterAssembler.assemble(groups);
        log.debug("Clustered {} points into {} clusters (k={}, capacity={}, iterations={})",
                arena.size(), clusters.size(), k, capacity, partition.getIterations());

        return ClusteringResult.builder()
                .clusters(clusters)
                .requestedK(k)
                .iterations(partition.getIterations())
                .converged(partition.isConverged())
                .build();
    }

    /**
     * Fewest groups that can hold {@code pointCount} points at {@code maxPerCluster}
     * each, capped at {@code maxClusters} when given.
     */
    public static int optimalClusterCount(int pointCount, int maxPerCluster, Integer maxClusters) {
        if (pointCount <= maxPerCluster) {
            return 1;
        }
        int minClusters = (int) Math.ceil((double) pointCount / maxPerCluster);
        if (maxClusters != null && maxClusters > 0 && minClusters > maxClusters) {
            return maxClusters;
        }
        return minClusters;
    }

    /** Tighter clustering asks for more groups so distant facilities are not lumped together. */
    static int adjustForTightness(int baseK, double tightness) {
        int adjusted = (int) Math.floor(baseK * (0.5 + tightness));
        return Math.max(baseK, adjusted);
    }

    /** {@code maxClusters} bounds the final request, after the tightness adjustment. */
    static int capClusterCount(int k, Integer maxClusters) {
        if (maxClusters != null && maxClusters > 0 && k > maxClusters) {
            return maxClusters;
        }
        return k;
    }
}
