package com.fieldops.clustering.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning for one {@link GeoClusteringEngine#cluster} call.
 *
 *   maxPointsPerCluster: hard cap a day/team can visit, at least 1
 *   homeBase           : depot; reference for bearings and distance ordering
 *   tightness          : [0,1], higher gives more compact, less even groups
 *   balanceWeight      : [0,1], below 0.6 no size balancing happens at all
 *   maxClusters        : optional cap on the initial number of groups, after tightness
 *   mergeAdjacent      : fold small neighbouring groups together afterwards
 */
@Value
@Builder
public class ClusteringOptions {

    int maxPointsPerCluster;
    GeoPoint homeBase;

    @Builder.Default
    double tightness = 0.5;

    @Builder.Default
    double balanceWeight = 0.35;

    @Builder.Default
    int maxIterations = GeoClusteringEngine.DEFAULT_MAX_ITERATIONS;

    Integer maxClusters;

    boolean mergeAdjacent;
}
