package com.fieldops.clustering.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Clusters ordered by centroid distance from the home base, plus run statistics.
 */
@Value
@Builder
public class ClusteringResult {

    List<Cluster> clusters;

    /** Number of groups the top-level partition was asked for. */
    int requestedK;

    /** Rounds the top-level partition ran; 0 when no partitioning was needed. */
    int iterations;

    boolean converged;

    public static ClusteringResult empty() {
        return ClusteringResult.builder()
                .clusters(List.of())
                .requestedK(0)
                .iterations(0)
                .converged(true)
                .build();
    }

    public int totalPoints() {
        int total = 0;
        for (Cluster cluster : clusters) {
            total += cluster.size();
        }
        return total;
    }
}
