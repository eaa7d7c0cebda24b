package com.fieldops.clustering.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Final id assignment: drops empty groups and numbers the rest 0..N-1 in list order.
 */
public final class ClusterAssembler {

    private ClusterAssembler() {}

    public static List<Cluster> assemble(List<PointGroup> groups) {
        List<Cluster> clusters = new ArrayList<>(groups.size());
        for (PointGroup group : groups) {
            if (group.isEmpty()) {
                continue;
            }
            clusters.add(new Cluster(clusters.size(), group.getCentroid(), group.getPoints()));
        }
        return clusters;
    }
}
