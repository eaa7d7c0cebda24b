package com.fieldops.clustering.engine;

import com.fieldops.clustering.exception.ClusteringException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brings every group down to the capacity a day/team can visit.
 *
 * An overloaded group is re-partitioned into {@code ceil(size / capacity)} compact
 * sub-groups (fixed {@link #SUB_CLUSTER_TIGHTNESS}, {@link #SUB_CLUSTER_ITERATIONS}
 * rounds), the sub-groups are balanced, and any sub-group still over capacity goes
 * round again. When a re-partition cannot shrink the group at all (every point on
 * one coordinate, say) it is cut into equal chunks in bearing order instead.
 *
 * The combined output always runs through the {@link CohesionValidator}, whether
 * anything was split or not.
 */
@Slf4j
@RequiredArgsConstructor
public class OverloadSplitter {

    static final int SUB_CLUSTER_ITERATIONS = 30;
    static final double SUB_CLUSTER_TIGHTNESS = 0.8;

    private final WeightedPartitioner partitioner;
    private final ClusterBalancer balancer;
    private final CohesionValidator validator;

    public List<PointGroup> split(List<PointGroup> groups, int maxPointsPerCluster,
                                  GeoPoint homeBase, double balanceWeight) {
        if (maxPointsPerCluster < 1) {
            throw new ClusteringException("INVALID_CAPACITY",
                    "maxPointsPerCluster must be at least 1, was " + maxPointsPerCluster);
        }

        List<PointGroup> result = new ArrayList<>();
        int overloaded = 0;
        for (PointGroup group : groups) {
            if (group.isEmpty()) {
                continue;
            }
            if (group.size() <= maxPointsPerCluster) {
                result.add(group);
            } else {
                overloaded++;
                result.addAll(splitGroup(group, maxPointsPerCluster, homeBase, balanceWeight));
            }
        }

        if (overloaded > 0) {
            log.debug("Split {} overloaded groups (capacity {}) into {} groups total",
                    overloaded, maxPointsPerCluster, result.size());
        }
        return validator.validate(result, homeBase);
    }

    private List<PointGroup> splitGroup(PointGroup group, int maxPointsPerCluster,
                                        GeoPoint homeBase, double balanceWeight) {
        int subCount = (int) Math.ceil((double) group.size() / maxPointsPerCluster);
        Partition partition = partitioner.partition(group, subCount, SUB_CLUSTER_ITERATIONS, SUB_CLUSTER_TIGHTNESS);
        List<PointGroup> subGroups = balancer.balance(partition.getGroups(), maxPointsPerCluster, homeBase, balanceWeight);

        int largest = 0;
        for (PointGroup subGroup : subGroups) {
            largest = Math.max(largest, subGroup.size());
        }
        if (largest >= group.size()) {
            log.debug("Re-partition of {} points made no progress, cutting by bearing", group.size());
            return chunkByBearing(group, subCount, homeBase);
        }

        List<PointGroup> out = new ArrayList<>(subGroups.size());
        for (PointGroup subGroup : subGroups) {
            if (subGroup.isEmpty()) {
                continue;
            }
            if (subGroup.size() <= maxPointsPerCluster) {
                out.add(subGroup);
            } else {
                out.addAll(splitGroup(subGroup, maxPointsPerCluster, homeBase, balanceWeight));
            }
        }
        return out;
    }

    private static List<PointGroup> chunkByBearing(PointGroup group, int chunks, GeoPoint homeBase) {
        PointSet arena = group.getArena();
        List<Integer> ordered = new ArrayList<>(group.getMembers());
        ordered.sort(Comparator
                .comparingDouble((Integer index) -> homeBase.bearingTo(arena.get(index)))
                .thenComparingDouble(index -> homeBase.distanceTo(arena.get(index))));

        int chunkSize = (int) Math.ceil((double) ordered.size() / chunks);
        List<PointGroup> out = new ArrayList<>(chunks);
        for (int from = 0; from < ordered.size(); from += chunkSize) {
            int to = Math.min(from + chunkSize, ordered.size());
            out.add(arena.group(ordered.subList(from, to)));
        }
        return out;
    }
}
