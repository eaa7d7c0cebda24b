package com.fieldops.clustering.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds small neighbouring groups together to save visiting days.
 *
 * Walking a distance-ordered list, a group absorbs every later group that
 *   - still fits the capacity once combined,
 *   - lies within {@link #ADJACENCY_FACTOR} × the mean intra-group spacing
 *     (mean pairwise distance, averaged over the two groups) of it, and
 *   - still passes the {@link CohesionValidator} checks once combined, so a merge
 *     never rebuilds a group the validator split apart.
 * Two groups with no spacing to compare (singletons, stacked points) count as adjacent.
 */
@Slf4j
@RequiredArgsConstructor
public class AdjacentClusterMerger {

    static final double ADJACENCY_FACTOR = 2.0;

    private final CohesionValidator validator;

    public List<PointGroup> merge(List<PointGroup> ordered, int maxPointsPerCluster, GeoPoint homeBase) {
        List<PointGroup> merged = new ArrayList<>(ordered.size());
        boolean[] absorbed = new boolean[ordered.size()];

        for (int i = 0; i < ordered.size(); i++) {
            if (absorbed[i]) {
                continue;
            }
            PointGroup current = ordered.get(i);
            absorbed[i] = true;

            for (int j = i + 1; j < ordered.size(); j++) {
                if (absorbed[j]) {
                    continue;
                }
                PointGroup candidate = ordered.get(j);
                if (current.size() + candidate.size() > maxPointsPerCluster) {
                    continue;
                }

                double centroidDistance = current.getCentroid().distanceTo(candidate.getCentroid());
                double spacing = (meanPairwiseDistance(current) + meanPairwiseDistance(candidate)) / 2;
                if (spacing > 0 && centroidDistance > spacing * ADJACENCY_FACTOR) {
                    continue;
                }

                PointGroup combined = current.mergedWith(candidate);
                if (!validator.isCohesive(combined, homeBase)) {
                    continue;
                }
                current = combined;
                absorbed[j] = true;
            }
            merged.add(current);
        }

        if (merged.size() != ordered.size()) {
            log.debug("Merged {} adjacent groups into {}", ordered.size(), merged.size());
        }
        return merged;
    }

    static double meanPairwiseDistance(PointGroup group) {
        if (group.size() <= 1) {
            return 0.0;
        }
        List<GeoPoint> points = group.getPoints();
        double total = 0.0;
        int pairs = 0;
        for (int a = 0; a < points.size(); a++) {
            for (int b = a + 1; b < points.size(); b++) {
                total += points.get(a).distanceTo(points.get(b));
                pairs++;
            }
        }
        return total / pairs;
    }
}
