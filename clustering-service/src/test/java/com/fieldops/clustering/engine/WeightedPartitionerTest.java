package com.fieldops.clustering.engine;

import com.fieldops.clustering.exception.ClusteringException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightedPartitionerTest {

    private static WeightedPartitioner partitioner(long seed) {
        return new WeightedPartitioner(new SeedSelector(new Random(seed)));
    }

    @Test
    @DisplayName("Two distant blobs → one group per blob")
    void separatedBlobs_partitionCleanly() {
        List<GeoPoint> points = new ArrayList<>();
        points.addAll(TestPoints.grid("west", 35.0, -103.0, 2, 3, 0.01));
        points.addAll(TestPoints.grid("east", 35.0, -99.0, 2, 3, 0.01));
        PointSet arena = PointSet.of(points);

        Partition partition = partitioner(3).partition(arena.all(), 2, 50, 0.5);

        assertThat(partition.getGroups()).hasSize(2);
        assertThat(partition.isConverged()).isTrue();
        for (PointGroup group : partition.getGroups()) {
            assertThat(group.size()).isEqualTo(6);
            assertThat(group.getPoints())
                    .extracting(p -> p.getId().substring(0, 4))
                    .containsOnly(group.pointAt(0).getId().substring(0, 4));
        }
    }

    @Test
    @DisplayName("Every input index lands in exactly one group")
    void everyPointAssignedOnce() {
        PointSet arena = PointSet.of(TestPoints.grid(35.0, -101.0, 6, 7, 0.05));

        Partition partition = partitioner(11).partition(arena.all(), 5, 50, 0.3);

        List<Integer> assigned = partition.getGroups().stream()
                .flatMap(g -> g.getMembers().stream())
                .sorted()
                .collect(Collectors.toList());
        assertThat(assigned).isEqualTo(TestPoints.indices(0, arena.size()));
    }

    @Test
    @DisplayName("Each group's centroid is the spherical centroid of its members")
    void centroidsMatchMembers() {
        PointSet arena = PointSet.of(TestPoints.grid(35.0, -101.0, 5, 5, 0.07));

        Partition partition = partitioner(5).partition(arena.all(), 4, 50, 0.9);

        for (PointGroup group : partition.getGroups()) {
            GeoPoint expected = SphericalCentroid.of(group.getPoints());
            assertThat(group.getCentroid().getLatitude()).isCloseTo(expected.getLatitude(), within(1e-9));
            assertThat(group.getCentroid().getLongitude()).isCloseTo(expected.getLongitude(), within(1e-9));
        }
    }

    @Test
    @DisplayName("n ≤ k → one singleton per point, zero iterations")
    void fewerPointsThanGroups_singletons() {
        PointSet arena = PointSet.of(List.of(GeoPoint.of(35, -101), GeoPoint.of(36, -102)));

        Partition partition = partitioner(1).partition(arena.all(), 3, 50, 0.5);

        assertThat(partition.getIterations()).isZero();
        assertThat(partition.getGroups()).hasSize(2);
        assertThat(partition.getGroups().get(0).getCentroid().getLatitude()).isEqualTo(35.0);
        assertThat(partition.getGroups().get(1).getCentroid().getLongitude()).isEqualTo(-102.0);
    }

    @Test
    @DisplayName("Groups left empty after assignment are dropped")
    void emptyGroups_dropped() {
        // both seeds sit on the same coordinate, ties go to the first group
        PointSet arena = PointSet.of(List.of(GeoPoint.of(35, -101), GeoPoint.of(35, -101), GeoPoint.of(35, -101)));

        Partition partition = partitioner(9).partition(arena.all(), 2, 50, 0.5);

        assertThat(partition.getGroups()).hasSize(1);
        assertThat(partition.getGroups().get(0).size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Empty input → empty partition")
    void emptyInput() {
        Partition partition = partitioner(1).partition(PointSet.of(List.of()).all(), 2, 50, 0.5);
        assertThat(partition.getGroups()).isEmpty();
        assertThat(partition.getIterations()).isZero();
    }

    @Test
    @DisplayName("Same seed → same membership")
    void fixedSeed_isReproducible() {
        PointSet arena = PointSet.of(TestPoints.grid(35.0, -101.0, 6, 6, 0.04));

        List<List<Integer>> first = partitioner(42).partition(arena.all(), 4, 50, 0.5).getGroups().stream()
                .map(PointGroup::getMembers).collect(Collectors.toList());
        List<List<Integer>> second = partitioner(42).partition(arena.all(), 4, 50, 0.5).getGroups().stream()
                .map(PointGroup::getMembers).collect(Collectors.toList());

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Iteration cap is honoured")
    void iterationCap() {
        PointSet arena = PointSet.of(TestPoints.grid(35.0, -101.0, 8, 8, 0.03));
        Partition partition = partitioner(2).partition(arena.all(), 6, 1, 0.5);
        assertThat(partition.getIterations()).isEqualTo(1);
    }

    @Test
    @DisplayName("k < 1 and maxIterations < 1 are rejected")
    void invalidArguments() {
        PointGroup all = PointSet.of(TestPoints.grid(35.0, -101.0, 2, 2, 0.1)).all();

        assertThatThrownBy(() -> partitioner(1).partition(all, 0, 50, 0.5))
                .isInstanceOf(ClusteringException.class)
                .extracting("code").isEqualTo("INVALID_CLUSTER_COUNT");
        assertThatThrownBy(() -> partitioner(1).partition(all, 2, 0, 0.5))
                .isInstanceOf(ClusteringException.class)
                .extracting("code").isEqualTo("INVALID_ITERATIONS");
    }
}
