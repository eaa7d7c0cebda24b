package com.fieldops.clustering.engine;

import com.fieldops.clustering.exception.ClusteringException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedSelectorTest {

    @Test
    @DisplayName("Returns k seeds, each taken from the input")
    void returnsKSeedsFromInput() {
        List<GeoPoint> points = TestPoints.grid(35.0, -101.0, 4, 4, 0.1);
        List<GeoPoint> seeds = new SeedSelector(new Random(7)).select(points, 5);

        assertThat(seeds).hasSize(5);
        assertThat(points).containsAll(seeds);
    }

    @Test
    @DisplayName("Same seed → same picks")
    void fixedSeed_isReproducible() {
        List<GeoPoint> points = TestPoints.grid(35.0, -101.0, 5, 5, 0.1);
        List<GeoPoint> first  = new SeedSelector(new Random(42)).select(points, 4);
        List<GeoPoint> second = new SeedSelector(new Random(42)).select(points, 4);
        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Two distant regions each get a seed (squared-distance weighting)")
    void distantRegions_eachGetASeed() {
        List<GeoPoint> points = new ArrayList<>();
        points.addAll(TestPoints.grid("west", 35.0, -105.0, 1, 5, 0.001));
        points.addAll(TestPoints.grid("east", 35.0, -95.0, 1, 5, 0.001));

        for (long seed = 0; seed < 20; seed++) {
            List<GeoPoint> seeds = new SeedSelector(new Random(seed)).select(points, 2);
            assertThat(seeds)
                    .extracting(p -> p.getId().substring(0, 4))
                    .as("seed %d", seed)
                    .containsExactlyInAnyOrder("west", "east");
        }
    }

    @Test
    @DisplayName("Exhausted roulette draw falls back to points[floor(i*n/k)]")
    void exhaustedDraw_usesDeterministicFallback() {
        List<GeoPoint> points = List.of(
                GeoPoint.of("p0", 35.0, -101.0),
                GeoPoint.of("p1", 35.1, -101.0),
                GeoPoint.of("p2", 35.2, -101.0),
                GeoPoint.of("p3", 35.3, -101.0));

        // draws past the end of the cumulative weight on every pick
        Random overshooting = new Random() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }

            @Override
            public double nextDouble() {
                return 2.0;
            }
        };

        List<GeoPoint> seeds = new SeedSelector(overshooting).select(points, 2);
        assertThat(seeds).extracting(GeoPoint::getId).containsExactly("p0", "p2");
    }

    @Test
    @DisplayName("Identical points never fail the draw")
    void identicalPoints_stillProduceSeeds() {
        List<GeoPoint> points = List.of(GeoPoint.of(35, -101), GeoPoint.of(35, -101), GeoPoint.of(35, -101));
        List<GeoPoint> seeds = new SeedSelector(new Random(1)).select(points, 3);
        assertThat(seeds).hasSize(3);
    }

    @Test
    @DisplayName("More seeds than points is rejected")
    void tooManySeeds_rejected() {
        List<GeoPoint> points = List.of(GeoPoint.of(35, -101), GeoPoint.of(36, -101));
        assertThatThrownBy(() -> new SeedSelector(new Random(1)).select(points, 3))
                .isInstanceOf(ClusteringException.class)
                .extracting("code").isEqualTo("INVALID_SEED_COUNT");
    }
}
