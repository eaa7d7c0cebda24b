package com.fieldops.clustering.service;

import com.fieldops.clustering.config.ClusteringProperties;
import com.fieldops.clustering.engine.ClusteringOptions;
import com.fieldops.clustering.engine.GeoClusteringEngine;
import com.fieldops.clustering.exception.ClusteringException;
import com.fieldops.clustering.metrics.ClusteringMetrics;
import com.fieldops.clustering.model.ClusterRequest;
import com.fieldops.clustering.model.ClusterResponse;
import com.fieldops.clustering.model.ClusterView;
import com.fieldops.clustering.model.FacilityLocation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the real engine behind the service; metrics go to an in-memory registry.
 */
class FacilityClusteringServiceTest {

    private SimpleMeterRegistry registry;
    private ClusteringProperties properties;
    private FacilityClusteringService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new ClusteringProperties();
        service = new FacilityClusteringService(new GeoClusteringEngine(), properties, new ClusteringMetrics(registry));
    }

    private static List<FacilityLocation> wellPads(int count) {
        List<FacilityLocation> pads = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            pads.add(new FacilityLocation("pad-" + i, 31.5 + (i % 6) * 0.12, -102.6 + (i / 6) * 0.15));
        }
        return pads;
    }

    private static ClusterRequest request(int facilities, int capacity) {
        ClusterRequest request = new ClusterRequest();
        request.setFacilities(wellPads(facilities));
        request.setMaxFacilitiesPerCluster(capacity);
        request.setHomeBase(new FacilityLocation(null, 31.9973, -102.0779));
        request.setSeed(42L);
        return request;
    }

    // ─── Option resolution ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Unset knobs fall back to configured defaults")
    void toOptions_usesDefaults() {
        properties.setDefaultTightness(0.7);
        properties.setDefaultBalanceWeight(0.65);
        properties.setMaxIterations(20);
        properties.setMergeAdjacent(true);
        ClusterRequest request = request(5, 3);
        request.setHomeBase(null);

        ClusteringOptions options = service.toOptions(request);

        assertThat(options.getTightness()).isEqualTo(0.7);
        assertThat(options.getBalanceWeight()).isEqualTo(0.65);
        assertThat(options.getMaxIterations()).isEqualTo(20);
        assertThat(options.isMergeAdjacent()).isTrue();
        assertThat(options.getHomeBase().getLatitude()).isEqualTo(39.8283);
        assertThat(options.getHomeBase().getLongitude()).isEqualTo(-98.5795);
    }

    @Test
    @DisplayName("Request values override configured defaults")
    void toOptions_requestWins() {
        ClusterRequest request = request(5, 3);
        request.setTightness(0.1);
        request.setBalanceWeight(0.9);
        request.setMaxClusters(4);
        request.setMergeAdjacent(false);
        properties.setMergeAdjacent(true);

        ClusteringOptions options = service.toOptions(request);

        assertThat(options.getTightness()).isEqualTo(0.1);
        assertThat(options.getBalanceWeight()).isEqualTo(0.9);
        assertThat(options.getMaxClusters()).isEqualTo(4);
        assertThat(options.isMergeAdjacent()).isFalse();
        assertThat(options.getHomeBase().getLatitude()).isEqualTo(31.9973);
    }

    // ─── Clustering ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("36 pads at capacity 8 → every pad placed once, no cluster over 8")
    void cluster_respectsCapacity() {
        ClusterResponse response = service.cluster(request(36, 8));

        assertThat(response.getTotalFacilities()).isEqualTo(36);
        assertThat(response.getClusterCount()).isEqualTo(response.getClusters().size());
        assertThat(response.getClusters()).allSatisfy(view -> {
            assertThat(view.getSize()).isBetween(1, 8);
            assertThat(view.getFacilities()).hasSize(view.getSize());
            assertThat(view.getCentroidCell()).isNotBlank();
        });
        List<String> ids = new ArrayList<>();
        for (ClusterView view : response.getClusters()) {
            for (FacilityLocation facility : view.getFacilities()) {
                ids.add(facility.getId());
            }
        }
        assertThat(ids).doesNotHaveDuplicates().hasSize(36);
    }

    @Test
    @DisplayName("Same request seed → same clusters")
    void cluster_seedIsReproducible() {
        ClusterResponse first = service.cluster(request(30, 7));
        ClusterResponse second = service.cluster(request(30, 7));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Cluster ids are 0..N-1 in response order")
    void cluster_denseIds() {
        ClusterResponse response = service.cluster(request(24, 5));

        for (int i = 0; i < response.getClusters().size(); i++) {
            assertThat(response.getClusters().get(i).getId()).isEqualTo(i);
        }
    }

    // ─── Metrics ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Success → success counter, clusters produced, one timer sample")
    void metrics_success() {
        ClusterResponse response = service.cluster(request(20, 6));

        assertThat(registry.get("clustering.requests").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("clustering.clusters.produced").counter().count())
                .isEqualTo((double) response.getClusterCount());
        assertThat(registry.get("clustering.latency").timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Engine rejection → ClusteringException propagates, rejected counter incremented")
    void metrics_rejected() {
        ClusterRequest request = request(5, 0);

        assertThatThrownBy(() -> service.cluster(request))
                .isInstanceOf(ClusteringException.class)
                .extracting("code").isEqualTo("INVALID_CAPACITY");
        assertThat(registry.get("clustering.requests").tag("outcome", "rejected").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("clustering.requests").tag("outcome", "success").counter().count()).isZero();
    }
}
