package com.fieldops.clustering.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the Clustering Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   clustering_requests_total{outcome="success|rejected"}
 *   clustering_clusters_produced_total
 *   clustering_facilities_per_request        : request size distribution
 *   clustering_latency_seconds{quantile="0.5|0.95|0.99"}
 */
@Component
public class ClusteringMetrics {

    private final Counter successCounter;
    private final Counter rejectedCounter;
    private final Counter clustersProduced;
    private final DistributionSummary facilitiesPerRequest;
    private final Timer   clusteringTimer;

    public ClusteringMetrics(MeterRegistry registry) {
        this.successCounter = Counter.builder("clustering.requests")
                .tag("outcome", "success")
                .description("Clustering requests completed")
                .register(registry);

        this.rejectedCounter = Counter.builder("clustering.requests")
                .tag("outcome", "rejected")
                .description("Clustering requests rejected as caller errors")
                .register(registry);

        this.clustersProduced = Counter.builder("clustering.clusters.produced")
                .description("Total clusters handed to route sequencing")
                .register(registry);

        this.facilitiesPerRequest = DistributionSummary.builder("clustering.facilities.per_request")
                .description("Number of facilities in a clustering request")
                .register(registry);

        this.clusteringTimer = Timer.builder("clustering.latency")
                .description("Time spent in the clustering engine per request")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(registry);
    }

    public void recordSuccess(int facilities, int clusters) {
        successCounter.increment();
        facilitiesPerRequest.record(facilities);
        clustersProduced.increment(clusters);
    }

    public void recordRejected()        { rejectedCounter.increment(); }
    public Timer getClusteringTimer()   { return clusteringTimer; }
}
