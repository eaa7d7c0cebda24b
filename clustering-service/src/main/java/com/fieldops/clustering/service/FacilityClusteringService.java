package com.fieldops.clustering.service;

import com.fieldops.clustering.config.ClusteringProperties;
import com.fieldops.clustering.engine.Cluster;
import com.fieldops.clustering.engine.ClusteringOptions;
import com.fieldops.clustering.engine.ClusteringResult;
import com.fieldops.clustering.engine.GeoClusteringEngine;
import com.fieldops.clustering.engine.GeoPoint;
import com.fieldops.clustering.exception.ClusteringException;
import com.fieldops.clustering.metrics.ClusteringMetrics;
import com.fieldops.clustering.model.ClusterRequest;
import com.fieldops.clustering.model.ClusterResponse;
import com.fieldops.clustering.model.ClusterView;
import com.fieldops.clustering.model.FacilityLocation;
import com.fieldops.shared.util.H3Util;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Maps clustering requests onto the engine, fills unset knobs from configuration
 * and records metrics. The engine call itself is synchronous and CPU-bound.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FacilityClusteringService {

    private final GeoClusteringEngine engine;
    private final ClusteringProperties properties;
    private final ClusteringMetrics metrics;

    public ClusterResponse cluster(ClusterRequest request) {
        List<GeoPoint> points = toPoints(request.getFacilities());
        ClusteringOptions options = toOptions(request);
        Random random = randomFor(request);

        ClusteringResult result;
        try {
            result = metrics.getClusteringTimer().record(() -> engine.cluster(points, options, random));
        } catch (ClusteringException e) {
            metrics.recordRejected();
            throw e;
        }

        metrics.recordSuccess(points.size(), result.getClusters().size());
        log.info("Clustered facilities={} capacity={} -> clusters={} k={} iterations={} converged={}",
                points.size(), options.getMaxPointsPerCluster(), result.getClusters().size(),
                result.getRequestedK(), result.getIterations(), result.isConverged());

        return toResponse(result);
    }

    ClusteringOptions toOptions(ClusterRequest request) {
        if (request.getMaxFacilitiesPerCluster() == null) {
            throw new ClusteringException("INVALID_CAPACITY", "maxFacilitiesPerCluster is required");
        }
        return ClusteringOptions.builder()
                .maxPointsPerCluster(request.getMaxFacilitiesPerCluster())
                .homeBase(homeBaseFor(request))
                .tightness(request.getTightness() != null
                        ? request.getTightness() : properties.getDefaultTightness())
                .balanceWeight(request.getBalanceWeight() != null
                        ? request.getBalanceWeight() : properties.getDefaultBalanceWeight())
                .maxIterations(properties.getMaxIterations())
                .maxClusters(request.getMaxClusters())
                .mergeAdjacent(request.getMergeAdjacent() != null
                        ? request.getMergeAdjacent() : properties.isMergeAdjacent())
                .build();
    }

    private GeoPoint homeBaseFor(ClusterRequest request) {
        FacilityLocation homeBase = request.getHomeBase();
        if (homeBase != null) {
            return GeoPoint.of(homeBase.getLatitude(), homeBase.getLongitude());
        }
        ClusteringProperties.HomeBase fallback = properties.getDefaultHomeBase();
        return GeoPoint.of(fallback.getLatitude(), fallback.getLongitude());
    }

    private Random randomFor(ClusterRequest request) {
        if (request.getSeed() != null) {
            return new Random(request.getSeed());
        }
        if (properties.getRandomSeed() != null) {
            return new Random(properties.getRandomSeed());
        }
        return new Random();
    }

    private static List<GeoPoint> toPoints(List<FacilityLocation> facilities) {
        List<GeoPoint> points = new ArrayList<>(facilities.size());
        for (FacilityLocation facility : facilities) {
            points.add(GeoPoint.of(facility.getId(), facility.getLatitude(), facility.getLongitude()));
        }
        return points;
    }

    private static ClusterResponse toResponse(ClusteringResult result) {
        List<ClusterView> views = new ArrayList<>(result.getClusters().size());
        for (Cluster cluster : result.getClusters()) {
            GeoPoint centroid = cluster.getCentroid();
            List<FacilityLocation> facilities = new ArrayList<>(cluster.size());
            for (GeoPoint point : cluster.getPoints()) {
                facilities.add(new FacilityLocation(point.getId(), point.getLatitude(), point.getLongitude()));
            }
            views.add(ClusterView.builder()
                    .id(cluster.getId())
                    .centroidLatitude(centroid.getLatitude())
                    .centroidLongitude(centroid.getLongitude())
                    .centroidCell(H3Util.clusterCell(centroid.getLatitude(), centroid.getLongitude()))
                    .size(cluster.size())
                    .facilities(facilities)
                    .build());
        }

        return ClusterResponse.builder()
                .clusterCount(views.size())
                .totalFacilities(result.totalPoints())
                .requestedK(result.getRequestedK())
                .iterations(result.getIterations())
                .converged(result.isConverged())
                .clusters(views)
                .build();
    }
}
