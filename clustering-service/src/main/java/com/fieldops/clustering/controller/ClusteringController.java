package com.fieldops.clustering.controller;

import com.fieldops.clustering.exception.ClusteringException;
import com.fieldops.clustering.model.ClusterRequest;
import com.fieldops.clustering.model.ClusterResponse;
import com.fieldops.clustering.service.FacilityClusteringService;
import com.fieldops.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/v1/clusters")
@RequiredArgsConstructor
public class ClusteringController {

    private final FacilityClusteringService clusteringService;

    /**
     * Groups facilities into visiting days. The response clusters are ordered by
     * distance from the home base and numbered 0..N-1 in that order.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ClusterResponse>> cluster(@Valid @RequestBody ClusterRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(clusteringService.cluster(request)));
    }

    @ExceptionHandler(ClusteringException.class)
    public ResponseEntity<ApiResponse<Void>> handleClusteringException(ClusteringException ex) {
        log.warn("Clustering error [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }
}
