package com.fieldops.clustering.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ClusterResponse {
    private int clusterCount;
    private int totalFacilities;
    private int requestedK;
    private int iterations;
    private boolean converged;
    private List<ClusterView> clusters;
}
