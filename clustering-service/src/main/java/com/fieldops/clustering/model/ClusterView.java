package com.fieldops.clustering.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One visiting group as returned to clients. {@code centroidCell} is the H3 cell
 * (resolution 7) the map uses to place the group marker.
 */
@Data
@Builder
public class ClusterView {
    private int id;
    private double centroidLatitude;
    private double centroidLongitude;
    private String centroidCell;
    private int size;
    private List<FacilityLocation> facilities;
}
