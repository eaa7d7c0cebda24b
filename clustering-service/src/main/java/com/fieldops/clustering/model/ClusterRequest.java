package com.fieldops.clustering.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Facilities to group into visiting days. Unset tuning fields fall back to the
 * {@code clustering.*} configuration.
 */
@Data
public class ClusterRequest {

    @NotNull
    private List<@Valid @NotNull FacilityLocation> facilities = new ArrayList<>();

    /** Depot; defaults to clustering.default-home-base. {@code id} is ignored. */
    @Valid
    private FacilityLocation homeBase;

    @NotNull
    @Min(1)
    private Integer maxFacilitiesPerCluster;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double tightness;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double balanceWeight;

    @Min(1)
    private Integer maxClusters;

    private Boolean mergeAdjacent;

    /** Fixed seed for reproducible clusters. */
    private Long seed;
}
