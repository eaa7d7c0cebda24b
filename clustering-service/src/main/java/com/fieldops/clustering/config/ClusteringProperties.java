package com.fieldops.clustering.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults applied when a request leaves a tuning knob unset.
 *
 * clustering:
 *   default-tightness: 0.5
 *   default-balance-weight: 0.35
 *   max-iterations: 50
 *   merge-adjacent: false
 *   random-seed:            # unset → fresh entropy per request
 *   default-home-base:
 *     latitude: 39.8283
 *     longitude: -98.5795
 */
@Data
@Validated
@ConfigurationProperties(prefix = "clustering")
public class ClusteringProperties {

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double defaultTightness = 0.5;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double defaultBalanceWeight = 0.35;

    @Min(1)
    private int maxIterations = 50;

    private boolean mergeAdjacent = false;

    private Long randomSeed;

    @NotNull
    private HomeBase defaultHomeBase = new HomeBase();

    @Data
    public static class HomeBase {
        // geographic centre of the contiguous US
        private double latitude = 39.8283;
        private double longitude = -98.5795;
    }
}
