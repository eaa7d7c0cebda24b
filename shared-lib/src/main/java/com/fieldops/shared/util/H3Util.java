package com.fieldops.shared.util;

import com.uber.h3core.H3Core;

import java.io.IOException;

/**
 * H3 hexagonal cell lookup for map tiling of cluster centroids.
 * Resolution 7 ≈ 5.2 km², so one cell comfortably covers a facility yard.
 */
public final class H3Util {

    public static final int CLUSTER_RESOLUTION = 7;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    private H3Util() {}

    public static String latLngToCell(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    public static String clusterCell(double lat, double lng) {
        return latLngToCell(lat, lng, CLUSTER_RESOLUTION);
    }
}
