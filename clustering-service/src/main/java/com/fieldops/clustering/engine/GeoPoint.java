package com.fieldops.clustering.engine;

import com.fieldops.shared.util.GeoUtil;
import lombok.Value;

/**
 * Immutable facility coordinate. {@code id} is optional and carried through
 * clustering untouched so callers can re-associate points with their records.
 * Ranges are not validated here.
 */
@Value
public class GeoPoint {

    double latitude;
    double longitude;
    String id;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude, null);
    }

    public static GeoPoint of(String id, double latitude, double longitude) {
        return new GeoPoint(latitude, longitude, id);
    }

    /** Great-circle distance in statute miles. */
    public double distanceTo(GeoPoint other) {
        return GeoUtil.distanceMiles(latitude, longitude, other.latitude, other.longitude);
    }

    /** Initial bearing from this point towards {@code other}, in [0, 360). */
    public double bearingTo(GeoPoint other) {
        return GeoUtil.initialBearing(latitude, longitude, other.latitude, other.longitude);
    }
}
