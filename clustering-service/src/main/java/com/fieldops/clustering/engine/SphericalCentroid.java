package com.fieldops.clustering.engine;

import java.util.List;

/**
 * Mean position of a set of coordinates, computed on the sphere.
 *
 * Each point becomes a unit vector (x = cosφ·cosλ, y = cosφ·sinλ, z = sinφ);
 * the component-wise mean is converted back with atan2. Unlike averaging raw
 * degrees this is correct across the ±180° meridian and near the poles.
 */
public final class SphericalCentroid {

    /** Returned for an empty set. Not a real location. */
    public static final GeoPoint EMPTY = GeoPoint.of(0.0, 0.0);

    private SphericalCentroid() {}

    public static GeoPoint of(List<GeoPoint> points) {
        if (points.isEmpty()) {
            return EMPTY;
        }
        if (points.size() == 1) {
            GeoPoint only = points.get(0);
            return GeoPoint.of(only.getLatitude(), only.getLongitude());
        }

        double x = 0.0;
        double y = 0.0;
        double z = 0.0;
        for (GeoPoint point : points) {
            double latRad = Math.toRadians(point.getLatitude());
            double lngRad = Math.toRadians(point.getLongitude());
            x += Math.cos(latRad) * Math.cos(lngRad);
            y += Math.cos(latRad) * Math.sin(lngRad);
            z += Math.sin(latRad);
        }
        int n = points.size();
        x /= n;
        y /= n;
        z /= n;

        double lngRad = Math.atan2(y, x);
        double hyp = Math.sqrt(x * x + y * y);
        double latRad = Math.atan2(z, hyp);
        return GeoPoint.of(Math.toDegrees(latRad), Math.toDegrees(lngRad));
    }
}
