package com.fieldops.shared.util;

/**
 * Great-circle helpers for facility coordinates.
 * Distances are statute miles (route planning reports miles throughout).
 */
public final class GeoUtil {

    public static final double EARTH_RADIUS_MILES = 3959.0;

    private GeoUtil() {}

    /**
     * Haversine distance between two coordinates, in miles.
     */
    public static double distanceMiles(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        // rounding can push a past 1 for antipodal points
        a = Math.min(1.0, a);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }

    /**
     * Initial compass bearing from the first coordinate towards the second,
     * normalised to [0, 360).
     */
    public static double initialBearing(double fromLat, double fromLng, double toLat, double toLng) {
        double lat1 = Math.toRadians(fromLat);
        double lat2 = Math.toRadians(toLat);
        double dLng = Math.toRadians(toLng - fromLng);

        double y = Math.sin(dLng) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2)
                - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLng);

        double bearing = Math.toDegrees(Math.atan2(y, x));
        return (bearing + 360.0) % 360.0;
    }

    /**
     * Smallest angle between two bearings, in [0, 180].
     */
    public static double angularDifference(double bearingA, double bearingB) {
        double diff = Math.abs(bearingA - bearingB) % 360.0;
        return Math.min(diff, 360.0 - diff);
    }
}
