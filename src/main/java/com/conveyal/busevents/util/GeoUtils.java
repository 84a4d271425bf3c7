package com.conveyal.busevents.util;

import org.apache.commons.math3.util.FastMath;

/**
 * Great-circle distance calculations on WGS84 degree coordinates.
 */
public abstract class GeoUtils {

    public static final double EARTH_RADIUS_METERS = 6371000;

    /**
     * @return Haversine distance in meters between two points given in degrees.
     */
    public static double distance (double lat1, double lng1, double lat2, double lng2) {
        double dLat = FastMath.toRadians(lat2 - lat1);
        double dLng = FastMath.toRadians(lng2 - lng1);
        double sinLat = FastMath.sin(dLat / 2);
        double sinLng = FastMath.sin(dLng / 2);
        double a = sinLat * sinLat +
            FastMath.cos(FastMath.toRadians(lat1)) * FastMath.cos(FastMath.toRadians(lat2)) * sinLng * sinLng;
        double c = 2 * FastMath.atan2(FastMath.sqrt(a), FastMath.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Sum of the distances between consecutive vertices of a polyline, walking from vertex {@code fromIndex} to vertex
     * {@code toIndex}. Returns zero when toIndex is not greater than fromIndex.
     */
    public static double pathLength (double[] lats, double[] lngs, int fromIndex, int toIndex) {
        double length = 0;
        for (int i = fromIndex; i < toIndex; i++) {
            length += distance(lats[i], lngs[i], lats[i + 1], lngs[i + 1]);
        }
        return length;
    }

    /** Length of a whole polyline in meters. */
    public static double pathLength (double[] lats, double[] lngs) {
        return pathLength(lats, lngs, 0, Math.min(lats.length, lngs.length) - 1);
    }
}
