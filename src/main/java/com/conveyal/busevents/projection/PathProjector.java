package com.conveyal.busevents.projection;

import com.conveyal.busevents.util.GeoUtils;

/**
 * Snaps a point onto a path by finding the nearest path vertex. Only vertices are considered, not the segments
 * between them, so the precision of the projection depends on the density of the GPS trace.
 */
public abstract class PathProjector {

    /**
     * Scan every vertex of the path and return the one nearest to the point by haversine distance. When several
     * vertices are equally near, the one with the lowest index wins.
     * @throws IllegalArgumentException if the path has no vertices.
     */
    public static NearestVertex nearest (double pointLat, double pointLng, double[] pathLats, double[] pathLngs) {
        int size = Math.min(pathLats.length, pathLngs.length);
        if (size == 0) {
            throw new IllegalArgumentException("Cannot project a point onto an empty path.");
        }
        int nearestIndex = 0;
        double minDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < size; i++) {
            double distance = GeoUtils.distance(pointLat, pointLng, pathLats[i], pathLngs[i]);
            if (distance < minDistance) {
                minDistance = distance;
                nearestIndex = i;
            }
        }
        return new NearestVertex(nearestIndex, minDistance);
    }

    /** The result of a projection: a vertex index and how far the projected point is from it. */
    public static class NearestVertex {
        public final int index;
        public final double distanceMeters;

        public NearestVertex (int index, double distanceMeters) {
            this.index = index;
            this.distanceMeters = distanceMeters;
        }
    }
}
