package com.conveyal.busevents.model;

import java.io.Serializable;

/**
 * The GPS trace a vehicle follows along one route variant, as two parallel coordinate arrays. Index i of the latitude
 * array pairs with index i of the longitude array, and increasing indexes follow the direction of travel.
 *
 * The loader does not reject malformed paths (mismatched or too short arrays), it is up to the projection to skip
 * the variant, see {@link com.conveyal.busevents.projection.VariantGeometry}.
 */
public class RoutePath implements Serializable {

    private static final long serialVersionUID = 1L;

    public final double[] lats;
    public final double[] lngs;

    public RoutePath (double[] lats, double[] lngs) {
        this.lats = lats;
        this.lngs = lngs;
    }

    public int size () {
        return Math.min(lats.length, lngs.length);
    }

    public boolean isEmpty () {
        return lats.length == 0 || lngs.length == 0;
    }

    public boolean hasMatchingCoordinates () {
        return lats.length == lngs.length;
    }
}
