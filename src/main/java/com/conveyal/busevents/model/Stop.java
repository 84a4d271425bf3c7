package com.conveyal.busevents.model;

import java.io.Serializable;

/**
 * A physical bus stop with fixed WGS84 coordinates. Stops are looked up by id within the stop list of one variant.
 */
public class Stop implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int stopId;
    public final String name;
    public final double lat;
    public final double lng;

    public Stop (int stopId, String name, double lat, double lng) {
        this.stopId = stopId;
        this.name = name;
        this.lat = lat;
        this.lng = lng;
    }

    @Override
    public String toString () {
        return String.format("Stop %d (%s) lat=%f; lng=%f", stopId, name, lat, lng);
    }
}
