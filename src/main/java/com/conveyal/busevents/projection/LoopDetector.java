package com.conveyal.busevents.projection;

import com.conveyal.busevents.model.Stop;

import java.util.List;

public abstract class LoopDetector {

    /** About ten centimeters at the equator. */
    public static final double COORDINATE_TOLERANCE_DEGREES = 1e-6;

    /**
     * A variant is a loop (circular route) when its first and last stops are at the same place.
     */
    public static boolean isLoop (List<Stop> stops) {
        if (stops.size() < 2) return false;
        Stop first = stops.get(0);
        Stop last = stops.get(stops.size() - 1);
        return Math.abs(first.lat - last.lat) < COORDINATE_TOLERANCE_DEGREES &&
            Math.abs(first.lng - last.lng) < COORDINATE_TOLERANCE_DEGREES;
    }
}
