package com.conveyal.busevents.stats.model;

import java.io.Serializable;

/**
 * Summary figures of one analyzed route variant.
 */
public class VariantStatistic implements Serializable {

    private static final long serialVersionUID = 1L;

    public int totalStops;
    /** Path distance from first to last stop, rounded to the meter. */
    public long totalDistance;
    /** Mean of the average speeds of all projected trips, in km/h. */
    public double avgSpeed;
    /** Minutes needed to cover the variant at the average speed. */
    public double travelingTime;
    /** Minutes of dwell time across all stops of one trip. */
    public double totalWaitingTime;
    /** All candidate trips, whether or not they could be projected. */
    public int totalTrips;
    public int validTrips;
    public boolean loopRoute;

    @Override
    public String toString () {
        return String.format("%d stops, %dm, %.2f km/h, %.2f min travel, %.2f min dwell, %d/%d trips",
            totalStops, totalDistance, avgSpeed, travelingTime, totalWaitingTime, validTrips, totalTrips);
    }
}
