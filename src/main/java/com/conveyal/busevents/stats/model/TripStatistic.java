package com.conveyal.busevents.stats.model;

import java.io.Serializable;

/**
 * Summary of the events generated for one trip.
 */
public class TripStatistic implements Serializable {

    private static final long serialVersionUID = 1L;

    public int tripId;
    public String routeNo;
    public int routeVarId;
    public int nodeCount;
    /** Seconds from first to last event. */
    public int duration;
    public String startTime;
    public String endTime;
    /** Distinct stops visited. */
    public int stopCount;
}
