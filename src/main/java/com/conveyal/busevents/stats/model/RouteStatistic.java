package com.conveyal.busevents.stats.model;

import java.io.Serializable;

/**
 * Summary of all events generated for one route.
 */
public class RouteStatistic implements Serializable {

    private static final long serialVersionUID = 1L;

    public int routeId;
    public String routeNo;
    public int totalNodes;
    public int totalTrips;
    public int variants;
    /** Distinct stops served. */
    public int stops;
    /** Mean time from first to last event of a trip, in seconds. */
    public double avgTripDuration;
    public String firstEventTime;
    public String lastEventTime;
    /** Seconds between the first and last event of the route. */
    public int serviceSpan;
}
