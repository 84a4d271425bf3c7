package com.conveyal.busevents.model;

import com.conveyal.busevents.util.TimeUtils;

import java.util.Arrays;
import java.util.List;

/**
 * One synthesized arrival or departure of a trip at a stop. This is the unit of output of the projection: a bulk
 * export and a single-variant analysis both produce lists of these, with every field populated.
 *
 * Timestamps are seconds after midnight of the service day and are purely additive from the trip start time.
 */
public class EventNode {

    public final int nodeId;
    public final int routeId;
    public final String routeNo;
    public final int routeVarId;
    public final int tripId;
    public final int stopId;
    public final int timestamp;
    public final EventType event;
    public final String stopName;

    public EventNode (
        int nodeId,
        int routeId,
        String routeNo,
        int routeVarId,
        int tripId,
        int stopId,
        int timestamp,
        EventType event,
        String stopName
    ) {
        this.nodeId = nodeId;
        this.routeId = routeId;
        this.routeNo = routeNo;
        this.routeVarId = routeVarId;
        this.tripId = tripId;
        this.stopId = stopId;
        this.timestamp = timestamp;
        this.event = event;
        this.stopName = stopName;
    }

    /** The timestamp as HH:MM:SS. */
    public String getTime () {
        return TimeUtils.formatTime(timestamp);
    }

    /** The attribute tuple consumed by graph builders: route id, stop id, timestamp and event kind. */
    public List<Object> getAttributes () {
        return Arrays.asList(routeId, stopId, timestamp, event.name());
    }

    @Override
    public String toString () {
        return String.format("Node %d: %s trip %d stop %d at %s", nodeId, event, tripId, stopId, getTime());
    }
}
