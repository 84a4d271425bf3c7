package com.conveyal.busevents.projection;

import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.EventNode;
import com.conveyal.busevents.model.Trip;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of projecting one trip: either its events, or the reason it was skipped.
 */
public class TripProjection {

    public final Trip trip;
    public final List<EventNode> nodes;
    /** Null when the trip was projected. */
    public final ErrorType error;
    /** Constant speed in meters per second assumed for the whole trip, NaN when not projected. */
    public final double avgSpeed;
    /** Seconds available for moving between stops once all dwell time is subtracted, 0 when times did not parse. */
    public final int travelWindow;

    private TripProjection (Trip trip, List<EventNode> nodes, ErrorType error, double avgSpeed, int travelWindow) {
        this.trip = trip;
        this.nodes = nodes;
        this.error = error;
        this.avgSpeed = avgSpeed;
        this.travelWindow = travelWindow;
    }

    static TripProjection projected (Trip trip, List<EventNode> nodes, double avgSpeed, int travelWindow) {
        return new TripProjection(trip, Collections.unmodifiableList(nodes), null, avgSpeed, travelWindow);
    }

    static TripProjection failed (Trip trip, ErrorType error, int travelWindow) {
        return new TripProjection(trip, Collections.emptyList(), error, Double.NaN, travelWindow);
    }

    public boolean isProjected () {
        return error == null;
    }

    /** Explains why a trip was skipped, for log messages. */
    public String describeFailure () {
        return String.format("trip %d (%s-%s): %s", trip.tripId, trip.startTime, trip.endTime,
            error == null ? "projected" : error.englishMessage);
    }
}
