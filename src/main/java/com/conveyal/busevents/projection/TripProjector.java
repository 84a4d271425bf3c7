package com.conveyal.busevents.projection;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.EventNode;
import com.conveyal.busevents.model.EventType;
import com.conveyal.busevents.model.Route;
import com.conveyal.busevents.model.SegmentDistance;
import com.conveyal.busevents.model.Stop;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.util.TimeUtils;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Synthesizes the arrival and departure events of trips on one route variant.
 *
 * A trip's schedule only gives a start and an end time. The time between them is split into a fixed dwell at every
 * stop after the first (the dwell at the last stop being the terminal layover that ends the trip) and a travel window.
 * The vehicle is assumed to cover the whole variant distance at a constant average speed during the travel window, so
 * the time spent on each leg is proportional to its path distance.
 *
 * The trip emits a departure at its first stop, an arrival followed by a departure at every intermediate stop, and an
 * arrival at its last stop. Time is accumulated without rounding and only rounded to whole seconds when an event is
 * emitted, so rounding error never builds up along long trips.
 */
public class TripProjector {

    private static final Logger LOG = LoggerFactory.getLogger(TripProjector.class);

    private final Route route;
    private final int routeVarId;
    private final List<Stop> stops;
    private final List<SegmentDistance> segments;
    private final double totalDistance;
    private final int dwellSeconds;
    private final Double minAvgSpeed;
    private final Double maxAvgSpeed;

    public TripProjector (
        Route route,
        int routeVarId,
        List<Stop> stops,
        List<SegmentDistance> segments,
        int dwellSeconds,
        Double minAvgSpeed,
        Double maxAvgSpeed
    ) {
        Preconditions.checkArgument(stops.size() >= 2, "A trip needs at least two stops.");
        Preconditions.checkArgument(segments.size() == stops.size() - 1, "There must be one segment per pair of stops.");
        Preconditions.checkArgument(dwellSeconds >= 0, "Dwell time must not be negative.");
        this.route = route;
        this.routeVarId = routeVarId;
        this.stops = stops;
        this.segments = segments;
        this.totalDistance = SegmentDistancer.totalDistance(segments);
        Preconditions.checkArgument(totalDistance > 0, "Stops must not all project onto the same path point.");
        this.dwellSeconds = dwellSeconds;
        this.minAvgSpeed = minAvgSpeed;
        this.maxAvgSpeed = maxAvgSpeed;
    }

    public TripProjector (Route route, int routeVarId, List<Stop> stops, List<SegmentDistance> segments, int dwellSeconds) {
        this(route, routeVarId, stops, segments, dwellSeconds, null, null);
    }

    /** Create a projector for a usable variant, taking dwell time and speed limits from the configuration. */
    public static TripProjector forVariant (VariantGeometry geometry, ProjectionConfig config) {
        Preconditions.checkArgument(geometry.isUsable(), "Variant %s cannot be projected: %s",
            geometry.routeVarId, geometry.problem);
        Route route = geometry.record.route;
        return new TripProjector(route, geometry.routeVarId, geometry.stops, geometry.segments,
            config.dwellSecondsFor(route.type), config.minAvgSpeedMetersPerSecond, config.maxAvgSpeedMetersPerSecond);
    }

    /**
     * Project one trip. Ids are only drawn from the sequence when the trip succeeds, so skipped trips leave no gaps.
     */
    public TripProjection project (Trip trip, EventIdSequence ids) {
        OptionalInt start = TimeUtils.parseTime(trip.startTime);
        if (!start.isPresent()) return TripProjection.failed(trip, ErrorType.START_TIME_INVALID, 0);
        OptionalInt end = TimeUtils.parseTime(trip.endTime);
        if (!end.isPresent()) return TripProjection.failed(trip, ErrorType.END_TIME_INVALID, 0);
        int startSeconds = start.getAsInt();
        int endSeconds = end.getAsInt();

        int totalDwell = (stops.size() - 1) * dwellSeconds;
        int travelWindow = endSeconds - startSeconds - totalDwell;
        if (endSeconds <= startSeconds) {
            return TripProjection.failed(trip, ErrorType.END_TIME_NOT_AFTER_START, travelWindow);
        }
        if (travelWindow <= 0) {
            return TripProjection.failed(trip, ErrorType.TRAVEL_WINDOW_NOT_POSITIVE, travelWindow);
        }
        double avgSpeed = totalDistance / travelWindow;
        if (minAvgSpeed != null && avgSpeed < minAvgSpeed) {
            return TripProjection.failed(trip, ErrorType.TRAVEL_TOO_SLOW, travelWindow);
        }
        if (maxAvgSpeed != null && avgSpeed > maxAvgSpeed) {
            return TripProjection.failed(trip, ErrorType.TRAVEL_TOO_FAST, travelWindow);
        }

        List<EventNode> nodes = new ArrayList<>(stops.size() * 2 - 2);
        nodes.add(createNode(ids, trip, stops.get(0), startSeconds, EventType.DEPARTURE));
        double currentTime = startSeconds;
        for (int i = 1; i < stops.size(); i++) {
            Stop stop = stops.get(i);
            currentTime += segments.get(i - 1).meters / avgSpeed;
            nodes.add(createNode(ids, trip, stop, (int) Math.round(currentTime), EventType.ARRIVAL));
            if (i < stops.size() - 1) {
                currentTime += dwellSeconds;
                nodes.add(createNode(ids, trip, stop, (int) Math.round(currentTime), EventType.DEPARTURE));
            }
        }
        LOG.trace("Trip {} projected at {} m/s over {}s of travel", trip.tripId, avgSpeed, travelWindow);
        return TripProjection.projected(trip, nodes, avgSpeed, travelWindow);
    }

    private EventNode createNode (EventIdSequence ids, Trip trip, Stop stop, int timestamp, EventType event) {
        return new EventNode(ids.next(), route.routeId, route.routeNo, routeVarId, trip.tripId, stop.stopId,
            timestamp, event, stop.name);
    }

    public int getDwellSeconds () {
        return dwellSeconds;
    }

    public double getTotalDistance () {
        return totalDistance;
    }
}
