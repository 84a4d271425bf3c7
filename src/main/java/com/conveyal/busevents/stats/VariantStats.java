package com.conveyal.busevents.stats;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.EventNode;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.projection.EventIdSequence;
import com.conveyal.busevents.projection.TripProjection;
import com.conveyal.busevents.projection.TripProjector;
import com.conveyal.busevents.projection.VariantGeometry;
import com.conveyal.busevents.stats.model.VariantStatistic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects the trips of a single route variant and summarizes the result: distance, average speed, travel and dwell
 * time. Failed trips are left out of the summary; a variant where no trip can be projected has no summary at all.
 */
public class VariantStats {

    private static final Logger LOG = LoggerFactory.getLogger(VariantStats.class);

    private final ProjectionConfig config;

    public VariantStats (ProjectionConfig config) {
        this.config = config;
    }

    public VariantAnalysis analyze (RouteRecord record, int routeVarId, ProjectionMode mode) {
        LOG.info("Analyzing variant {} of {} ({} mode)", routeVarId, record, mode);
        VariantGeometry geometry = VariantGeometry.of(record, routeVarId);
        List<TripProjection> projections = new ArrayList<>();
        if (!geometry.isUsable()) {
            LOG.warn("Skipping variant {} of {}: {}", routeVarId, record, geometry.problem.englishMessage);
            return VariantAnalysis.failed(geometry, mode, projections, geometry.problem);
        }
        if (geometry.isLoop) LOG.info("Variant {} is a loop route", routeVarId);
        LOG.info("Variant {}: {} stops, {}m", routeVarId, geometry.stops.size(), Math.round(geometry.totalDistance));

        TripProjector projector = TripProjector.forVariant(geometry, config);
        EventIdSequence ids = new EventIdSequence();
        List<EventNode> nodes = new ArrayList<>();
        double speedSum = 0;
        int validTrips = 0;
        for (Trip trip : selectTrips(record, routeVarId, mode)) {
            TripProjection projection = projector.project(trip, ids);
            projections.add(projection);
            if (projection.isProjected()) {
                nodes.addAll(projection.nodes);
                speedSum += projection.avgSpeed;
                validTrips++;
            } else {
                LOG.warn("Skipping {}", projection.describeFailure());
            }
        }
        LOG.info("Generated {} nodes from {} valid trips", nodes.size(), validTrips);
        if (validTrips == 0) {
            LOG.warn("No valid trips found for variant {}", routeVarId);
            return VariantAnalysis.failed(geometry, mode, projections, ErrorType.NO_VALID_TRIPS);
        }

        double avgSpeed = speedSum / validTrips;
        VariantStatistic statistic = new VariantStatistic();
        statistic.totalStops = geometry.stops.size();
        statistic.totalDistance = Math.round(geometry.totalDistance);
        statistic.avgSpeed = roundToHundredths(avgSpeed * 3.6);
        statistic.travelingTime = roundToHundredths(geometry.totalDistance / avgSpeed / 60);
        statistic.totalWaitingTime = roundToHundredths((geometry.stops.size() - 1) * projector.getDwellSeconds() / 60D);
        statistic.totalTrips = record.countTrips(routeVarId);
        statistic.validTrips = validTrips;
        statistic.loopRoute = geometry.isLoop;
        return new VariantAnalysis(geometry, mode, projections, nodes, statistic, null);
    }

    /**
     * In full mode, every trip of every timetable of the variant in timetable order. In preview mode, only the first
     * trip of the first timetable.
     */
    static List<Trip> selectTrips (RouteRecord record, int routeVarId, ProjectionMode mode) {
        List<Trip> trips = new ArrayList<>();
        List<Timetable> timetables = record.getTimetables(routeVarId);
        if (timetables.isEmpty()) {
            LOG.warn("No timetables found for variant {}", routeVarId);
            return trips;
        }
        if (mode == ProjectionMode.PREVIEW) {
            List<Trip> firstTimetableTrips = record.getTrips(timetables.get(0).timetableId);
            if (!firstTimetableTrips.isEmpty()) trips.add(firstTimetableTrips.get(0));
            return trips;
        }
        for (Timetable timetable : timetables) {
            trips.addAll(record.getTrips(timetable.timetableId));
        }
        return trips;
    }

    static double roundToHundredths (double value) {
        return Math.round(value * 100) / 100D;
    }
}
