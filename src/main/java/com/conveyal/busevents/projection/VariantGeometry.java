package com.conveyal.busevents.projection;

import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.RoutePath;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.RouteVariant;
import com.conveyal.busevents.model.SegmentDistance;
import com.conveyal.busevents.model.Stop;

import java.util.Collections;
import java.util.List;

/**
 * The static distance table of one route variant: its stops, its path, whether it is a loop and the path distance
 * of every leg. Either all of these are present, or {@link #problem} says why the variant cannot be projected.
 */
public class VariantGeometry {

    public final RouteRecord record;
    public final int routeVarId;
    public final RouteVariant variant;
    public final List<Stop> stops;
    public final RoutePath path;
    public final boolean isLoop;
    public final List<SegmentDistance> segments;
    public final double totalDistance;
    /** Null when the variant is usable. */
    public final ErrorType problem;

    private VariantGeometry (
        RouteRecord record,
        int routeVarId,
        RouteVariant variant,
        List<Stop> stops,
        RoutePath path,
        boolean isLoop,
        List<SegmentDistance> segments,
        ErrorType problem
    ) {
        this.record = record;
        this.routeVarId = routeVarId;
        this.variant = variant;
        this.stops = stops;
        this.path = path;
        this.isLoop = isLoop;
        this.segments = segments;
        this.totalDistance = SegmentDistancer.totalDistance(segments);
        this.problem = problem;
    }

    /**
     * Check the stops and path of a variant and measure all of its legs.
     */
    public static VariantGeometry of (RouteRecord record, int routeVarId) {
        RouteVariant variant = record.getVariant(routeVarId);
        if (variant == null) return failed(record, routeVarId, null, ErrorType.VARIANT_NOT_FOUND);
        List<Stop> stops = record.getStops(routeVarId);
        RoutePath path = record.getPath(routeVarId);
        if (stops.isEmpty()) return failed(record, routeVarId, variant, ErrorType.VARIANT_MISSING_STOPS);
        if (path == null || path.isEmpty()) return failed(record, routeVarId, variant, ErrorType.VARIANT_MISSING_PATH);
        if (stops.size() < 2) return failed(record, routeVarId, variant, ErrorType.VARIANT_TOO_FEW_STOPS);
        if (!path.hasMatchingCoordinates()) return failed(record, routeVarId, variant, ErrorType.PATH_COORDINATES_MISMATCH);
        if (path.size() < 2) return failed(record, routeVarId, variant, ErrorType.PATH_TOO_SHORT);

        boolean isLoop = LoopDetector.isLoop(stops);
        List<SegmentDistance> segments = SegmentDistancer.distancesForVariant(stops, path);
        VariantGeometry geometry = new VariantGeometry(record, routeVarId, variant, stops, path, isLoop, segments, null);
        if (geometry.totalDistance <= 0) {
            return failed(record, routeVarId, variant, ErrorType.VARIANT_ZERO_DISTANCE);
        }
        return geometry;
    }

    private static VariantGeometry failed (RouteRecord record, int routeVarId, RouteVariant variant, ErrorType problem) {
        return new VariantGeometry(record, routeVarId, variant, Collections.emptyList(), null, false,
            Collections.emptyList(), problem);
    }

    public boolean isUsable () {
        return problem == null;
    }
}
