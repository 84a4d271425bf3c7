package com.conveyal.busevents.stats;

import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.EventNode;
import com.conveyal.busevents.model.SegmentDistance;
import com.conveyal.busevents.projection.TripProjection;
import com.conveyal.busevents.projection.VariantGeometry;
import com.conveyal.busevents.stats.model.VariantStatistic;

import java.util.Collections;
import java.util.List;

/**
 * Everything known about one route variant after analysis: its geometry, the outcome for every candidate trip, the
 * events of the projected trips (ids local to this analysis, starting at 1) and the summary statistic.
 * When {@link #problem} is set there is no statistic and no events.
 */
public class VariantAnalysis {

    public final VariantGeometry geometry;
    public final ProjectionMode mode;
    public final List<TripProjection> projections;
    public final List<EventNode> nodes;
    public final VariantStatistic statistic;
    public final ErrorType problem;

    VariantAnalysis (
        VariantGeometry geometry,
        ProjectionMode mode,
        List<TripProjection> projections,
        List<EventNode> nodes,
        VariantStatistic statistic,
        ErrorType problem
    ) {
        this.geometry = geometry;
        this.mode = mode;
        this.projections = Collections.unmodifiableList(projections);
        this.nodes = Collections.unmodifiableList(nodes);
        this.statistic = statistic;
        this.problem = problem;
    }

    static VariantAnalysis failed (VariantGeometry geometry, ProjectionMode mode, List<TripProjection> projections, ErrorType problem) {
        return new VariantAnalysis(geometry, mode, projections, Collections.emptyList(), null, problem);
    }

    public boolean isValid () {
        return problem == null;
    }

    public List<SegmentDistance> getSegments () {
        return geometry.segments;
    }
}
