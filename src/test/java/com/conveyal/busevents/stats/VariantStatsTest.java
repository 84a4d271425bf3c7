package com.conveyal.busevents.stats;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.TestUtils;
import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.BusDataset;
import com.conveyal.busevents.model.Route;
import com.conveyal.busevents.model.RoutePath;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Stop;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.stats.model.VariantStatistic;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static com.conveyal.busevents.TestUtils.singleVariantRecord;
import static com.conveyal.busevents.TestUtils.stopAtVertex;
import static com.conveyal.busevents.TestUtils.straightPath;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class VariantStatsTest {

    private static BusDataset dataset;
    private final VariantStats variantStats = new VariantStats(new ProjectionConfig());

    @BeforeAll
    public static void setUpClass () throws IOException {
        dataset = TestUtils.loadSampleDataset();
    }

    /** Variant 1 of route 12 has three trips, of which only the first can be projected. */
    @Test
    public void canSummarizeVariantInFullMode () {
        VariantAnalysis analysis = variantStats.analyze(dataset.getRoute("12"), 1, ProjectionMode.FULL);
        assertThat(analysis.isValid(), is(true));
        assertThat(analysis.projections.size(), equalTo(3));
        assertThat(analysis.nodes.size(), equalTo(4));
        assertThat(analysis.nodes.get(0).nodeId, equalTo(1));

        VariantStatistic statistic = analysis.statistic;
        assertThat(statistic.totalStops, equalTo(3));
        assertThat(statistic.totalTrips, equalTo(3));
        assertThat(statistic.validTrips, equalTo(1));
        assertThat(statistic.loopRoute, is(false));
        assertThat(statistic.totalDistance, equalTo(Math.round(analysis.geometry.totalDistance)));
        // 240 seconds of travel, two 30 second dwells.
        assertThat(statistic.travelingTime, closeTo(4.0, 0.001));
        assertThat(statistic.totalWaitingTime, closeTo(1.0, 0.001));
        assertThat(statistic.avgSpeed, closeTo(analysis.geometry.totalDistance / 240 * 3.6, 0.01));
        assertThat(analysis.getSegments().size(), equalTo(2));
    }

    @Test
    public void previewProjectsFirstTripOnly () {
        VariantAnalysis analysis = variantStats.analyze(dataset.getRoute("12"), 1, ProjectionMode.PREVIEW);
        assertThat(analysis.isValid(), is(true));
        assertThat(analysis.projections.size(), equalTo(1));
        assertThat(analysis.projections.get(0).trip.tripId, equalTo(1));
        assertThat(analysis.statistic.validTrips, equalTo(1));
        assertThat(analysis.statistic.totalTrips, equalTo(3));
    }

    @Test
    public void canSummarizeLoopVariant () {
        VariantAnalysis analysis = variantStats.analyze(dataset.getRoute("12"), 2, ProjectionMode.FULL);
        assertThat(analysis.isValid(), is(true));
        assertThat(analysis.statistic.loopRoute, is(true));
        assertThat(analysis.statistic.totalStops, equalTo(4));
        assertThat(analysis.statistic.totalWaitingTime, closeTo(1.5, 0.001));
        assertThat(analysis.nodes.size(), equalTo(6));
        assertThat(analysis.getSegments().get(2).wraparound, is(true));
    }

    @Test
    public void unusableVariantHasNoStatistic () {
        VariantAnalysis analysis = variantStats.analyze(dataset.getRoute("34"), 5, ProjectionMode.FULL);
        assertThat(analysis.isValid(), is(false));
        assertThat(analysis.problem, equalTo(ErrorType.VARIANT_TOO_FEW_STOPS));
        assertThat(analysis.statistic, nullValue());
        assertThat(analysis.nodes.isEmpty(), is(true));
    }

    @Test
    public void variantWithoutValidTripsHasNoStatistic () {
        RoutePath path = straightPath(3, 0.01);
        List<Stop> stops = Arrays.asList(stopAtVertex(1, path, 0), stopAtVertex(2, path, 2));
        RouteRecord record = singleVariantRecord(new Route(9, "9", null, null), stops, path, Arrays.asList(
            new Trip(1, "8:00", "7:00"),
            new Trip(2, "8:00", "bad")
        ));
        VariantAnalysis analysis = variantStats.analyze(record, 1, ProjectionMode.FULL);
        assertThat(analysis.problem, equalTo(ErrorType.NO_VALID_TRIPS));
        assertThat(analysis.statistic, nullValue());
        assertThat(analysis.projections.size(), equalTo(2));
        assertThat(analysis.projections.get(0).error, equalTo(ErrorType.END_TIME_NOT_AFTER_START));
        assertThat(analysis.projections.get(1).error, equalTo(ErrorType.END_TIME_INVALID));
    }

    /** In preview mode a bad first trip leaves nothing to summarize, even if later trips are fine. */
    @Test
    public void previewWithInvalidFirstTripHasNoValidTrips () {
        RoutePath path = straightPath(3, 0.01);
        List<Stop> stops = Arrays.asList(stopAtVertex(1, path, 0), stopAtVertex(2, path, 2));
        RouteRecord record = singleVariantRecord(new Route(9, "9", null, null), stops, path, Arrays.asList(
            new Trip(1, "25:00", "7:00"),
            new Trip(2, "7:00", "7:30")
        ));
        assertThat(variantStats.analyze(record, 1, ProjectionMode.PREVIEW).problem, equalTo(ErrorType.NO_VALID_TRIPS));
        assertThat(variantStats.analyze(record, 1, ProjectionMode.FULL).isValid(), is(true));
    }

    @Test
    public void canRoundToHundredths () {
        assertThat(VariantStats.roundToHundredths(32.8456), equalTo(32.85));
        assertThat(VariantStats.roundToHundredths(4.0), equalTo(4.0));
    }
}
