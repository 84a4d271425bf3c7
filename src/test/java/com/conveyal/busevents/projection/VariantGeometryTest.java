package com.conveyal.busevents.projection;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.Route;
import com.conveyal.busevents.model.RoutePath;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Stop;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.conveyal.busevents.TestUtils.singleVariantRecord;
import static com.conveyal.busevents.TestUtils.stop;
import static com.conveyal.busevents.TestUtils.stopAtVertex;
import static com.conveyal.busevents.TestUtils.straightPath;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class VariantGeometryTest {

    private static final Route ROUTE = new Route(7, "7", "Test route", "Express");
    private static final RoutePath PATH = straightPath(5, 0.005);

    private static ErrorType problemWith (List<Stop> stops, RoutePath path) {
        RouteRecord record = singleVariantRecord(ROUTE, stops, path, Collections.emptyList());
        return VariantGeometry.of(record, 1).problem;
    }

    @Test
    public void canMeasureUsableVariant () {
        List<Stop> stops = Arrays.asList(stopAtVertex(1, PATH, 0), stopAtVertex(2, PATH, 4));
        VariantGeometry geometry = VariantGeometry.of(singleVariantRecord(ROUTE, stops, PATH, Collections.emptyList()), 1);
        assertThat(geometry.isUsable(), is(true));
        assertThat(geometry.problem, nullValue());
        assertThat(geometry.segments.size(), equalTo(1));
        assertThat(geometry.isLoop, is(false));
        assertThat(geometry.totalDistance > 0, is(true));
    }

    @Test
    public void unknownVariantIsNotFound () {
        List<Stop> stops = Arrays.asList(stopAtVertex(1, PATH, 0), stopAtVertex(2, PATH, 4));
        VariantGeometry geometry = VariantGeometry.of(singleVariantRecord(ROUTE, stops, PATH, Collections.emptyList()), 99);
        assertThat(geometry.problem, equalTo(ErrorType.VARIANT_NOT_FOUND));
    }

    @Test
    public void reportsMissingData () {
        List<Stop> twoStops = Arrays.asList(stopAtVertex(1, PATH, 0), stopAtVertex(2, PATH, 4));
        assertThat(problemWith(Collections.emptyList(), PATH), equalTo(ErrorType.VARIANT_MISSING_STOPS));
        assertThat(problemWith(twoStops, null), equalTo(ErrorType.VARIANT_MISSING_PATH));
        assertThat(problemWith(twoStops, new RoutePath(new double[0], new double[0])), equalTo(ErrorType.VARIANT_MISSING_PATH));
        assertThat(problemWith(Collections.singletonList(stop(1, 10.0, 106.0)), PATH), equalTo(ErrorType.VARIANT_TOO_FEW_STOPS));
    }

    @Test
    public void reportsMalformedPaths () {
        List<Stop> twoStops = Arrays.asList(stop(1, 10.0, 106.0), stop(2, 10.0, 106.02));
        RoutePath mismatched = new RoutePath(new double[] {10.0, 10.0, 10.0}, new double[] {106.0, 106.02});
        assertThat(problemWith(twoStops, mismatched), equalTo(ErrorType.PATH_COORDINATES_MISMATCH));
        RoutePath singlePoint = new RoutePath(new double[] {10.0}, new double[] {106.0});
        assertThat(problemWith(twoStops, singlePoint), equalTo(ErrorType.PATH_TOO_SHORT));
    }

    /** Both stops snap onto the same vertex, so the vehicle would not need to move at all. */
    @Test
    public void reportsZeroDistance () {
        List<Stop> stops = Arrays.asList(stop(1, 10.0, 106.0001), stop(2, 10.0, 106.0002));
        assertThat(problemWith(stops, PATH), equalTo(ErrorType.VARIANT_ZERO_DISTANCE));
    }

    @Test
    public void projectorTakesDwellFromRouteType () {
        List<Stop> stops = Arrays.asList(stopAtVertex(1, PATH, 0), stopAtVertex(2, PATH, 4));
        VariantGeometry geometry = VariantGeometry.of(singleVariantRecord(ROUTE, stops, PATH, Collections.emptyList()), 1);
        ProjectionConfig config = new ProjectionConfig();
        assertThat(TripProjector.forVariant(geometry, config).getDwellSeconds(), equalTo(30));
        config.dwellSecondsByRouteType.put("Express", 10);
        assertThat(TripProjector.forVariant(geometry, config).getDwellSeconds(), equalTo(10));
    }

    @Test
    public void projectorRequiresUsableVariant () {
        RouteRecord record = singleVariantRecord(ROUTE, Collections.emptyList(), PATH, Collections.emptyList());
        VariantGeometry geometry = VariantGeometry.of(record, 1);
        assertThrows(IllegalArgumentException.class, () -> TripProjector.forVariant(geometry, new ProjectionConfig()));
    }
}
