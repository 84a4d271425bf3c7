package com.conveyal.busevents.export;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.TestUtils;
import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.error.TripProjectionException;
import com.conveyal.busevents.model.BusDataset;
import com.conveyal.busevents.model.EventNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class NodeTableExporterTest {

    private static BusDataset dataset;

    @BeforeAll
    public static void setUpClass () throws IOException {
        dataset = TestUtils.loadSampleDataset();
    }

    /**
     * Route 12 yields 4 events for trip 1 and 6 for the loop trip 4, skipping trips 2 and 3. The only variant of
     * route 34 has a single stop and is skipped.
     */
    @Test
    public void canExportSampleDataset () {
        ExportResult result = new NodeTableExporter(new ProjectionConfig()).export(dataset);
        assertThat(result.getNodeCount(), equalTo(10));
        assertThat(result.getRoutesProcessed(), equalTo(2));
        assertThat(result.getVariantsProcessed(), equalTo(2));
        assertThat(result.getProjectedTrips(), equalTo(2));
        assertThat(result.getSkippedTrips(), equalTo(2));
        assertThat(result.countSkippedTrips(ErrorType.END_TIME_NOT_AFTER_START), equalTo(1));
        assertThat(result.countSkippedTrips(ErrorType.START_TIME_INVALID), equalTo(1));
        assertThat(result.getSkippedVariants(), equalTo(1));
        assertThat(result.countSkippedVariants(ErrorType.VARIANT_TOO_FEW_STOPS), equalTo(1));

        List<EventNode> nodes = result.getNodes();
        assertThat(nodes.get(0).tripId, equalTo(1));
        assertThat(nodes.get(4).tripId, equalTo(4));
        assertThat(nodes.get(4).routeVarId, equalTo(2));
        assertThat(nodes.get(9).stopId, equalTo(201));
    }

    /** Ids run from 1 without gaps across trips, variants and routes. */
    @Test
    public void nodeIdsAreDenseAcrossDataset () {
        List<EventNode> nodes = new NodeTableExporter(new ProjectionConfig()).export(dataset).getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            assertThat(nodes.get(i).nodeId, equalTo(i + 1));
        }
    }

    @Test
    public void everyExportStartsFromFirstId () {
        NodeTableExporter exporter = new NodeTableExporter(new ProjectionConfig());
        exporter.export(dataset);
        assertThat(exporter.export(dataset).getNodes().get(0).nodeId, equalTo(1));
    }

    @Test
    public void reportsProgressPerRoute () {
        List<String> progress = new ArrayList<>();
        new NodeTableExporter(new ProjectionConfig(), (processed, total) -> progress.add(processed + "/" + total))
            .export(dataset);
        assertThat(progress, contains("1/2", "2/2"));
    }

    @Test
    public void canLimitRoutes () {
        ProjectionConfig config = new ProjectionConfig();
        config.routeLimit = 1;
        ExportResult result = new NodeTableExporter(config).export(dataset);
        assertThat(result.getRoutesProcessed(), equalTo(1));
        assertThat(result.getSkippedVariants(), equalTo(0));
        assertThat(result.getNodeCount(), equalTo(10));
    }

    @Test
    public void strictModeStopsOnFirstBadTrip () {
        ProjectionConfig config = new ProjectionConfig();
        config.skipInvalidTrips = false;
        TripProjectionException exception = assertThrows(TripProjectionException.class,
            () -> new NodeTableExporter(config).export(dataset));
        assertThat(exception.errorType, equalTo(ErrorType.END_TIME_NOT_AFTER_START));
    }

    @Test
    public void emptyDatasetGivesEmptyResult () {
        ExportResult result = new NodeTableExporter(new ProjectionConfig()).export(new BusDataset());
        assertThat(result.isEmpty(), is(true));
        assertThat(result.getRoutesProcessed(), equalTo(0));
    }
}
