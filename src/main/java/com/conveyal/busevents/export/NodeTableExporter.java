package com.conveyal.busevents.export;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.error.TripProjectionException;
import com.conveyal.busevents.model.BusDataset;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.RouteVariant;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.projection.EventIdSequence;
import com.conveyal.busevents.projection.TripProjection;
import com.conveyal.busevents.projection.TripProjector;
import com.conveyal.busevents.projection.VariantGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.busevents.util.Util.human;

/**
 * Projects every trip of every timetable of every variant of every route in a dataset into one node table. All events
 * share a single id sequence starting at 1, so node ids are dense and follow generation order across the whole
 * dataset. Each call to {@link #export(BusDataset)} starts a fresh sequence.
 *
 * Variants without usable stops or path and trips that cannot be projected are skipped and counted. In strict mode
 * (skipInvalidTrips false) the first failed trip aborts the export instead.
 */
public class NodeTableExporter {

    private static final Logger LOG = LoggerFactory.getLogger(NodeTableExporter.class);

    private final ProjectionConfig config;
    private final ProgressListener progressListener;

    public NodeTableExporter (ProjectionConfig config, ProgressListener progressListener) {
        this.config = config;
        this.progressListener = progressListener;
    }

    public NodeTableExporter (ProjectionConfig config) {
        this(config, (processed, total) -> LOG.debug("Processed {}/{} routes", processed, total));
    }

    public ExportResult export (BusDataset dataset) {
        List<RouteRecord> routes = new ArrayList<>(dataset.getRoutes());
        if (config.routeLimit != null && config.routeLimit < routes.size()) {
            routes = routes.subList(0, config.routeLimit);
        }
        LOG.info("Exporting nodes for {} of {} routes, dwell time {}s", routes.size(), dataset.size(), config.dwellSeconds);

        ExportResult result = new ExportResult();
        EventIdSequence ids = new EventIdSequence();
        for (RouteRecord record : routes) {
            LOG.info("[{}/{}] Processing {}", result.routesProcessed + 1, routes.size(), record);
            int nodesBefore = result.nodes.size();
            for (RouteVariant variant : record.variants) {
                exportVariant(record, variant, ids, result);
            }
            result.routesProcessed++;
            LOG.info("  => {} nodes", result.nodes.size() - nodesBefore);
            progressListener.routeProcessed(result.routesProcessed, routes.size());
        }

        LOG.info("Generated {} nodes from {} trips ({} trips and {} variants skipped)", human(result.nodes.size()),
            result.projectedTrips, result.getSkippedTrips(), result.getSkippedVariants());
        if (result.isEmpty()) LOG.warn("No nodes were generated, there is nothing to export.");
        return result;
    }

    private void exportVariant (RouteRecord record, RouteVariant variant, EventIdSequence ids, ExportResult result) {
        VariantGeometry geometry = VariantGeometry.of(record, variant.routeVarId);
        if (!geometry.isUsable()) {
            LOG.warn("  ! Skipping {}: {}", variant, geometry.problem.englishMessage);
            result.skippedVariantReasons.add(geometry.problem);
            return;
        }
        result.variantsProcessed++;
        TripProjector projector = TripProjector.forVariant(geometry, config);
        List<Timetable> timetables = record.getTimetables(variant.routeVarId);
        LOG.info("  - {}: {} stops, {}m, dwell {}s, {} timetables{}", variant, geometry.stops.size(),
            Math.round(geometry.totalDistance), projector.getDwellSeconds(), timetables.size(),
            geometry.isLoop ? ", loop route" : "");

        for (Timetable timetable : timetables) {
            List<Trip> trips = record.getTrips(timetable.timetableId);
            if (trips.isEmpty()) continue;
            int validTrips = 0;
            for (Trip trip : trips) {
                TripProjection projection = projector.project(trip, ids);
                if (projection.isProjected()) {
                    result.nodes.addAll(projection.nodes);
                    result.projectedTrips++;
                    validTrips++;
                } else {
                    if (!config.skipInvalidTrips) {
                        throw new TripProjectionException(projection.error, projection.describeFailure());
                    }
                    LOG.debug("      ! Skip {}", projection.describeFailure());
                    result.skippedTripReasons.add(projection.error);
                }
            }
            LOG.info("    Timetable {}: {} valid, {} skipped / {} trips", timetable.timetableId, validTrips,
                trips.size() - validTrips, trips.size());
        }
    }
}
