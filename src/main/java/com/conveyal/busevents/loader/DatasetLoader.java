package com.conveyal.busevents.loader;

import com.conveyal.busevents.error.DatasetFormatException;
import com.conveyal.busevents.model.BusDataset;
import com.conveyal.busevents.model.Route;
import com.conveyal.busevents.model.RoutePath;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.RouteVariant;
import com.conveyal.busevents.model.Stop;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.util.json.JsonManager;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON bus dataset into model objects. The source document maps each route key to a record with the
 * sections {@code getroutebyid}, {@code getvarsbyroute}, {@code getstopsbyvar}, {@code getpathsbyvar},
 * {@code gettimetablebyroute} and {@code gettripsbytimetable}. Absent or null sections are treated as empty.
 *
 * Any structural problem (wrong JSON type, non-integer id, non-numeric coordinate) throws a
 * {@link DatasetFormatException}: a dataset is loaded completely or not at all. Trip times are NOT checked here,
 * they are kept raw for the validator and the projection to judge.
 */
public class DatasetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetLoader.class);

    public static final String ROUTE_INFO = "getroutebyid";
    public static final String VARIANTS = "getvarsbyroute";
    public static final String STOPS_BY_VARIANT = "getstopsbyvar";
    public static final String PATHS_BY_VARIANT = "getpathsbyvar";
    public static final String TIMETABLES = "gettimetablebyroute";
    public static final String TRIPS_BY_TIMETABLE = "gettripsbytimetable";

    public static BusDataset load (File file) {
        LOG.info("Loading bus dataset from {}", file.getAbsolutePath());
        try (InputStream stream = new FileInputStream(file)) {
            return load(stream);
        } catch (IOException e) {
            throw new DatasetFormatException(file.getName(), e);
        }
    }

    public static BusDataset load (InputStream stream) {
        JsonNode root;
        try {
            root = JsonManager.MAPPER.readTree(stream);
        } catch (IOException e) {
            throw new DatasetFormatException("/", e);
        }
        return fromJson(root);
    }

    public static BusDataset fromJson (JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DatasetFormatException("/", "dataset must be a JSON object keyed by route");
        }
        BusDataset dataset = new BusDataset();
        Iterator<Map.Entry<String, JsonNode>> routes = root.fields();
        while (routes.hasNext()) {
            Map.Entry<String, JsonNode> entry = routes.next();
            dataset.addRoute(loadRoute(entry.getKey(), entry.getValue()));
        }
        LOG.info("Loaded {} routes with {} trips", dataset.size(), dataset.countTrips());
        return dataset;
    }

    private static RouteRecord loadRoute (String routeKey, JsonNode node) {
        String location = "/" + routeKey;
        requireObject(node, location);
        Route route = loadRouteInfo(routeKey, node.get(ROUTE_INFO), location + "/" + ROUTE_INFO);

        List<RouteVariant> variants = new ArrayList<>();
        String variantsLocation = location + "/" + VARIANTS;
        for (JsonNode variantNode : arrayElements(node.get(VARIANTS), variantsLocation)) {
            requireObject(variantNode, variantsLocation);
            variants.add(new RouteVariant(
                getIntField(variantNode, "RouteVarId", variantsLocation),
                getStringField(variantNode, "RouteVarName", null)
            ));
        }

        Map<Integer, List<Stop>> stopsByVariant = new LinkedHashMap<>();
        String stopsLocation = location + "/" + STOPS_BY_VARIANT;
        for (Map.Entry<String, JsonNode> entry : objectEntries(node.get(STOPS_BY_VARIANT), stopsLocation)) {
            String stopListLocation = stopsLocation + "/" + entry.getKey();
            List<Stop> stops = new ArrayList<>();
            for (JsonNode stopNode : arrayElements(entry.getValue(), stopListLocation)) {
                requireObject(stopNode, stopListLocation);
                stops.add(new Stop(
                    getIntField(stopNode, "StopId", stopListLocation),
                    getStringField(stopNode, "Name", ""),
                    getDoubleField(stopNode, "Lat", stopListLocation),
                    getDoubleField(stopNode, "Lng", stopListLocation)
                ));
            }
            stopsByVariant.put(parseIntKey(entry.getKey(), stopsLocation), stops);
        }

        Map<Integer, RoutePath> pathsByVariant = new LinkedHashMap<>();
        String pathsLocation = location + "/" + PATHS_BY_VARIANT;
        for (Map.Entry<String, JsonNode> entry : objectEntries(node.get(PATHS_BY_VARIANT), pathsLocation)) {
            String pathLocation = pathsLocation + "/" + entry.getKey();
            if (entry.getValue() == null || entry.getValue().isNull()) continue;
            requireObject(entry.getValue(), pathLocation);
            pathsByVariant.put(parseIntKey(entry.getKey(), pathsLocation), new RoutePath(
                getDoubleArray(entry.getValue().get("lat"), pathLocation + "/lat"),
                getDoubleArray(entry.getValue().get("lng"), pathLocation + "/lng")
            ));
        }

        List<Timetable> timetables = new ArrayList<>();
        String timetablesLocation = location + "/" + TIMETABLES;
        for (JsonNode timetableNode : arrayElements(node.get(TIMETABLES), timetablesLocation)) {
            requireObject(timetableNode, timetablesLocation);
            timetables.add(new Timetable(
                getIntField(timetableNode, "TimeTableId", timetablesLocation),
                getIntField(timetableNode, "RouteVarId", timetablesLocation)
            ));
        }

        Map<Integer, List<Trip>> tripsByTimetable = new LinkedHashMap<>();
        String tripsLocation = location + "/" + TRIPS_BY_TIMETABLE;
        for (Map.Entry<String, JsonNode> entry : objectEntries(node.get(TRIPS_BY_TIMETABLE), tripsLocation)) {
            String tripListLocation = tripsLocation + "/" + entry.getKey();
            List<Trip> trips = new ArrayList<>();
            for (JsonNode tripNode : arrayElements(entry.getValue(), tripListLocation)) {
                requireObject(tripNode, tripListLocation);
                trips.add(new Trip(
                    getIntField(tripNode, "TripId", tripListLocation),
                    getRawTimeField(tripNode, "StartTime"),
                    getRawTimeField(tripNode, "EndTime")
                ));
            }
            tripsByTimetable.put(parseIntKey(entry.getKey(), tripsLocation), trips);
        }

        return new RouteRecord(routeKey, route, variants, stopsByVariant, pathsByVariant, timetables, tripsByTimetable);
    }

    /**
     * The route info section is optional. Without a RouteId the route key must itself be an integer, without a
     * RouteNo the key is displayed as the route number.
     */
    private static Route loadRouteInfo (String routeKey, JsonNode node, String location) {
        if (node == null || node.isNull()) {
            return new Route(parseIntKey(routeKey, location), routeKey, null, null);
        }
        requireObject(node, location);
        int routeId = hasValue(node, "RouteId")
            ? getIntField(node, "RouteId", location)
            : parseIntKey(routeKey, location);
        return new Route(
            routeId,
            getStringField(node, "RouteNo", routeKey),
            getStringField(node, "RouteName", null),
            getStringField(node, "Type", null)
        );
    }

    private static boolean hasValue (JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    private static void requireObject (JsonNode node, String location) {
        if (node == null || !node.isObject()) {
            throw new DatasetFormatException(location, "expected a JSON object but found " + describe(node));
        }
    }

    private static Iterable<JsonNode> arrayElements (JsonNode node, String location) {
        if (node == null || node.isNull()) return new ArrayList<>();
        if (!node.isArray()) {
            throw new DatasetFormatException(location, "expected a JSON array but found " + describe(node));
        }
        return node;
    }

    private static List<Map.Entry<String, JsonNode>> objectEntries (JsonNode node, String location) {
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        if (node == null || node.isNull()) return entries;
        requireObject(node, location);
        node.fields().forEachRemaining(entries::add);
        return entries;
    }

    private static int parseIntKey (String key, String location) {
        try {
            return Integer.parseInt(key.trim());
        } catch (NumberFormatException e) {
            throw new DatasetFormatException(location, String.format("key '%s' is not an integer id", key));
        }
    }

    /** Integer ids may appear as JSON numbers or as numeric strings. */
    private static int getIntField (JsonNode node, String field, String location) {
        JsonNode value = node.get(field);
        if (value != null && value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value != null && value.isTextual()) {
            try {
                return Integer.parseInt(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new DatasetFormatException(location,
                    String.format("field %s must be an integer but found %s", field, describe(value)));
            }
        }
        throw new DatasetFormatException(location,
            String.format("field %s must be an integer but found %s", field, describe(value)));
    }

    private static double getDoubleField (JsonNode node, String field, String location) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new DatasetFormatException(location,
                String.format("field %s must be a number but found %s", field, describe(value)));
        }
        return value.doubleValue();
    }

    private static String getStringField (JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return defaultValue;
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /**
     * Time fields are kept exactly as written. A non-string value (a number, a boolean, an array...) is kept as its
     * JSON text, which can never match the H:MM time format since it contains no colon outside of quotes.
     */
    private static String getRawTimeField (JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        return value.isTextual() ? value.textValue() : value.toString();
    }

    private static double[] getDoubleArray (JsonNode node, String location) {
        if (node == null || node.isNull()) return new double[0];
        if (!node.isArray()) {
            throw new DatasetFormatException(location, "expected an array of coordinates but found " + describe(node));
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new DatasetFormatException(location + "/" + i, "coordinate must be a number but found " + describe(value));
            }
            values[i] = value.doubleValue();
        }
        return values;
    }

    private static String describe (JsonNode node) {
        if (node == null || node.isMissingNode()) return "nothing";
        return node.getNodeType().name().toLowerCase() + " " + node;
    }
}
