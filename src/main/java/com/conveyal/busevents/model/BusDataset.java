package com.conveyal.busevents.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The whole source dataset: route records keyed by route key, in the order they appear in the source file.
 */
public class BusDataset {

    private final Map<String, RouteRecord> routes = new LinkedHashMap<>();

    public void addRoute (RouteRecord record) {
        routes.put(record.routeKey, record);
    }

    public RouteRecord getRoute (String routeKey) {
        return routes.get(routeKey);
    }

    public Collection<RouteRecord> getRoutes () {
        return Collections.unmodifiableCollection(routes.values());
    }

    public int size () {
        return routes.size();
    }

    public int countTrips () {
        int count = 0;
        for (RouteRecord record : routes.values()) {
            for (Timetable timetable : record.timetables) {
                count += record.getTrips(timetable.timetableId).size();
            }
        }
        return count;
    }
}
