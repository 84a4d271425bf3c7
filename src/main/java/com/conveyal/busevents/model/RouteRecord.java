package com.conveyal.busevents.model;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything the source dataset holds for a single route key: route metadata, its variants, the stop list and path
 * of each variant, and the timetables and trips that run on those variants. Variant and timetable maps are keyed by
 * the integer ids that appear as string keys in the source.
 */
public class RouteRecord {

    public final String routeKey;
    public final Route route;
    public final List<RouteVariant> variants;
    public final Map<Integer, List<Stop>> stopsByVariant;
    public final Map<Integer, RoutePath> pathsByVariant;
    public final List<Timetable> timetables;
    public final Map<Integer, List<Trip>> tripsByTimetable;

    /** Timetables grouped by the variant they run, in source order. */
    private final ListMultimap<Integer, Timetable> timetablesByVariant = ArrayListMultimap.create();

    public RouteRecord (
        String routeKey,
        Route route,
        List<RouteVariant> variants,
        Map<Integer, List<Stop>> stopsByVariant,
        Map<Integer, RoutePath> pathsByVariant,
        List<Timetable> timetables,
        Map<Integer, List<Trip>> tripsByTimetable
    ) {
        this.routeKey = routeKey;
        this.route = route;
        this.variants = ImmutableList.copyOf(variants);
        this.stopsByVariant = ImmutableMap.copyOf(stopsByVariant);
        this.pathsByVariant = ImmutableMap.copyOf(pathsByVariant);
        this.timetables = ImmutableList.copyOf(timetables);
        this.tripsByTimetable = ImmutableMap.copyOf(tripsByTimetable);
        for (Timetable timetable : timetables) {
            timetablesByVariant.put(timetable.routeVarId, timetable);
        }
    }

    /** @return the variant with the given id, or null if this route has none. */
    public RouteVariant getVariant (int routeVarId) {
        for (RouteVariant variant : variants) {
            if (variant.routeVarId == routeVarId) return variant;
        }
        return null;
    }

    /** @return the ordered stops of a variant, empty if the dataset has none. */
    public List<Stop> getStops (int routeVarId) {
        return stopsByVariant.getOrDefault(routeVarId, Collections.emptyList());
    }

    /** @return the path of a variant, or null if the dataset has none. */
    public RoutePath getPath (int routeVarId) {
        return pathsByVariant.get(routeVarId);
    }

    public List<Timetable> getTimetables (int routeVarId) {
        return Collections.unmodifiableList(timetablesByVariant.get(routeVarId));
    }

    public List<Trip> getTrips (int timetableId) {
        return tripsByTimetable.getOrDefault(timetableId, Collections.emptyList());
    }

    /** @return the number of trips across all timetables of the given variant. */
    public int countTrips (int routeVarId) {
        int count = 0;
        for (Timetable timetable : timetablesByVariant.get(routeVarId)) {
            count += getTrips(timetable.timetableId).size();
        }
        return count;
    }

    @Override
    public String toString () {
        return String.format("%s, key %s", route, routeKey);
    }
}
