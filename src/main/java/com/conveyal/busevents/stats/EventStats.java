package com.conveyal.busevents.stats;

import com.conveyal.busevents.model.EventNode;
import com.conveyal.busevents.stats.model.RouteStatistic;
import com.conveyal.busevents.stats.model.TripStatistic;
import com.conveyal.busevents.util.TimeUtils;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Summaries computed from a list of generated events, grouped by route or by trip. These work on any event list, an
 * exported node table or the events of a single variant analysis. Groups are reported in order of first appearance.
 */
public abstract class EventStats {

    public static List<RouteStatistic> getRouteStatistics (Collection<EventNode> nodes) {
        ListMultimap<Integer, EventNode> nodesByRoute = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (EventNode node : nodes) nodesByRoute.put(node.routeId, node);

        List<RouteStatistic> statistics = new ArrayList<>();
        for (Integer routeId : nodesByRoute.keySet()) {
            List<EventNode> routeNodes = nodesByRoute.get(routeId);
            RouteStatistic statistic = new RouteStatistic();
            statistic.routeId = routeId;
            statistic.routeNo = routeNodes.get(0).routeNo;
            statistic.totalNodes = routeNodes.size();

            Set<Integer> variants = new HashSet<>();
            Set<Integer> stops = new HashSet<>();
            int first = Integer.MAX_VALUE;
            int last = Integer.MIN_VALUE;
            for (EventNode node : routeNodes) {
                variants.add(node.routeVarId);
                stops.add(node.stopId);
                first = Math.min(first, node.timestamp);
                last = Math.max(last, node.timestamp);
            }
            List<TripStatistic> trips = getTripStatistics(routeNodes);
            double durationSum = 0;
            for (TripStatistic trip : trips) durationSum += trip.duration;

            statistic.totalTrips = trips.size();
            statistic.variants = variants.size();
            statistic.stops = stops.size();
            statistic.avgTripDuration = trips.isEmpty() ? 0 : durationSum / trips.size();
            statistic.firstEventTime = TimeUtils.formatTime(first);
            statistic.lastEventTime = TimeUtils.formatTime(last);
            statistic.serviceSpan = last - first;
            statistics.add(statistic);
        }
        return statistics;
    }

    /**
     * Trips are identified by route, variant and trip id together, since trip ids are only unique within the
     * timetables of one route.
     */
    public static List<TripStatistic> getTripStatistics (Collection<EventNode> nodes) {
        ListMultimap<String, EventNode> nodesByTrip = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (EventNode node : nodes) {
            nodesByTrip.put(String.join(":", Integer.toString(node.routeId), Integer.toString(node.routeVarId),
                Integer.toString(node.tripId)), node);
        }

        List<TripStatistic> statistics = new ArrayList<>();
        for (String key : nodesByTrip.keySet()) {
            List<EventNode> tripNodes = nodesByTrip.get(key);
            EventNode firstNode = tripNodes.get(0);
            Set<Integer> stops = new HashSet<>();
            int first = Integer.MAX_VALUE;
            int last = Integer.MIN_VALUE;
            for (EventNode node : tripNodes) {
                stops.add(node.stopId);
                first = Math.min(first, node.timestamp);
                last = Math.max(last, node.timestamp);
            }
            TripStatistic statistic = new TripStatistic();
            statistic.tripId = firstNode.tripId;
            statistic.routeNo = firstNode.routeNo;
            statistic.routeVarId = firstNode.routeVarId;
            statistic.nodeCount = tripNodes.size();
            statistic.duration = last - first;
            statistic.startTime = TimeUtils.formatTime(first);
            statistic.endTime = TimeUtils.formatTime(last);
            statistic.stopCount = stops.size();
            statistics.add(statistic);
        }
        return statistics;
    }
}
