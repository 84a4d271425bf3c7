package com.conveyal.busevents.projection;

import com.conveyal.busevents.model.RoutePath;
import com.conveyal.busevents.model.SegmentDistance;
import com.conveyal.busevents.model.Stop;
import com.conveyal.busevents.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures distances between stops along the path of a variant rather than as the crow flies.
 */
public abstract class SegmentDistancer {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentDistancer.class);

    /**
     * Measure the path distance between two stops of a variant. Both stops are projected onto their nearest path
     * vertex and the lengths of the path edges between the two vertices are summed, whichever order the stops come in.
     *
     * The closing leg of a loop is the exception. A circular route's trace is recorded as an open polyline, so when
     * the last stop projects before the second-to-last stop, the vehicle is assumed to continue past the end of the
     * trace and start over from its first point. The distance is then measured from the second-to-last stop to the end
     * of the path plus from the start of the path to the last stop.
     *
     * @param indexA position of stopA in the stop sequence
     * @param indexB position of stopB in the stop sequence
     * @param stopCount number of stops in the sequence
     */
    public static SegmentDistance segmentDistance (
        Stop stopA,
        Stop stopB,
        RoutePath path,
        boolean isLoop,
        int indexA,
        int indexB,
        int stopCount
    ) {
        int ia = PathProjector.nearest(stopA.lat, stopA.lng, path.lats, path.lngs).index;
        int ib = PathProjector.nearest(stopB.lat, stopB.lng, path.lats, path.lngs).index;
        boolean closingLeg = indexA == stopCount - 2 && indexB == stopCount - 1;
        if (isLoop && closingLeg && ib < ia) {
            double meters = GeoUtils.pathLength(path.lats, path.lngs, ia, path.size() - 1) +
                GeoUtils.pathLength(path.lats, path.lngs, 0, ib);
            LOG.debug("Loop wraparound between stop {} and stop {}", indexA, indexB);
            return new SegmentDistance(stopA, stopB, meters, ia, ib, true);
        }
        double meters = GeoUtils.pathLength(path.lats, path.lngs, Math.min(ia, ib), Math.max(ia, ib));
        return new SegmentDistance(stopA, stopB, meters, ia, ib, false);
    }

    /**
     * Measure every leg between consecutive stops of a variant. This is done once per variant and the result shared
     * by all of its trips.
     */
    public static List<SegmentDistance> distancesForVariant (List<Stop> stops, RoutePath path) {
        boolean isLoop = LoopDetector.isLoop(stops);
        List<SegmentDistance> segments = new ArrayList<>(Math.max(0, stops.size() - 1));
        for (int i = 0; i < stops.size() - 1; i++) {
            segments.add(segmentDistance(stops.get(i), stops.get(i + 1), path, isLoop, i, i + 1, stops.size()));
        }
        return segments;
    }

    public static double totalDistance (List<SegmentDistance> segments) {
        double total = 0;
        for (SegmentDistance segment : segments) total += segment.meters;
        return total;
    }
}
