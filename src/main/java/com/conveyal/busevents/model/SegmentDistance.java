package com.conveyal.busevents.model;

/**
 * Real distance along the path between two consecutive stops of a variant. Computed once per variant and shared by
 * all of its trips.
 */
public class SegmentDistance {

    public final Stop fromStop;
    public final Stop toStop;
    public final double meters;
    /** Index of the path vertex nearest to the from stop. */
    public final int fromPathIndex;
    /** Index of the path vertex nearest to the to stop. */
    public final int toPathIndex;
    /** True if the distance was measured past the end of the path and back from its start (closing leg of a loop). */
    public final boolean wraparound;

    public SegmentDistance (Stop fromStop, Stop toStop, double meters, int fromPathIndex, int toPathIndex, boolean wraparound) {
        this.fromStop = fromStop;
        this.toStop = toStop;
        this.meters = meters;
        this.fromPathIndex = fromPathIndex;
        this.toPathIndex = toPathIndex;
        this.wraparound = wraparound;
    }

    @Override
    public String toString () {
        return String.format("%s -> %s: %.0fm (path %d-%d%s)", fromStop.name, toStop.name, meters,
            fromPathIndex, toPathIndex, wraparound ? ", wraparound" : "");
    }
}
