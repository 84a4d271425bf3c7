package com.conveyal.busevents.model;

import java.io.Serializable;

/**
 * One scheduled run of a route variant. Start and end times are kept exactly as they appear in the source dataset
 * (wall-clock "H:MM" or "HH:MM" strings, same service day) so that validation can report the raw values. Either may
 * be null when the source omits it.
 */
public class Trip implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int tripId;
    public final String startTime;
    public final String endTime;

    public Trip (int tripId, String startTime, String endTime) {
        this.tripId = tripId;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    @Override
    public String toString () {
        return String.format("Trip %d %s-%s", tripId, startTime, endTime);
    }
}
