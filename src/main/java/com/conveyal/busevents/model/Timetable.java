package com.conveyal.busevents.model;

import java.io.Serializable;

/**
 * A named grouping of trips that all run the same route variant.
 */
public class Timetable implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int timetableId;
    public final int routeVarId;

    public Timetable (int timetableId, int routeVarId) {
        this.timetableId = timetableId;
        this.routeVarId = routeVarId;
    }
}
