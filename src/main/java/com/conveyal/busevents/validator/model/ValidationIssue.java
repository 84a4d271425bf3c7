package com.conveyal.busevents.validator.model;

import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.error.Priority;

import java.io.Serializable;

/**
 * A problem found with one trip, with the raw time values that triggered it. A trip can have several issues.
 */
public class ValidationIssue implements Serializable {

    private static final long serialVersionUID = 1L;

    public int routeId;
    public String routeNo;
    public int timetableId;
    public int tripId;
    /** Short category text, e.g. "EndTime &lt;= StartTime". */
    public String issue;
    public ErrorType errorType;
    public Priority priority;
    public String startTime;
    public String endTime;

    public ValidationIssue () { }

    public ValidationIssue (int routeId, String routeNo, int timetableId, int tripId, ErrorType errorType,
                            String startTime, String endTime) {
        this.routeId = routeId;
        this.routeNo = routeNo;
        this.timetableId = timetableId;
        this.tripId = tripId;
        this.issue = errorType.label;
        this.errorType = errorType;
        this.priority = errorType.priority;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    @Override
    public String toString () {
        return String.format("Route %s timetable %d trip %d: %s (start=%s, end=%s)",
            routeNo, timetableId, tripId, issue, startTime, endTime);
    }
}
