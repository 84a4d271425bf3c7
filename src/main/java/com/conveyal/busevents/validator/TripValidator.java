package com.conveyal.busevents.validator;

import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.validator.model.ValidationIssue;

import java.util.List;

/**
 * A TripValidator examines a single trip in the context of its route and timetable, and accumulates issues for the
 * problems it finds. Validators never change the trips they check.
 */
public abstract class TripValidator {

    private final List<ValidationIssue> issues;

    public TripValidator (List<ValidationIssue> issueStorage) {
        this.issues = issueStorage;
    }

    /**
     * This method will be called on each trip of each timetable of each route in the dataset.
     */
    public abstract void validateTrip (RouteRecord record, Timetable timetable, Trip trip);

    /**
     * Store an issue that affects a single trip.
     */
    public void registerIssue (RouteRecord record, Timetable timetable, Trip trip, ErrorType errorType) {
        issues.add(new ValidationIssue(record.route.routeId, record.route.routeNo, timetable.timetableId,
            trip.tripId, errorType, trip.startTime, trip.endTime));
    }

}
