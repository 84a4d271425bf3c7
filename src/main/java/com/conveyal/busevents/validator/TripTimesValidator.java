package com.conveyal.busevents.validator;

import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.util.TimeUtils;
import com.conveyal.busevents.validator.model.ValidationIssue;

import java.util.List;
import java.util.OptionalInt;

import static com.conveyal.busevents.error.ErrorType.END_TIME_INVALID;
import static com.conveyal.busevents.error.ErrorType.END_TIME_NOT_AFTER_START;
import static com.conveyal.busevents.error.ErrorType.START_TIME_INVALID;

/**
 * Checks that both trip times are present, written as H:MM or HH:MM and within the day (hour 0 to 23, minute 0 to
 * 59), and that the trip ends after it starts. Each failed check is a separate issue. Ordering is only checked when
 * both times parse.
 */
public class TripTimesValidator extends TripValidator {

    public TripTimesValidator (List<ValidationIssue> issueStorage) {
        super(issueStorage);
    }

    @Override
    public void validateTrip (RouteRecord record, Timetable timetable, Trip trip) {
        OptionalInt start = TimeUtils.parseTime(trip.startTime);
        OptionalInt end = TimeUtils.parseTime(trip.endTime);
        // A well formed time can still be out of range, e.g. 25:00 or 7:75.
        if (!TimeUtils.isWellFormed(trip.startTime) || !start.isPresent()) {
            registerIssue(record, timetable, trip, START_TIME_INVALID);
        }
        if (!TimeUtils.isWellFormed(trip.endTime) || !end.isPresent()) {
            registerIssue(record, timetable, trip, END_TIME_INVALID);
        }
        if (start.isPresent() && end.isPresent() && end.getAsInt() <= start.getAsInt()) {
            registerIssue(record, timetable, trip, END_TIME_NOT_AFTER_START);
        }
    }
}
