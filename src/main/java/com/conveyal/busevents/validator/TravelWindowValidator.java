package com.conveyal.busevents.validator;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.util.TimeUtils;
import com.conveyal.busevents.validator.model.ValidationIssue;

import java.util.List;
import java.util.OptionalInt;

import static com.conveyal.busevents.error.ErrorType.TRAVEL_WINDOW_NOT_POSITIVE;

/**
 * Reports trips whose scheduled duration is too short to dwell at every stop of their variant, which the projection
 * would otherwise skip without a trace in the validation report. Trips with unparseable or out of order times are
 * left to {@link TripTimesValidator}, and trips on variants without a usable stop list are not checked.
 */
public class TravelWindowValidator extends TripValidator {

    private final ProjectionConfig config;

    public TravelWindowValidator (List<ValidationIssue> issueStorage, ProjectionConfig config) {
        super(issueStorage);
        this.config = config;
    }

    @Override
    public void validateTrip (RouteRecord record, Timetable timetable, Trip trip) {
        int stopCount = record.getStops(timetable.routeVarId).size();
        if (stopCount < 2) return;
        OptionalInt start = TimeUtils.parseTime(trip.startTime);
        OptionalInt end = TimeUtils.parseTime(trip.endTime);
        if (!start.isPresent() || !end.isPresent() || end.getAsInt() <= start.getAsInt()) return;
        int totalDwell = (stopCount - 1) * config.dwellSecondsFor(record.route.type);
        if (end.getAsInt() - start.getAsInt() - totalDwell <= 0) {
            registerIssue(record, timetable, trip, TRAVEL_WINDOW_NOT_POSITIVE);
        }
    }
}
