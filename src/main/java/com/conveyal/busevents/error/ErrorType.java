package com.conveyal.busevents.error;

/**
 * Every kind of recoverable problem encountered while validating or projecting a dataset. Trip-level types cause a
 * single trip to be skipped, variant-level types cause a whole route variant to be skipped. The label is the short
 * category text that appears in validation reports.
 */
public enum ErrorType {
    // Trip-level problems.
    START_TIME_INVALID(Priority.MEDIUM, "Invalid StartTime", "Trip start time is missing, is not in H:MM or HH:MM format, or is not a valid time of day."),
    END_TIME_INVALID(Priority.MEDIUM, "Invalid EndTime", "Trip end time is missing, is not in H:MM or HH:MM format, or is not a valid time of day."),
    END_TIME_NOT_AFTER_START(Priority.HIGH, "EndTime <= StartTime", "Trip end time is not later than its start time."),
    TRAVEL_WINDOW_NOT_POSITIVE(Priority.HIGH, "Travel window too short", "The scheduled duration leaves no time to travel once dwell time at every stop is subtracted."),
    TRAVEL_TOO_SLOW(Priority.MEDIUM, "Average speed too low", "The average speed needed to keep to the schedule is below the configured minimum."),
    TRAVEL_TOO_FAST(Priority.MEDIUM, "Average speed too high", "The average speed needed to keep to the schedule is above the configured maximum."),

    // Variant-level problems.
    VARIANT_NOT_FOUND(Priority.MEDIUM, "Variant not found", "The route has no variant with this id."),
    VARIANT_MISSING_STOPS(Priority.MEDIUM, "Missing stops", "The route variant has no stop list."),
    VARIANT_TOO_FEW_STOPS(Priority.MEDIUM, "Too few stops", "A route variant needs at least two stops to represent travel."),
    VARIANT_MISSING_PATH(Priority.MEDIUM, "Missing path", "The route variant has no path coordinates."),
    PATH_TOO_SHORT(Priority.MEDIUM, "Path too short", "A path needs at least two points."),
    PATH_COORDINATES_MISMATCH(Priority.HIGH, "Path coordinates mismatch", "The path latitude and longitude arrays differ in length."),
    VARIANT_ZERO_DISTANCE(Priority.MEDIUM, "Zero route distance", "All stops of the route variant project onto the same path point."),
    NO_VALID_TRIPS(Priority.LOW, "No valid trips", "None of the trips of the route variant could be projected.");

    public final Priority priority;
    public final String label;
    public final String englishMessage;

    ErrorType (Priority priority, String label, String englishMessage) {
        this.priority = priority;
        this.label = label;
        this.englishMessage = englishMessage;
    }

}
