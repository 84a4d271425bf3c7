package com.conveyal.busevents.stats;

/**
 * Which trips of a variant an analysis projects.
 */
public enum ProjectionMode {
    /** Every trip of every timetable bound to the variant. */
    FULL,
    /** Only the first trip of the first timetable, as a quick look at one run. */
    PREVIEW
}
