package com.conveyal.busevents.error;

/**
 * How serious a problem is for the consumers of the generated event network.
 */
public enum Priority {
    HIGH, MEDIUM, LOW
}
