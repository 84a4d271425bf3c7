package com.conveyal.busevents.model;

public enum EventType {
    ARRIVAL, DEPARTURE
}
