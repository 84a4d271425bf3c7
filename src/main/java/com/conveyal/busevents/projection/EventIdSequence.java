package com.conveyal.busevents.projection;

/**
 * Hands out dense, strictly increasing event node ids starting at 1. A fresh sequence must be created for every
 * export or analysis; a sequence is not meant to be shared between threads.
 */
public class EventIdSequence {

    private int nextId = 1;

    public int next () {
        return nextId++;
    }

    /** @return the id the next call to {@link #next()} will return. */
    public int peek () {
        return nextId;
    }

    /** @return how many ids have been handed out so far. */
    public int issued () {
        return nextId - 1;
    }
}
