package com.conveyal.busevents.export;

/**
 * Receives progress of a bulk export, once per processed route.
 */
@FunctionalInterface
public interface ProgressListener {

    void routeProcessed (int routesProcessed, int totalRoutes);

}
