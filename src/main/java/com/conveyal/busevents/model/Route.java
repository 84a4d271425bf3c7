package com.conveyal.busevents.model;

import java.io.Serializable;

/**
 * Descriptive metadata of a route. The type is the service category given by the operator (subsidized, express...)
 * and may be null; it selects a per-type dwell time when one is configured.
 */
public class Route implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int routeId;
    public final String routeNo;
    public final String routeName;
    public final String type;

    public Route (int routeId, String routeNo, String routeName, String type) {
        this.routeId = routeId;
        this.routeNo = routeNo;
        this.routeName = routeName;
        this.type = type;
    }

    @Override
    public String toString () {
        return String.format("Route %s (id %d)", routeNo, routeId);
    }
}
