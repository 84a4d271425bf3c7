package com.conveyal.busevents.model;

import java.io.Serializable;

/**
 * One directional version of a route (e.g. outbound or inbound).
 */
public class RouteVariant implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int routeVarId;
    public final String routeVarName;

    public RouteVariant (int routeVarId, String routeVarName) {
        this.routeVarId = routeVarId;
        this.routeVarName = routeVarName;
    }

    @Override
    public String toString () {
        return String.format("Variant %d (%s)", routeVarId, routeVarName);
    }
}
