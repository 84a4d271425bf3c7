package com.conveyal.busevents;

import com.conveyal.busevents.util.json.JsonManager;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Tunable parameters of the projection, export and validation. Defaults reproduce the fixed behavior of a dwell of
 * 30 seconds at every stop with no speed limits. A JSON file may override any field; unknown properties are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_DWELL_SECONDS = 30;
    public static final int DEFAULT_MAX_ISSUE_DETAILS = 100;

    /** Time a vehicle waits at every stop between arrival and departure. */
    public int dwellSeconds = DEFAULT_DWELL_SECONDS;

    /** Dwell time overrides keyed by route type (the operator's service category). */
    public Map<String, Integer> dwellSecondsByRouteType = new HashMap<>();

    /** Only the first N routes of the dataset are exported when set. */
    public Integer routeLimit = null;

    /** When false, the first trip that cannot be projected aborts the export. */
    public boolean skipInvalidTrips = true;

    /** Trips whose average speed would be below this many meters per second are skipped, when set. */
    public Double minAvgSpeedMetersPerSecond = null;

    /** Trips whose average speed would be above this many meters per second are skipped, when set. */
    public Double maxAvgSpeedMetersPerSecond = null;

    /** Maximum number of individual issues listed in a validation report. Counts are never capped. */
    public int maxIssueDetails = DEFAULT_MAX_ISSUE_DETAILS;

    /**
     * @return the dwell time for routes of the given type, falling back on the default dwell time when the type is
     * null or has no override.
     */
    public int dwellSecondsFor (String routeType) {
        if (routeType == null) return dwellSeconds;
        return dwellSecondsByRouteType.getOrDefault(routeType, dwellSeconds);
    }

    /**
     * Check that the values are usable.
     * @throws IllegalArgumentException describing the first bad value.
     */
    public ProjectionConfig validate () {
        if (dwellSeconds < 0) {
            throw new IllegalArgumentException("Dwell time must not be negative: " + dwellSeconds);
        }
        for (Map.Entry<String, Integer> entry : dwellSecondsByRouteType.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException(
                    String.format("Dwell time for route type '%s' must not be negative: %s", entry.getKey(), entry.getValue()));
            }
        }
        if (routeLimit != null && routeLimit <= 0) {
            throw new IllegalArgumentException("Route limit must be positive: " + routeLimit);
        }
        if (minAvgSpeedMetersPerSecond != null && maxAvgSpeedMetersPerSecond != null &&
            minAvgSpeedMetersPerSecond > maxAvgSpeedMetersPerSecond) {
            throw new IllegalArgumentException(String.format("Minimum speed %.2f m/s is above maximum speed %.2f m/s",
                minAvgSpeedMetersPerSecond, maxAvgSpeedMetersPerSecond));
        }
        if (maxIssueDetails < 0) {
            throw new IllegalArgumentException("Maximum issue details must not be negative: " + maxIssueDetails);
        }
        return this;
    }

    /** Read a configuration from a JSON file. Fields absent from the file keep their defaults. */
    public static ProjectionConfig fromFile (File file) throws IOException {
        JsonManager<ProjectionConfig> json = new JsonManager<>(ProjectionConfig.class);
        return json.read(file).validate();
    }

}
