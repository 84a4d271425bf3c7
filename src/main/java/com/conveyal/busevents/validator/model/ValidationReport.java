package com.conveyal.busevents.validator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An instance of this class is returned by the dataset validator. The summary and issue type counts cover every
 * issue found, while the details list may be capped to keep the report readable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationReport implements Serializable {

    private static final long serialVersionUID = 1L;

    public Summary summary = new Summary();

    /** Number of issues per category label, in order of first occurrence. */
    public Map<String, Integer> issueTypes = new LinkedHashMap<>();

    public List<ValidationIssue> details = new ArrayList<>();

    public static class Summary implements Serializable {
        private static final long serialVersionUID = 1L;
        /** Every trip examined. */
        public int totalTrips;
        /** Trips with at least one issue, each counted once. */
        public int invalidTrips;
        /** Issues across all trips; a trip failing several checks counts several times. */
        public int issueCount;
        /** invalidTrips as a percentage of totalTrips, rounded to two decimals. */
        public double errorRate;
    }

}
