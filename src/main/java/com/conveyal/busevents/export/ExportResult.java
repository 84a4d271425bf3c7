package com.conveyal.busevents.export;

import com.conveyal.busevents.error.ErrorType;
import com.conveyal.busevents.model.EventNode;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The events generated by a bulk export, in id order, with counts of what was projected and what was skipped so that a
 * partial result is never mistaken for a complete one.
 */
public class ExportResult {

    final List<EventNode> nodes = new ArrayList<>();
    final Multiset<ErrorType> skippedTripReasons = HashMultiset.create();
    final Multiset<ErrorType> skippedVariantReasons = HashMultiset.create();
    int routesProcessed;
    int variantsProcessed;
    int projectedTrips;

    public List<EventNode> getNodes () {
        return Collections.unmodifiableList(nodes);
    }

    public int getNodeCount () {
        return nodes.size();
    }

    /** An export without any events has nothing to write; this is not an error. */
    public boolean isEmpty () {
        return nodes.isEmpty();
    }

    public int getRoutesProcessed () {
        return routesProcessed;
    }

    public int getVariantsProcessed () {
        return variantsProcessed;
    }

    public int getProjectedTrips () {
        return projectedTrips;
    }

    public int getSkippedTrips () {
        return skippedTripReasons.size();
    }

    public int getSkippedVariants () {
        return skippedVariantReasons.size();
    }

    /** How many trips were skipped for the given reason. */
    public int countSkippedTrips (ErrorType reason) {
        return skippedTripReasons.count(reason);
    }

    public int countSkippedVariants (ErrorType reason) {
        return skippedVariantReasons.count(reason);
    }
}
