package com.conveyal.busevents.validator;

import com.conveyal.busevents.ProjectionConfig;
import com.conveyal.busevents.model.BusDataset;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.Timetable;
import com.conveyal.busevents.model.Trip;
import com.conveyal.busevents.validator.model.ValidationIssue;
import com.conveyal.busevents.validator.model.ValidationReport;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sweeps every trip of every timetable of every route, whether or not its variant can be projected, and runs the trip
 * validators on it. This pass is independent of the projection: it never changes which events are generated.
 */
public class DatasetValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetValidator.class);

    private final ProjectionConfig config;

    public DatasetValidator (ProjectionConfig config) {
        this.config = config;
    }

    public ValidationReport validate (BusDataset dataset) {
        LOG.info("Validating trip times of {} routes", dataset.size());
        List<ValidationIssue> issues = new ArrayList<>();
        List<TripValidator> validators = Lists.newArrayList(
            new TripTimesValidator(issues),
            new TravelWindowValidator(issues, config)
        );

        int totalTrips = 0;
        int invalidTrips = 0;
        for (RouteRecord record : dataset.getRoutes()) {
            for (Timetable timetable : record.timetables) {
                for (Trip trip : record.getTrips(timetable.timetableId)) {
                    totalTrips++;
                    int issuesBefore = issues.size();
                    for (TripValidator validator : validators) {
                        validator.validateTrip(record, timetable, trip);
                    }
                    if (issues.size() > issuesBefore) invalidTrips++;
                }
            }
        }

        ValidationReport report = new ValidationReport();
        report.summary.totalTrips = totalTrips;
        report.summary.invalidTrips = invalidTrips;
        report.summary.issueCount = issues.size();
        report.summary.errorRate = totalTrips == 0 ? 0 : Math.round(invalidTrips * 10000D / totalTrips) / 100D;
        for (ValidationIssue issue : issues) {
            report.issueTypes.merge(issue.issue, 1, Integer::sum);
        }
        report.details.addAll(issues.subList(0, Math.min(issues.size(), config.maxIssueDetails)));

        LOG.info("Total trips: {}", totalTrips);
        LOG.info("Invalid trips: {} ({} issues)", invalidTrips, issues.size());
        LOG.info("Error rate: {}%", String.format("%.2f", report.summary.errorRate));
        return report;
    }
}
