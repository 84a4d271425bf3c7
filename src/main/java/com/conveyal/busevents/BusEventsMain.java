package com.conveyal.busevents;

import com.conveyal.busevents.export.ExportResult;
import com.conveyal.busevents.export.NodeTableCsvWriter;
import com.conveyal.busevents.export.NodeTableExporter;
import com.conveyal.busevents.loader.DatasetLoader;
import com.conveyal.busevents.model.BusDataset;
import com.conveyal.busevents.model.RouteRecord;
import com.conveyal.busevents.model.SegmentDistance;
import com.conveyal.busevents.stats.ProjectionMode;
import com.conveyal.busevents.stats.VariantAnalysis;
import com.conveyal.busevents.stats.VariantStats;
import com.conveyal.busevents.stats.model.VariantStatistic;
import com.conveyal.busevents.util.json.JsonManager;
import com.conveyal.busevents.validator.DatasetValidator;
import com.conveyal.busevents.validator.model.ValidationReport;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;

public class BusEventsMain {

    private static final Logger LOG = LoggerFactory.getLogger(BusEventsMain.class);

    public static final String DEFAULT_NODE_TABLE = "node_table.csv";

    public static void main (String[] args) throws Exception {
        Options options = getOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);
        String[] arguments = cmd.getArgs();
        if (cmd.hasOption("help")) {
            printHelp(options);
            return;
        }
        if (arguments.length < 1) {
            System.out.println("Please specify a bus dataset to load.");
            System.exit(1);
        }
        ProjectionConfig config = buildConfig(cmd);
        BusDataset dataset = DatasetLoader.load(new File(arguments[0]));
        String output = arguments.length >= 2 ? arguments[1] : null;

        if (cmd.hasOption("validate")) {
            ValidationReport report = new DatasetValidator(config).validate(dataset);
            JsonManager<ValidationReport> json = new JsonManager<>(ValidationReport.class);
            String reportString = json.writePretty(report);
            if (output != null) {
                File reportFile = new File(output);
                FileUtils.writeStringToFile(reportFile, reportString, StandardCharsets.UTF_8);
                LOG.info("Storing validation report at: {}", reportFile.getAbsolutePath());
            } else {
                System.out.print(reportString);
            }
        }
        if (cmd.hasOption("analyze")) {
            analyze(dataset, config, cmd.getOptionValue("analyze"),
                cmd.hasOption("preview") ? ProjectionMode.PREVIEW : ProjectionMode.FULL);
        }
        if (cmd.hasOption("export")) {
            ExportResult result = new NodeTableExporter(config).export(dataset);
            if (result.isEmpty()) {
                LOG.warn("Nothing to export, no file written.");
            } else {
                NodeTableCsvWriter.write(result.getNodes(), new File(output != null ? output : DEFAULT_NODE_TABLE));
            }
        }
    }

    /** Configuration file first, then individual command line overrides. */
    static ProjectionConfig buildConfig (CommandLine cmd) throws Exception {
        ProjectionConfig config = cmd.hasOption("config")
            ? ProjectionConfig.fromFile(new File(cmd.getOptionValue("config")))
            : new ProjectionConfig();
        if (cmd.hasOption("dwell")) config.dwellSeconds = Integer.parseInt(cmd.getOptionValue("dwell"));
        if (cmd.hasOption("routeLimit")) config.routeLimit = Integer.parseInt(cmd.getOptionValue("routeLimit"));
        if (cmd.hasOption("strict")) config.skipInvalidTrips = false;
        return config.validate();
    }

    private static void analyze (BusDataset dataset, ProjectionConfig config, String target, ProjectionMode mode) {
        String[] parts = target.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected ROUTEKEY:VARIANTID but got " + target);
        }
        RouteRecord record = dataset.getRoute(parts[0]);
        if (record == null) {
            throw new IllegalArgumentException("No route with key " + parts[0]);
        }
        VariantAnalysis analysis = new VariantStats(config).analyze(record, Integer.parseInt(parts[1].trim()), mode);
        if (!analysis.isValid()) {
            LOG.warn("Variant {} cannot be analyzed: {}", target, analysis.problem.englishMessage);
            return;
        }
        VariantStatistic statistic = analysis.statistic;
        LOG.info("Stops: {}, distance: {}m, loop: {}", statistic.totalStops, statistic.totalDistance, statistic.loopRoute);
        LOG.info("Average speed: {} km/h, traveling {} min, waiting {} min", statistic.avgSpeed,
            statistic.travelingTime, statistic.totalWaitingTime);
        LOG.info("Valid trips: {}/{}", statistic.validTrips, statistic.totalTrips);
        for (SegmentDistance segment : analysis.getSegments()) {
            LOG.info("  {}", segment);
        }
    }

    private static void printHelp (Options options) {
        final String HELP = String.join("\n",
                "java -jar bus-events.jar [options] INPUT.json [OUTPUT]",
                "Project the scheduled trips of a bus dataset onto their route paths and",
                "synthesize the arrival and departure event of every trip at every stop.",
                "", // blank lines for legibility
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        System.out.println(); // blank line for legibility
        formatter.printHelp(HELP, options);
        System.out.println(); // blank line for legibility
    }

    private static Options getOptions () {
        Options options = new Options();
        options.addOption(new Option("help", false, "print this message"));
        options.addOption(new Option("export", false, "write the event node table as CSV to [OUTPUT] (default " + DEFAULT_NODE_TABLE + ")"));
        options.addOption(new Option("validate", false, "check all trip times (optionally store the report at [OUTPUT])"));
        options.addOption(new Option("analyze", true, "summarize one route variant, given as ROUTEKEY:VARIANTID"));
        options.addOption(new Option("preview", false, "with -analyze, only project the first trip of the first timetable"));
        options.addOption(new Option("config", true, "read projection settings from a JSON file"));
        options.addOption(new Option("dwell", true, "dwell time at every stop in seconds"));
        options.addOption(new Option("routeLimit", true, "only export the first N routes"));
        options.addOption(new Option("strict", false, "abort the export on the first trip that cannot be projected"));
        return options;
    }

}
