package com.conveyal.busevents.export;

import com.conveyal.busevents.model.EventNode;
import com.conveyal.busevents.util.json.JsonManager;
import com.csvreader.CsvWriter;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes event nodes as a flat CSV table, one row per event. Fields containing the delimiter or a quote are quoted,
 * with embedded quotes doubled. The Attributes column holds the attribute tuple as a JSON array.
 */
public class NodeTableCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(NodeTableCsvWriter.class);

    public static final String[] HEADERS = {
        "NodeId", "RouteId", "RouteNo", "RouteVarId", "TripId", "StopId", "Timestamp", "Event", "Time", "StopName", "Attributes"
    };

    /**
     * Write the table to the given writer. The writer is flushed but not closed.
     */
    public static void write (List<EventNode> nodes, Writer writer) throws IOException {
        // don't let CsvWriter close the caller's writer when it is garbage-collected
        Writer protectedWriter = new FilterWriter(writer) {
            @Override
            public void close () throws IOException {
                flush();
            }
        };
        CsvWriter csvWriter = new CsvWriter(protectedWriter, ',');
        csvWriter.setRecordDelimiter('\n');
        csvWriter.writeRecord(HEADERS);
        for (EventNode node : nodes) {
            csvWriter.writeRecord(toRow(node), true);
        }
        csvWriter.flush();
    }

    /** Write the table to a UTF-8 file, creating parent directories as needed. */
    public static void write (List<EventNode> nodes, File file) throws IOException {
        try (Writer writer = new OutputStreamWriter(FileUtils.openOutputStream(file), StandardCharsets.UTF_8)) {
            write(nodes, writer);
        }
        LOG.info("Wrote {} nodes to {} ({})", nodes.size(), file.getAbsolutePath(),
            FileUtils.byteCountToDisplaySize(file.length()));
    }

    static String[] toRow (EventNode node) throws IOException {
        return new String[] {
            Integer.toString(node.nodeId),
            Integer.toString(node.routeId),
            node.routeNo == null ? "" : node.routeNo,
            Integer.toString(node.routeVarId),
            Integer.toString(node.tripId),
            Integer.toString(node.stopId),
            Integer.toString(node.timestamp),
            node.event.name(),
            node.getTime(),
            node.stopName == null ? "" : node.stopName,
            JsonManager.MAPPER.writeValueAsString(node.getAttributes())
        };
    }
}
