/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.queuesim.sinks;

import io.nosqlbench.queuesim.events.SimulationEvent;
import io.nosqlbench.queuesim.events.SimulationEventSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/// Streams events to a CSV history log, one row per event, flushed as it goes.
///
/// ```
/// Time,Event,CustomerID,QueueLength,BusyServers
/// 0.00,Arrival,0,1,0
/// 0.00,ServiceStart,0,0,1
/// ```
///
/// Output is best effort. If the file cannot be opened or a write fails, the
/// failure is logged once and the sink stops writing; the simulation carries
/// on unaffected.
public class CsvHistorySink implements SimulationEventSink {
    private static final Logger logger = LogManager.getLogger(CsvHistorySink.class);

    /// The header row of every history log
    public static final String HEADER = "Time,Event,CustomerID,QueueLength,BusyServers";

    private final String description;
    private Writer writer;
    private long rows;

    /// Write history to an already open writer. The header is written at once.
    /// @param writer the destination, closed when this sink closes
    /// @param description how to name the destination in log messages
    public CsvHistorySink(Writer writer, String description) {
        this.description = description;
        this.writer = writer;
        if (writer != null) {
            write(HEADER);
        }
    }

    /// Create or truncate a history file.
    /// @param path where to write the history
    /// @return a sink for the file, which discards events if the file could not be opened
    public static CsvHistorySink open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
            return new CsvHistorySink(out, path.toString());
        } catch (IOException e) {
            logger.warn("unable to create history file {}: {}", path, e.toString());
            return new CsvHistorySink(null, path.toString());
        }
    }

    /// Format one history row.
    /// @param event the event to format
    /// @return the row, without a line terminator
    public static String formatRow(SimulationEvent event) {
        return String.format(Locale.ROOT, "%.2f,%s,%d,%d,%d",
            event.time(), event.type().getLabel(), event.customerId(),
            event.queueLength(), event.busyServers());
    }

    @Override
    public void onEvent(SimulationEvent event) {
        if (writer != null) {
            write(formatRow(event));
            if (writer != null) {
                rows++;
            }
        }
    }

    /// @return true if rows are still being written
    public boolean isWriting() {
        return writer != null;
    }

    /// @return the number of event rows written
    public long getRowCount() {
        return rows;
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            logger.warn("unable to close history file {}: {}", description, e.toString());
        } finally {
            writer = null;
        }
    }

    private void write(String line) {
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            logger.warn("history file {} stopped accepting writes after {} rows: {}",
                description, rows, e.toString());
            close();
        }
    }

    @Override
    public String toString() {
        return "CsvHistorySink[" + description + "]";
    }
}
