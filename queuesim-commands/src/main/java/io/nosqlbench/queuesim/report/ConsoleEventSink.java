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

package io.nosqlbench.queuesim.report;

import io.nosqlbench.queuesim.events.SimulationEvent;
import io.nosqlbench.queuesim.events.SimulationEventSink;
import io.nosqlbench.queuesim.format.DurationFormat;

import java.io.PrintWriter;
import java.util.Locale;

/// Prints each transition as one row of a fixed-width table.
///
/// ```
///                           Time Event           CustID     Queue      BusyServers
/// -------------------------------------------------------------------------------------------
///                            0ms Arrival         0          1          0/2
///                            0ms ServiceStart    0          0          1/2
///                       1min 30s ServiceEnd      0          0          0/2
/// ```
public class ConsoleEventSink implements SimulationEventSink {

    public static final String RULE = "-".repeat(91);

    private final PrintWriter out;

    /// @param out where rows are printed; flushed after every row
    public ConsoleEventSink(PrintWriter out) {
        this.out = out;
    }

    /// Print the column titles and a rule.
    public void printHeader() {
        out.println(String.format(Locale.ROOT, "%30s %-15s %-10s %-10s BusyServers", "Time", "Event", "CustID", "Queue"));
        out.println(RULE);
        out.flush();
    }

    /// Print a closing rule and the final time.
    /// @param finalTime the end of the run, in seconds
    public void printFooter(double finalTime) {
        out.println(RULE);
        out.println("Simulation finished at T=" + DurationFormat.format(finalTime));
        out.flush();
    }

    @Override
    public void onEvent(SimulationEvent event) {
        out.println(formatRow(event));
        out.flush();
    }

    public static String formatRow(SimulationEvent event) {
        return String.format(Locale.ROOT, "%s %-15s %-10d %-10d %d/%d",
            DurationFormat.formatFixedWidth(event.time()), event.type().getLabel(), event.customerId(),
            event.queueLength(), event.busyServers(), event.numWindows());
    }
}
