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

import io.nosqlbench.queuesim.engine.SimulationReport;
import io.nosqlbench.queuesim.format.DurationFormat;

import java.io.PrintWriter;
import java.util.Locale;

/// Prints the statistics of a finished run for people to read.
public class ReportPrinter {

    private final PrintWriter out;

    public ReportPrinter(PrintWriter out) {
        this.out = out;
    }

    /// @param report the run to describe
    public void print(SimulationReport report) {
        out.println();
        out.println("Simulation Statistics:");
        out.println("-----------------------------------------------");
        out.println("Outcome: " + describe(report));
        out.println("Total customers processed: " + report.totalCustomers());
        out.println("Customers completed: " + report.completedCustomers());

        if (report.completedCustomers() > 0) {
            out.println("Average waiting time per customer: " + DurationFormat.format(report.averageWaitTime()));
            out.println("Maximum waiting time: " + DurationFormat.format(report.maxWaitTime()));
            out.println("Average service time per customer: " + DurationFormat.format(report.averageServiceTime()));
        }

        if (report.finalTime() > 0.0d) {
            out.println(String.format(Locale.ROOT, "Average queue length (time-weighted): %.0f customers",
                (double) Math.round(report.averageQueueLength())));
            out.println("Maximum queue length: " + report.maxQueueLength() + " customers");
            out.println(String.format(Locale.ROOT, "Average servers busy (time-weighted): %.0f of %d windows",
                (double) Math.round(report.averageBusyServers()), report.numWindows()));
            out.println(String.format(Locale.ROOT, "Server utilization: %.2f%%", report.utilizationPercent()));
            out.println(String.format(Locale.ROOT, "Throughput: %.2f customers/hour", report.throughputPerHour()));
        }

        long unfinished = report.unfinishedCustomers();
        if (unfinished > 0) {
            out.println();
            out.println("Note: " + unfinished + " customers still in system (waiting or being served)");
        }
        out.flush();
    }

    private static String describe(SimulationReport report) {
        switch (report.outcome()) {
            case COMPLETED:
                return "all customers served";
            case TIME_LIMIT:
                return "stopped at time limit T=" + DurationFormat.format(report.finalTime());
            case STALLED:
                return "stopped, no progress possible with customers still in system";
            default:
                return "stopped, no progress possible";
        }
    }
}
